/**
 * 계약 문서 캐시.
 *
 * <p>파일 기반 계약 소스가 변경되지 않은 문서를 반복해서 파싱하지 않도록 합니다.</p>
 */
package com.ryuqq.lifecycle.adapter.yaml.cache;
