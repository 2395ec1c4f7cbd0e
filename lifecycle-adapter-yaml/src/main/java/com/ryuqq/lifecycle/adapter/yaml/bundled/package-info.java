/**
 * 내장 라이프사이클 계약.
 *
 * <p>오케스트레이터가 직접 구동하는 contract_loader, contract_registry, node_graph 인스턴스의
 * 계약을 YAML 리소스로 제공합니다.</p>
 */
package com.ryuqq.lifecycle.adapter.yaml.bundled;
