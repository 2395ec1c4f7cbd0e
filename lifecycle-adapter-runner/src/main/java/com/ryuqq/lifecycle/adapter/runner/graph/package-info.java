/**
 * 노드 그래프 의존성 해석과 이벤트 버스 구독 연결.
 */
package com.ryuqq.lifecycle.adapter.runner.graph;
