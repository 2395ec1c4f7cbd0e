/**
 * 런타임 구현: 기한을 강제하는 액션 실행자와 기본 오케스트레이터.
 *
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.TimedActionExecutor}: 액션 종류별 핸들러를 timeout_ms 안에서 실행</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.DefaultLifecycleOrchestrator}: 시작/종료 시퀀스, 치명 오류 전파, drain</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.BackoffCalculator}: Busy 재시도 간격</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.InFlightTracker}: drain 대상 작업 추적</li>
 * </ul>
 */
package com.ryuqq.lifecycle.adapter.runner;
