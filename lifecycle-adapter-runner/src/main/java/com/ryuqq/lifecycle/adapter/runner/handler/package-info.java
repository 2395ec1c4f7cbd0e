/**
 * 기본 액션 핸들러.
 *
 * <p>action_type마다 하나의 핸들러가 외부 협력자(이벤트 버스, 로그, 스냅샷 저장소,
 * 진단 저장소, 알림, 자원 해제)에 부수 효과를 위임합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.handler.EventActionHandler}</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.handler.LoggingActionHandler}</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.handler.PersistenceActionHandler}</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.handler.DataCaptureActionHandler}</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.handler.AlertActionHandler}</li>
 *   <li>{@link com.ryuqq.lifecycle.adapter.runner.handler.CleanupActionHandler}</li>
 * </ul>
 */
package com.ryuqq.lifecycle.adapter.runner.handler;
