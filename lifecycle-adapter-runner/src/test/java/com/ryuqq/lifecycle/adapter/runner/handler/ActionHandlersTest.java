package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryDiagnosticStore;
import com.ryuqq.lifecycle.adapter.runner.LifecycleCollaborators;
import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.executor.ActionPhase;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.model.ActionType;
import com.ryuqq.lifecycle.core.model.NodeType;
import com.ryuqq.lifecycle.core.spi.ActionHandler;
import com.ryuqq.lifecycle.core.spi.AlertNotifier;
import com.ryuqq.lifecycle.core.spi.AlertSeverity;
import com.ryuqq.lifecycle.core.spi.ContractSource;
import com.ryuqq.lifecycle.core.spi.DiagnosticStore;
import com.ryuqq.lifecycle.core.spi.EventBus;
import com.ryuqq.lifecycle.core.spi.ResourceReleaser;
import com.ryuqq.lifecycle.core.spi.SnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 기본 액션 핸들러 테스트.
 *
 * <p>각 핸들러가 action_config와 전이 문맥을 협력자 호출로 바꾸는 방식을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ActionHandlersTest {

    @Mock
    private ContractSource contractSource;

    @Mock
    private EventBus eventBus;

    @Mock
    private SnapshotStore snapshotStore;

    @Mock
    private DiagnosticStore diagnosticStore;

    @Mock
    private AlertNotifier alertNotifier;

    @Mock
    private ResourceReleaser resourceReleaser;

    private Map<ActionType, ActionHandler> handlers;

    @BeforeEach
    void setUp() {
        handlers = ActionHandlers.defaults(new LifecycleCollaborators(
            contractSource, eventBus, snapshotStore, diagnosticStore, alertNotifier, resourceReleaser));
    }

    @Test
    void defaults_모든_액션_종류에_핸들러_등록() {
        assertThat(handlers).containsOnlyKeys(ActionType.values());
    }

    @Test
    void event_기본은_관측_토픽에_액션_이름으로_발행() throws Exception {
        // given
        ActionDefinition action = ActionDefinition.of("announce", ActionType.EVENT);

        // when
        handlers.get(ActionType.EVENT).handle(action, context());

        // then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(eventBus).publish(eq("lifecycle.evt.billing.v1"), eq("announce"), payload.capture());
        assertThat(payload.getValue())
            .containsEntry("instance", "billing")
            .containsEntry("to_state", "running")
            .containsEntry("correlation_id", "corr-1");
    }

    @Test
    void event_command_tier는_명령_토픽에_발행() throws Exception {
        // given
        ActionDefinition action = ActionDefinition.of("announce", ActionType.EVENT)
            .withConfig(Map.of("topic_tier", "command", "event_name", "billing.started"));

        // when
        handlers.get(ActionType.EVENT).handle(action, context());

        // then
        verify(eventBus).publish(eq("lifecycle.cmd.billing.v1"), eq("billing.started"), anyMap());
    }

    @Test
    void persistence_key가_없으면_인스턴스_이름으로_저장() throws Exception {
        // given
        ActionDefinition action = ActionDefinition.of("persist", ActionType.PERSISTENCE);

        // when
        handlers.get(ActionType.PERSISTENCE).handle(action, context());

        // then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> snapshot = ArgumentCaptor.forClass(Map.class);
        verify(snapshotStore).save(eq("billing"), snapshot.capture());
        assertThat(snapshot.getValue()).containsEntry("state", "running");
    }

    @Test
    void persistence_설정된_key로_저장() throws Exception {
        ActionDefinition action = ActionDefinition.of("persist", ActionType.PERSISTENCE)
            .withConfig(Map.of("key", "billing-snapshot"));

        handlers.get(ActionType.PERSISTENCE).handle(action, context());

        verify(snapshotStore).save(eq("billing-snapshot"), anyMap());
    }

    @Test
    void data_capture_인스턴스와_도착_상태로_키_생성() {
        ActionDefinition action = ActionDefinition.of("capture", ActionType.DATA_CAPTURE);

        assertThat(DataCaptureActionHandler.keyFor(action, context())).isEqualTo("billing:running");
    }

    @Test
    void data_capture_상관관계_ID가_달라도_같은_상태_진입은_한_번만_기록() throws Exception {
        // given
        InMemoryDiagnosticStore store = new InMemoryDiagnosticStore();
        DataCaptureActionHandler handler = new DataCaptureActionHandler(store);
        ActionDefinition action = ActionDefinition.of("capture", ActionType.DATA_CAPTURE);
        ActionContext first = new ActionContext("billing", NodeType.EFFECT_GENERIC, "fatal_error",
            "running", "error", "corr-1", 3, ActionPhase.ENTRY);
        ActionContext second = new ActionContext("billing", NodeType.EFFECT_GENERIC, "fatal_error",
            "running", "error", "corr-2", 5, ActionPhase.ENTRY);

        // when
        handler.handle(action, first);
        handler.handle(action, second);

        // then
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.find("billing:error")).hasValueSatisfying(diagnostic ->
            assertThat(diagnostic).containsEntry("correlation_id", "corr-1"));
    }

    @Test
    void alert_severity_기본값은_WARNING() throws Exception {
        ActionDefinition action = ActionDefinition.of("page", ActionType.ALERT);

        handlers.get(ActionType.ALERT).handle(action, context());

        verify(alertNotifier).raise(eq(AlertSeverity.WARNING), eq("billing"), anyString(), anyMap());
    }

    @Test
    void alert_설정된_severity와_메시지() throws Exception {
        ActionDefinition action = ActionDefinition.of("page", ActionType.ALERT)
            .withConfig(Map.of("severity", "critical", "message", "billing is down"));

        handlers.get(ActionType.ALERT).handle(action, context());

        verify(alertNotifier).raise(eq(AlertSeverity.CRITICAL), eq("billing"), eq("billing is down"), anyMap());
    }

    @Test
    void alert_알_수_없는_severity는_실패() {
        ActionDefinition action = ActionDefinition.of("page", ActionType.ALERT)
            .withConfig(Map.of("severity", "catastrophic"));

        assertThatThrownBy(() -> handlers.get(ActionType.ALERT).handle(action, context()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cleanup_resource가_없으면_인스턴스_이름을_해제() throws Exception {
        ActionDefinition action = ActionDefinition.of("release", ActionType.CLEANUP);
        when(resourceReleaser.release("billing")).thenReturn(false);

        handlers.get(ActionType.CLEANUP).handle(action, context());

        verify(resourceReleaser).release("billing");
    }

    @Test
    void cleanup_설정된_resource를_해제() throws Exception {
        ActionDefinition action = ActionDefinition.of("release", ActionType.CLEANUP)
            .withConfig(Map.of("resource", "billing.socket"));
        when(resourceReleaser.release("billing.socket")).thenReturn(true);

        handlers.get(ActionType.CLEANUP).handle(action, context());

        verify(resourceReleaser).release("billing.socket");
    }

    @Test
    void logging_알_수_없는_level은_실패() {
        ActionDefinition action = ActionDefinition.of("log", ActionType.LOGGING)
            .withConfig(Map.of("level", "loud"));

        assertThatThrownBy(() -> handlers.get(ActionType.LOGGING).handle(action, context()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("loud");
    }

    @Test
    void logging_설정된_level로_기록() throws Exception {
        ActionDefinition action = ActionDefinition.of("log", ActionType.LOGGING)
            .withConfig(Map.of("level", "warn", "message", "draining"));

        handlers.get(ActionType.LOGGING).handle(action, context());

        assertThat(LoggingActionHandler.parseLevel("warn")).isEqualTo(org.slf4j.event.Level.WARN);
    }

    @Test
    void topicNames_노드_이름은_소문자로_정규화() {
        assertThat(TopicNames.events("Billing")).isEqualTo("lifecycle.evt.billing.v1");
        assertThat(TopicNames.commands(" ledger ")).isEqualTo("lifecycle.cmd.ledger.v1");
    }

    private static ActionContext context() {
        return new ActionContext("billing", NodeType.EFFECT_GENERIC, "start", "idle", "running",
            "corr-1", 3, ActionPhase.ENTRY);
    }
}
