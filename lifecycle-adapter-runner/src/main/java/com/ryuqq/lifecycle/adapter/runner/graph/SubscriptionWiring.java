package com.ryuqq.lifecycle.adapter.runner.graph;

import com.ryuqq.lifecycle.adapter.runner.handler.TopicNames;
import com.ryuqq.lifecycle.core.spi.EventBus;
import com.ryuqq.lifecycle.core.spi.Subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 노드별 명령 토픽 구독 묶음.
 *
 * <p>{@link #wire(NodeGraph, EventBus)}는 위상 순서대로 각 노드를 자신의 명령 토픽에
 * 구독시킵니다. 중간에 실패하면 이미 만든 구독을 닫고 예외를 전파합니다.</p>
 *
 * <p>{@link #close()}는 모든 구독을 역순으로 닫으며, 여러 번 호출해도 안전합니다.
 * 오케스트레이터는 이 객체를 자원 해제기에 등록하여 cleanup 액션이 해제하도록 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SubscriptionWiring implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionWiring.class);

    private final List<Subscription> subscriptions;

    private SubscriptionWiring(List<Subscription> subscriptions) {
        this.subscriptions = List.copyOf(subscriptions);
    }

    /**
     * 구독 연결.
     *
     * @param graph 해석된 노드 그래프
     * @param eventBus 이벤트 버스
     * @return 연결된 구독 묶음
     * @throws RuntimeException 이벤트 버스 구독 실패 시 (이미 만든 구독은 닫힘)
     */
    public static SubscriptionWiring wire(NodeGraph graph, EventBus eventBus) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }

        List<Subscription> created = new ArrayList<>();
        try {
            for (String node : graph.nodeNames()) {
                created.add(eventBus.subscribe(TopicNames.commands(node), node));
            }
        } catch (RuntimeException e) {
            new SubscriptionWiring(created).close();
            throw e;
        }
        log.info("Wired {} node subscriptions", created.size());
        return new SubscriptionWiring(created);
    }

    public List<Subscription> subscriptions() {
        return subscriptions;
    }

    @Override
    public void close() {
        for (int i = subscriptions.size() - 1; i >= 0; i--) {
            Subscription subscription = subscriptions.get(i);
            if (subscription.isActive()) {
                subscription.close();
                log.debug("Closed subscription {} on {}", subscription.subscriberId(), subscription.topic());
            }
        }
    }
}
