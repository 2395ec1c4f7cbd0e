package com.ryuqq.lifecycle.adapter.runner;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InFlightTracker 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InFlightTrackerTest {

    @Test
    void awaitIdle_작업이_없으면_즉시_true() throws InterruptedException {
        assertThat(new InFlightTracker().awaitIdle(0)).isTrue();
    }

    @Test
    void awaitIdle_작업이_끝나지_않으면_제한_시간_후_false() throws InterruptedException {
        InFlightTracker tracker = new InFlightTracker();
        tracker.begin();

        assertThat(tracker.awaitIdle(50)).isFalse();
        assertThat(tracker.inFlight()).isEqualTo(1);
    }

    @Test
    void awaitIdle_다른_스레드가_작업을_끝내면_true() throws InterruptedException {
        InFlightTracker tracker = new InFlightTracker();
        InFlightTracker.Ticket ticket = tracker.begin();

        CompletableFuture.runAsync(ticket::close,
            CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));

        assertThat(tracker.awaitIdle(5_000)).isTrue();
    }

    @Test
    void awaitIdle_매우_긴_제한_시간도_작업이_끝나면_true() throws InterruptedException {
        InFlightTracker tracker = new InFlightTracker();
        InFlightTracker.Ticket ticket = tracker.begin();

        CompletableFuture.runAsync(ticket::close,
            CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));

        assertThat(tracker.awaitIdle(Long.MAX_VALUE)).isTrue();
        assertThat(tracker.inFlight()).isZero();
    }

    @Test
    void ticket_여러_번_닫아도_한_번만_반영() {
        InFlightTracker tracker = new InFlightTracker();
        InFlightTracker.Ticket first = tracker.begin();
        tracker.begin();

        first.close();
        first.close();

        assertThat(tracker.inFlight()).isEqualTo(1);
    }
}
