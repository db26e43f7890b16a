package com.ryuqq.registration.adapter.inmemory.loop;

import com.ryuqq.registration.core.spi.LoopTask;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ManualCallerLoop 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ManualCallerLoopTest {

    private final ManualCallerLoop loop = new ManualCallerLoop();

    @Test
    void execute_runPending_호출_전에는_실행되지_않음() {
        // given
        List<String> events = new ArrayList<>();

        // when
        loop.execute(() -> events.add("first"));
        loop.execute(() -> events.add("second"));

        // then
        assertThat(events).isEmpty();
        assertThat(loop.pendingImmediateCount()).isEqualTo(2);
        loop.runPending();
        assertThat(events).containsExactly("first", "second");
        assertThat(loop.ownerThread()).isSameAs(Thread.currentThread());
    }

    @Test
    void scheduleAtFixedRate_주기마다_반복_실행() {
        // given
        AtomicInteger ticks = new AtomicInteger();
        loop.scheduleAtFixedRate(ticks::incrementAndGet, 10);

        // when
        boolean reached = loop.runUntil(() -> ticks.get() >= 3, Duration.ofSeconds(2));

        // then
        assertThat(reached).isTrue();
        assertThat(loop.activePeriodicCount()).isEqualTo(1);
    }

    @Test
    void cancel_이후에는_반복_작업_실행_안_됨() {
        // given
        AtomicInteger ticks = new AtomicInteger();
        LoopTask task = loop.scheduleAtFixedRate(ticks::incrementAndGet, 5);

        // when
        task.cancel();
        loop.runFor(Duration.ofMillis(50));

        // then
        assertThat(task.isCancelled()).isTrue();
        assertThat(ticks.get()).isZero();
        assertThat(loop.activePeriodicCount()).isZero();
    }

    @Test
    void runUntil_조건이_안_되면_false() {
        // when & then
        assertThat(loop.runUntil(() -> false, Duration.ofMillis(30))).isFalse();
    }

    @Test
    void scheduleAtFixedRate_잘못된_주기는_예외() {
        // when & then
        assertThatThrownBy(() -> loop.scheduleAtFixedRate(() -> { }, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be positive");
    }
}
