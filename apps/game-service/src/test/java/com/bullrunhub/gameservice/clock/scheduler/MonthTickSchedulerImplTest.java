package com.bullrunhub.gameservice.clock.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MonthTickSchedulerImpl")
class MonthTickSchedulerImplTest {

    private ScheduledThreadPoolExecutor executor;
    private MonthTickSchedulerImpl scheduler;

    @BeforeEach
    void setUp() {
        executor = new ScheduledThreadPoolExecutor(2);
        executor.setRemoveOnCancelPolicy(true);
        scheduler = new MonthTickSchedulerImpl(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("handler is invoked periodically with its key")
    void start_ticksPeriodically() throws Exception {
        CountDownLatch ticks = new CountDownLatch(3);
        AtomicInteger wrongKey = new AtomicInteger();

        scheduler.start("bullrun:R1", 10, key -> {
            if (!"bullrun:R1".equals(key)) {
                wrongKey.incrementAndGet();
            }
            ticks.countDown();
        });

        assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(wrongKey).hasValue(0);
        assertThat(scheduler.isActive("bullrun:R1")).isTrue();
    }

    @Test
    @DisplayName("a throwing handler keeps being scheduled")
    void start_handlerThrows_keepsTicking() throws Exception {
        CountDownLatch ticks = new CountDownLatch(3);

        scheduler.start("k", 10, key -> {
            ticks.countDown();
            throw new IllegalStateException("boom");
        });

        assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("stop cancels the task and forgets the key")
    void stop_cancels() {
        TickHandle handle = scheduler.start("k", 60_000, key -> { });

        scheduler.stop("k");

        assertThat(handle.isCancelled()).isTrue();
        assertThat(scheduler.isActive("k")).isFalse();
        assertThat(scheduler.activeCount()).isZero();
    }

    @Test
    @DisplayName("restarting a key replaces the old task; the old handle cannot cancel the new one")
    void start_sameKey_replaces() {
        TickHandle first = scheduler.start("k", 60_000, key -> { });
        TickHandle second = scheduler.start("k", 60_000, key -> { });

        assertThat(first.isCancelled()).isTrue();
        first.cancel();

        assertThat(second.isCancelled()).isFalse();
        assertThat(scheduler.isActive("k")).isTrue();
        assertThat(scheduler.activeCount()).isEqualTo(1);

        second.cancel();
        assertThat(scheduler.isActive("k")).isFalse();
    }

    @Test
    @DisplayName("non-positive period is rejected")
    void start_invalidPeriod() {
        assertThatThrownBy(() -> scheduler.start("k", 0, key -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
