package com.heureca.wppsessions.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReconnectSchedulerTest {

    private ScheduledExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void delayDoublesUpToCeiling() {
        ReconnectScheduler scheduler = new ReconnectScheduler(executor, Duration.ofSeconds(5), Duration.ofMinutes(1), 10);

        assertThat(scheduler.delayFor(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(scheduler.delayFor(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(scheduler.delayFor(4)).isEqualTo(Duration.ofSeconds(40));
        assertThat(scheduler.delayFor(5)).isEqualTo(Duration.ofMinutes(1));
        assertThat(scheduler.delayFor(200)).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void runsTaskAfterDelay() throws Exception {
        ReconnectScheduler scheduler = new ReconnectScheduler(executor, Duration.ofMillis(50), Duration.ofSeconds(1), 3);
        CountDownLatch ran = new CountDownLatch(1);

        assertThat(scheduler.schedule("s1", 1, ran::countDown)).isTrue();
        assertThat(scheduler.isPending("s1")).isTrue();

        assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void refusesAttemptsBeyondBudget() {
        ReconnectScheduler scheduler = new ReconnectScheduler(executor, Duration.ofMillis(50), Duration.ofSeconds(1), 3);

        assertThat(scheduler.schedule("s1", 4, () -> { })).isFalse();
        assertThat(scheduler.isPending("s1")).isFalse();
    }

    @Test
    void zeroMaxAttemptsMeansUnbounded() {
        ReconnectScheduler scheduler = new ReconnectScheduler(executor, Duration.ofSeconds(5), Duration.ofSeconds(5), 0);

        assertThat(scheduler.schedule("s1", 1_000, () -> { })).isTrue();
        scheduler.cancel("s1");
    }

    @Test
    void cancelledTimerNeverFires() throws Exception {
        ReconnectScheduler scheduler = new ReconnectScheduler(executor, Duration.ofMillis(100), Duration.ofSeconds(1), 3);
        AtomicInteger runs = new AtomicInteger();

        scheduler.schedule("s1", 1, runs::incrementAndGet);
        scheduler.cancel("s1");
        Thread.sleep(300);

        assertThat(runs.get()).isZero();
        assertThat(scheduler.isPending("s1")).isFalse();
    }

    @Test
    void newTimerReplacesPendingOne() throws Exception {
        ReconnectScheduler scheduler = new ReconnectScheduler(executor, Duration.ofMillis(100), Duration.ofSeconds(1), 3);
        AtomicInteger first = new AtomicInteger();
        CountDownLatch second = new CountDownLatch(1);

        scheduler.schedule("s1", 1, first::incrementAndGet);
        scheduler.schedule("s1", 1, second::countDown);

        assertThat(second.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(first.get()).isZero();
    }

    @Test
    void failingTaskDoesNotKillScheduler() throws Exception {
        ReconnectScheduler scheduler = new ReconnectScheduler(executor, Duration.ofMillis(10), Duration.ofSeconds(1), 3);
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule("s1", 1, () -> {
            throw new IllegalStateException("boom");
        });
        Thread.sleep(100);
        scheduler.schedule("s2", 1, ran::countDown);

        assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
