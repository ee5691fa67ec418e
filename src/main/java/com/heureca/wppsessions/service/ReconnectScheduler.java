package com.heureca.wppsessions.service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Delayed, cancellable reconnect timers, at most one pending per session id.
 * Delays grow exponentially from the initial delay up to the configured ceiling.
 */
@Component
public class ReconnectScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ReconnectScheduler.class);

    private final ScheduledExecutorService scheduler;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public ReconnectScheduler(
            @Qualifier("sessionScheduler") ScheduledExecutorService scheduler,
            @Value("${sessions.reconnect.initial-delay:5s}") Duration initialDelay,
            @Value("${sessions.reconnect.max-delay:5m}") Duration maxDelay,
            @Value("${sessions.reconnect.max-attempts:10}") int maxAttempts) {
        this.scheduler = scheduler;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param attempt 1-based attempt number since the session was last READY
     * @return false when the attempt budget is exhausted and nothing was scheduled
     */
    public boolean schedule(String sessionId, int attempt, Runnable reconnect) {
        if (maxAttempts > 0 && attempt > maxAttempts) {
            logger.error("RECONNECT GIVING UP | session={} | attempts={}", sessionId, maxAttempts);
            return false;
        }

        Duration delay = delayFor(attempt);
        ScheduledFuture<?> future = scheduler.schedule(
                () -> run(sessionId, reconnect),
                delay.toMillis(),
                TimeUnit.MILLISECONDS);

        ScheduledFuture<?> previous = pending.put(sessionId, future);
        if (previous != null) {
            previous.cancel(false);
        }

        logger.info("RECONNECT SCHEDULED | session={} | attempt={} | delayMs={}", sessionId, attempt, delay.toMillis());
        return true;
    }

    Duration delayFor(int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long millis = initialDelay.toMillis() << shift;
        if (millis <= 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    public boolean isPending(String sessionId) {
        ScheduledFuture<?> future = pending.get(sessionId);
        return future != null && !future.isDone();
    }

    public void cancel(String sessionId) {
        ScheduledFuture<?> future = pending.remove(sessionId);
        if (future != null && future.cancel(false)) {
            logger.info("RECONNECT CANCELLED | session={}", sessionId);
        }
    }

    public void cancelAll() {
        pending.keySet().forEach(this::cancel);
    }

    private void run(String sessionId, Runnable reconnect) {
        pending.remove(sessionId);
        try {
            reconnect.run();
        } catch (RuntimeException e) {
            logger.error("RECONNECT FAILED | session={}", sessionId, e);
        }
    }
}
