package com.heureca.wppsessions.config;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class SessionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(
            RestTemplateBuilder builder,
            @Value("${wpp.connect-timeout:5s}") Duration connectTimeout,
            @Value("${wpp.read-timeout:60s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    /**
     * Reconnect timers.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService sessionScheduler() {
        return Executors.newSingleThreadScheduledExecutor(named("session-scheduler"));
    }

    /**
     * Blocking calls to the WPPConnect server, off the request threads.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerExecutor() {
        return Executors.newCachedThreadPool(named("wpp-provider"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
