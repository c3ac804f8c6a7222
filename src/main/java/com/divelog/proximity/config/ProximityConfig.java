package com.divelog.proximity.config;

import com.divelog.proximity.service.ProximityMailbox;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Execution contexts and time source for the proximity engine.
 *
 * Threading model:
 * - One mailbox thread owns all scheduler, session, permission and health state
 * - Candidate-site queries run on a small separate pool and re-enter the mailbox
 *   with their result, so a slow database never blocks the mailbox
 * - Trailing region cycles are timed on a one-thread scheduler and re-enter the mailbox
 * - Reminders fire on their own scheduler, separate from the STOMP broker's
 */
@Configuration
@EnableConfigurationProperties(ProximityProperties.class)
public class ProximityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public ProximityMailbox proximityMailbox() {
        return ProximityMailbox.singleThreaded("proximity-mailbox");
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService candidateQueryExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "candidate-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ThreadPoolTaskScheduler regionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("region-refresh-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskScheduler reminderTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("reminder-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
