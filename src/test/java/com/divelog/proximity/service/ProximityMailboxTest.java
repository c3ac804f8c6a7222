package com.divelog.proximity.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProximityMailboxTest {

    @Test
    void shouldRunTasksInSubmissionOrder() {
        ProximityMailbox mailbox = new ProximityMailbox(Runnable::run);
        List<String> log = new ArrayList<>();

        mailbox.execute(() -> log.add("a"));
        mailbox.execute(() -> log.add("b"));

        assertThat(log).containsExactly("a", "b");
    }

    @Test
    void shouldQueueNestedTaskBehindRunningOne() {
        ProximityMailbox mailbox = new ProximityMailbox(Runnable::run);
        List<String> log = new ArrayList<>();

        mailbox.execute(() -> {
            log.add("outer-start");
            mailbox.execute(() -> log.add("inner"));
            log.add("outer-end");
        });

        assertThat(log).containsExactly("outer-start", "outer-end", "inner");
        assertThat(mailbox.pendingTasks()).isZero();
    }

    @Test
    void shouldKeepDrainingAfterFailingTask() {
        ProximityMailbox mailbox = new ProximityMailbox(Runnable::run);
        List<String> log = new ArrayList<>();

        mailbox.execute(() -> {
            mailbox.execute(() -> log.add("after"));
            throw new IllegalStateException("boom");
        });

        assertThat(log).containsExactly("after");
    }

    @Test
    void shouldRunOnNamedThreadAndStopWhenClosed() throws InterruptedException {
        ProximityMailbox mailbox = ProximityMailbox.singleThreaded("proximity-test");
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        mailbox.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).isEqualTo("proximity-test");

        mailbox.close();
        List<String> log = new ArrayList<>();
        mailbox.execute(() -> log.add("late"));
        assertThat(log).isEmpty();
        assertThat(mailbox.pendingTasks()).isZero();
    }

    @Test
    void shouldDrainAgainAfterExecutorRejectedOnce() {
        AtomicBoolean reject = new AtomicBoolean(true);
        Executor flaky = runnable -> {
            if (reject.getAndSet(false)) {
                throw new RejectedExecutionException("executor shutting down");
            }
            runnable.run();
        };
        ProximityMailbox mailbox = new ProximityMailbox(flaky);
        List<String> log = new ArrayList<>();

        assertThatThrownBy(() -> mailbox.execute(() -> log.add("first")))
            .isInstanceOf(RejectedExecutionException.class);
        mailbox.execute(() -> log.add("second"));

        assertThat(log).containsExactly("first", "second");
        assertThat(mailbox.pendingTasks()).isZero();
    }
}
