package com.divelog.proximity.service;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Serialized execution context for the proximity engine.
 *
 * Every mutation of region, session, permission and health state happens in a
 * task run by this mailbox. Tasks run one at a time in submission order; a task
 * submitted from inside a running task is queued behind it and never runs
 * re-entrantly.
 *
 * The underlying executor only provides a thread to drain on. In production it
 * is a single named thread; tests pass {@code Runnable::run} to drain on the
 * submitting thread and get deterministic, synchronous execution.
 */
@Slf4j
public class ProximityMailbox implements Executor, AutoCloseable {

    private final Executor executor;
    private final ExecutorService ownedExecutor;

    // Guarded by this
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;

    public ProximityMailbox(Executor executor) {
        this(executor, null);
    }

    private ProximityMailbox(Executor executor, ExecutorService ownedExecutor) {
        this.executor = executor;
        this.ownedExecutor = ownedExecutor;
    }

    public static ProximityMailbox singleThreaded(String threadName) {
        ExecutorService service = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
        return new ProximityMailbox(service, service);
    }

    @Override
    public void execute(Runnable task) {
        synchronized (this) {
            if (closed) {
                log.debug("Mailbox closed, dropping task");
                return;
            }
            tasks.add(task);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                draining = false;
            }
            log.warn("Mailbox executor rejected drain, {} tasks left queued", pendingTasks());
            throw e;
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = tasks.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                log.error("Proximity mailbox task failed", e);
            }
        }
    }

    public synchronized int pendingTasks() {
        return tasks.size();
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
            tasks.clear();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
