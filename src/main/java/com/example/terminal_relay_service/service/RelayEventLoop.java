package com.example.terminal_relay_service.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single thread that owns the process registry and the room tables.
 *
 * <p>PTY reader threads, exit monitors, timers and WebSocket container threads never touch
 * that state directly; they post tasks here. A task runs to completion before the next
 * one starts, so no further locking is needed.
 */
@Component
@Slf4j
public class RelayEventLoop {

    private final ExecutorService executor;
    private volatile Thread loopThread;

    public RelayEventLoop() {
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "relay-event-loop");
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
    }

    public boolean inEventLoop() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Queues a task without waiting. Tasks posted after shutdown are dropped.
     */
    public void execute(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("❌ Event loop task failed: {}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Event loop stopped, dropping task");
        }
    }

    /**
     * Runs the task on the loop and waits for its result. Exceptions thrown by the task
     * are rethrown to the caller unchanged.
     */
    public <T> T call(Supplier<T> task) {
        if (inEventLoop()) {
            return task.get();
        }
        Future<T> future;
        try {
            future = executor.submit(task::get);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Relay event loop is shut down", e);
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for event loop", e);
        }
    }

    public void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("⚠️ Event loop did not drain in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
