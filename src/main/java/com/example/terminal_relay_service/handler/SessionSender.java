package com.example.terminal_relay_service.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Writes to one socket in order on the send executor, at most one drain at a time.
 * A peer that stays blocked past the time limit, or lets the buffer fill, is closed with
 * SESSION_NOT_RELIABLE.
 */
@Slf4j
class SessionSender {

    private final WebSocketSession session;
    private final Executor executor;
    private final long sendTimeLimitMs;
    private final long bufferLimitBytes;

    private final Queue<WebSocketMessage<?>> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicLong bufferedBytes = new AtomicLong();
    private final AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile long sendStartedAt;

    SessionSender(WebSocketSession session, Executor executor, long sendTimeLimitMs, long bufferLimitBytes) {
        this.session = session;
        this.executor = executor;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferLimitBytes = bufferLimitBytes;
    }

    void send(WebSocketMessage<?> message) {
        if (closeStatus.get() != null) {
            return;
        }
        int length = message.getPayloadLength();
        if (exceedsLimits(length)) {
            log.warn("⚠️ Connection {} cannot keep up ({} bytes queued), closing", session.getId(), bufferedBytes.get());
            discardPending();
            close(CloseStatus.SESSION_NOT_RELIABLE);
            return;
        }
        bufferedBytes.addAndGet(length);
        queue.add(message);
        schedule();
    }

    /**
     * Closes after everything queued so far has been written.
     */
    void close(CloseStatus status) {
        if (closeStatus.compareAndSet(null, status)) {
            schedule();
        }
    }

    boolean isClosing() {
        return closeStatus.get() != null;
    }

    private boolean exceedsLimits(int length) {
        long started = sendStartedAt;
        if (started != 0 && System.currentTimeMillis() - started > sendTimeLimitMs) {
            return true;
        }
        long queued = bufferedBytes.get();
        return queued > 0 && queued + length > bufferLimitBytes;
    }

    private void schedule() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("⚠️ Send executor rejected connection {}, dropping {} queued frames", session.getId(), queue.size());
            discardPending();
        }
    }

    private void drain() {
        try {
            WebSocketMessage<?> message;
            while ((message = queue.poll()) != null) {
                bufferedBytes.addAndGet(-message.getPayloadLength());
                if (!write(message)) {
                    discardPending();
                    closeStatus.compareAndSet(null, CloseStatus.SESSION_NOT_RELIABLE);
                    break;
                }
            }
            CloseStatus status = closeStatus.get();
            if (status != null && closed.compareAndSet(false, true)) {
                discardPending();
                closeSession(status);
            }
        } finally {
            draining.set(false);
        }
        if (!queue.isEmpty() || (closeStatus.get() != null && !closed.get())) {
            schedule();
        }
    }

    private boolean write(WebSocketMessage<?> message) {
        if (!session.isOpen()) {
            return false;
        }
        sendStartedAt = System.currentTimeMillis();
        try {
            session.sendMessage(message);
            return true;
        } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
            log.debug("Send to {} failed: {}", session.getId(), e.getMessage());
            return false;
        } finally {
            sendStartedAt = 0;
        }
    }

    private void closeSession(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException | IllegalStateException e) {
            log.debug("Error closing {}: {}", session.getId(), e.getMessage());
        }
    }

    private void discardPending() {
        queue.clear();
        bufferedBytes.set(0);
    }
}
