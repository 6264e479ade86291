package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.dto.SessionKey;
import com.example.terminal_relay_service.dto.SessionStatus;
import com.example.terminal_relay_service.pty.PtyProcessController;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

@Getter
@Setter
@Builder
public class SessionHandle {
    private final SessionKey key;
    private final PtyProcessController controller;
    private final long pid;
    private final Path workDir;
    private final ScrollbackBuffer scrollback;
    private final LocalDateTime startedAt;

    /** Completes when the output pump hits end of stream. */
    @Builder.Default
    private final CompletableFuture<Void> outputDrained = new CompletableFuture<>();

    private int cols;
    private int rows;
    private SessionStatus status;
    private LocalDateTime lastActivityAt;
    private ScheduledFuture<?> escalation;

    public void updateActivity() {
        this.lastActivityAt = LocalDateTime.now();
    }

    public void cancelEscalation() {
        if (escalation != null) {
            escalation.cancel(false);
            escalation = null;
        }
    }
}
