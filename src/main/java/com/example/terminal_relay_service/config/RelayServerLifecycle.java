package com.example.terminal_relay_service.config;

import com.example.terminal_relay_service.handler.CollaborationHandler;
import com.example.terminal_relay_service.handler.TerminalHandler;
import com.example.terminal_relay_service.service.HeartbeatService;
import com.example.terminal_relay_service.service.RelayEventLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

/**
 * Starts the liveness sweep with the context and, on shutdown, closes every relay
 * connection before the embedded web server stops. Processes are force-stopped later,
 * in {@code ProcessSessionManager#shutdownAll}, once the destroy callbacks run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelayServerLifecycle implements SmartLifecycle {

    private final HeartbeatService heartbeatService;
    private final TerminalHandler terminalHandler;
    private final CollaborationHandler collaborationHandler;
    private final RelayEventLoop eventLoop;

    private volatile boolean running;

    @Override
    public void start() {
        heartbeatService.start();
        running = true;
        log.info("🚀 Relay server started");
    }

    @Override
    public void stop() {
        log.info("🛑 Relay server shutting down");
        heartbeatService.stop();
        eventLoop.run(() -> {
            terminalHandler.closeAll(CloseStatus.GOING_AWAY);
            collaborationHandler.closeAll(CloseStatus.GOING_AWAY);
        });
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // Highest phase stops first, ahead of the web server's graceful shutdown.
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
