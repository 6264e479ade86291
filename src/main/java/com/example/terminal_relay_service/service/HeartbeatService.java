package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.handler.CollaborationHandler;
import com.example.terminal_relay_service.handler.RelayConnection;
import com.example.terminal_relay_service.handler.RelayWebSocketHandler;
import com.example.terminal_relay_service.handler.TerminalHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

@Service
@Slf4j
public class HeartbeatService {

    private final TerminalHandler terminalHandler;
    private final CollaborationHandler collaborationHandler;
    private final RelayEventLoop eventLoop;
    private final TaskScheduler taskScheduler;
    private final Duration interval;

    private ScheduledFuture<?> sweepTask;

    public HeartbeatService(TerminalHandler terminalHandler,
                            CollaborationHandler collaborationHandler,
                            RelayEventLoop eventLoop,
                            @Qualifier("relayTaskScheduler") TaskScheduler taskScheduler,
                            @Value("${relay.websocket.heartbeat-interval:30s}") Duration interval) {
        this.terminalHandler = terminalHandler;
        this.collaborationHandler = collaborationHandler;
        this.eventLoop = eventLoop;
        this.taskScheduler = taskScheduler;
        this.interval = interval;
    }

    public synchronized void start() {
        if (sweepTask != null) {
            return;
        }
        sweepTask = taskScheduler.scheduleAtFixedRate(() -> eventLoop.execute(this::sweep), interval);
        log.info("💓 Heartbeat sweep every {}", interval);
    }

    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
    }

    // event loop only
    void sweep() {
        int dropped = sweep(terminalHandler) + sweep(collaborationHandler);
        if (dropped > 0) {
            log.info("💔 Heartbeat sweep dropped {} unresponsive connection(s)", dropped);
        }
    }

    private int sweep(RelayWebSocketHandler<?> handler) {
        List<RelayConnection> connections = handler.connections();
        int dropped = 0;
        for (RelayConnection connection : connections) {
            if (!connection.isAlive()) {
                handler.terminate(connection);
                dropped++;
            } else {
                connection.setAlive(false);
                connection.ping();
            }
        }
        return dropped;
    }
}
