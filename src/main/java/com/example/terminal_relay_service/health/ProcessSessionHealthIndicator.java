package com.example.terminal_relay_service.health;

import com.example.terminal_relay_service.handler.CollaborationHandler;
import com.example.terminal_relay_service.handler.TerminalHandler;
import com.example.terminal_relay_service.service.ProcessSessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ProcessSessionHealthIndicator implements HealthIndicator {

    private final ProcessSessionManager processSessionManager;
    private final TerminalHandler terminalHandler;
    private final CollaborationHandler collaborationHandler;

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        try {
            details.put("runningProcesses", processSessionManager.getRunningCount());
            details.put("terminalConnections", terminalHandler.getConnectionCount());
            details.put("terminalRooms", terminalHandler.getRoomCount());
            details.put("collaborationConnections", collaborationHandler.getConnectionCount());
            return Health.up().withDetails(details).build();
        } catch (IllegalStateException e) {
            // event loop already shut down
            return Health.down(e).withDetails(details).build();
        }
    }
}
