package com.example.terminal_relay_service.controller;

import com.example.terminal_relay_service.dto.SessionConfig;
import com.example.terminal_relay_service.dto.SessionKey;
import com.example.terminal_relay_service.dto.SessionStatusResponse;
import com.example.terminal_relay_service.dto.StartSessionRequest;
import com.example.terminal_relay_service.dto.StopSessionRequest;
import com.example.terminal_relay_service.dto.TerminalKind;
import com.example.terminal_relay_service.service.ProcessSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final ProcessSessionManager processSessionManager;

    @GetMapping
    public ResponseEntity<List<SessionKey>> listRunning() {
        return ResponseEntity.ok(processSessionManager.getRunningSessions());
    }

    // ============= PRIMARY AGENT =============

    @PostMapping("/{sessionId}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String sessionId,
                                                     @RequestBody(required = false) StartSessionRequest request) {
        return doStart(sessionId, TerminalKind.PRIMARY_AGENT, request);
    }

    @PostMapping("/{sessionId}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String sessionId,
                                                    @RequestBody(required = false) StopSessionRequest request) {
        return doStop(sessionId, TerminalKind.PRIMARY_AGENT, request);
    }

    @GetMapping("/{sessionId}/status")
    public ResponseEntity<SessionStatusResponse> status(@PathVariable String sessionId) {
        return doStatus(sessionId, TerminalKind.PRIMARY_AGENT);
    }

    // ============= SHELL / SECONDARY AGENT =============

    @PostMapping("/{sessionId}/{kind}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String sessionId,
                                                     @PathVariable String kind,
                                                     @RequestBody(required = false) StartSessionRequest request) {
        return doStart(sessionId, parseKind(kind), request);
    }

    @PostMapping("/{sessionId}/{kind}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String sessionId,
                                                    @PathVariable String kind,
                                                    @RequestBody(required = false) StopSessionRequest request) {
        return doStop(sessionId, parseKind(kind), request);
    }

    @GetMapping("/{sessionId}/{kind}/status")
    public ResponseEntity<SessionStatusResponse> status(@PathVariable String sessionId, @PathVariable String kind) {
        return doStatus(sessionId, parseKind(kind));
    }

    // ============= HELPERS =============

    private ResponseEntity<Map<String, Object>> doStart(String sessionId, TerminalKind kind, StartSessionRequest request) {
        if (request == null || request.getProjectPath() == null || request.getProjectPath().isBlank()) {
            throw new IllegalArgumentException("projectPath is required");
        }
        SessionConfig config = request.getConfig() != null ? request.getConfig() : new SessionConfig();
        if (request.getUserId() != null) {
            config.setUserId(request.getUserId());
        }

        log.info("🚀 Starting {} for session {} in {}", kind.getId(), sessionId, request.getProjectPath());
        long pid = processSessionManager.start(sessionId, request.getProjectPath(), config, kind);
        return ResponseEntity.ok(Map.of("success", true, "pid", pid));
    }

    private ResponseEntity<Map<String, Object>> doStop(String sessionId, TerminalKind kind, StopSessionRequest request) {
        if (!processSessionManager.isRunning(sessionId, kind)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Session is not running"));
        }
        boolean force = request != null && request.isForce();
        log.info("🛑 Stopping {} for session {} (force={})", kind.getId(), sessionId, force);
        processSessionManager.stop(sessionId, kind, force);
        return ResponseEntity.ok(Map.of("success", true));
    }

    private ResponseEntity<SessionStatusResponse> doStatus(String sessionId, TerminalKind kind) {
        return ResponseEntity.ok(new SessionStatusResponse(
                processSessionManager.isRunning(sessionId, kind),
                processSessionManager.getStatus(sessionId, kind),
                processSessionManager.getPid(sessionId, kind).orElse(null)));
    }

    private static TerminalKind parseKind(String kind) {
        return TerminalKind.fromWire(kind)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown terminal kind: " + kind));
    }
}
