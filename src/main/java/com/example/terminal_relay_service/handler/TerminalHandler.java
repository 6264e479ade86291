package com.example.terminal_relay_service.handler;

import com.example.terminal_relay_service.dto.SessionKey;
import com.example.terminal_relay_service.dto.TerminalKind;
import com.example.terminal_relay_service.dto.ws.ServerMessage;
import com.example.terminal_relay_service.dto.ws.TerminalClientMessage;
import com.example.terminal_relay_service.exception.ProcessSessionException;
import com.example.terminal_relay_service.exception.RelayProtocolException;
import com.example.terminal_relay_service.exception.SessionNotFoundException;
import com.example.terminal_relay_service.pty.ProcessSignal;
import com.example.terminal_relay_service.service.ProcessSessionListener;
import com.example.terminal_relay_service.service.ProcessSessionManager;
import com.example.terminal_relay_service.service.RelayEventLoop;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

@Component
@Slf4j
public class TerminalHandler extends RelayWebSocketHandler<SessionKey> implements ProcessSessionListener {

    public static final String ATTR_SESSION_ID = "sessionId";
    public static final String ATTR_TERMINAL_KIND = "terminalKind";

    private final ProcessSessionManager processSessionManager;

    public TerminalHandler(RelayEventLoop eventLoop,
                           RelayMessageCodec codec,
                           ProcessSessionManager processSessionManager,
                           @Qualifier("relaySendExecutor") Executor sendExecutor,
                           @Value("${relay.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                           @Value("${relay.websocket.send-buffer-limit-bytes:1048576}") int sendBufferLimitBytes) {
        super(RelayConnection.Channel.TERMINAL, eventLoop, codec, sendExecutor, sendTimeLimitMs, sendBufferLimitBytes);
        this.processSessionManager = processSessionManager;
    }

    @PostConstruct
    public void subscribe() {
        processSessionManager.addListener(this);
    }

    @PreDestroy
    public void unsubscribe() {
        processSessionManager.removeListener(this);
    }

    // ============= CONNECTION =============

    @Override
    protected boolean onOpen(RelayConnection connection) {
        String sessionId = attribute(connection, ATTR_SESSION_ID);
        if (sessionId == null) {
            reject(connection, "MISSING_SESSION_ID", "Session ID is required");
            return false;
        }
        String kindParam = attribute(connection, ATTR_TERMINAL_KIND);
        Optional<TerminalKind> kind = kindParam == null
                ? Optional.of(TerminalKind.PRIMARY_AGENT)
                : TerminalKind.fromWire(kindParam);
        if (kind.isEmpty()) {
            reject(connection, "INVALID_TERMINAL_KIND", "Unknown terminal kind: " + kindParam);
            return false;
        }

        SessionKey key = SessionKey.of(sessionId, kind.get());
        connection.setRoomKey(key);
        rooms.join(key, connection);
        log.info("🔌 Terminal viewer {} joined {}", connection.getId(), key);

        // Runs in one loop turn, so no live output can slip in between these frames.
        send(connection, new ServerMessage.ConnectionEstablished(sessionId, key.getTerminalKind()));
        List<String> scrollback = processSessionManager.getScrollback(sessionId, key.getTerminalKind());
        if (!scrollback.isEmpty()) {
            send(connection, new ServerMessage.Scrollback(scrollback));
        }
        send(connection, new ServerMessage.Status(
                processSessionManager.getStatus(sessionId, key.getTerminalKind()),
                processSessionManager.getPid(sessionId, key.getTerminalKind()).orElse(null),
                null, null));
        return true;
    }

    @Override
    protected void onMessage(RelayConnection connection, String payload) {
        SessionKey key = (SessionKey) connection.getRoomKey();
        TerminalClientMessage message = codec.decode(payload, TerminalClientMessage.class);

        if (message instanceof TerminalClientMessage.Input input) {
            handleInput(connection, key, input);
        } else if (message instanceof TerminalClientMessage.Resize resize) {
            processSessionManager.resize(key.getSessionId(), key.getTerminalKind(), resize.getCols(), resize.getRows());
        } else if (message instanceof TerminalClientMessage.Signal signal) {
            ProcessSignal processSignal = ProcessSignal.fromWire(signal.getSignal())
                    .orElseThrow(() -> new RelayProtocolException(RelayProtocolException.INVALID_MESSAGE,
                            "Unknown signal: " + signal.getSignal()));
            processSessionManager.sendSignal(key.getSessionId(), key.getTerminalKind(), processSignal);
        } else if (message instanceof TerminalClientMessage.Ping) {
            send(connection, new ServerMessage.Pong());
        }
    }

    private void handleInput(RelayConnection connection, SessionKey key, TerminalClientMessage.Input input) {
        if (input.getData() == null) {
            throw new RelayProtocolException(RelayProtocolException.INVALID_MESSAGE, "terminal:input requires data");
        }
        if (!processSessionManager.isRunning(key.getSessionId(), key.getTerminalKind())) {
            send(connection, new ServerMessage.SessionError(SessionNotFoundException.CODE, "Session is not running"));
            return;
        }
        try {
            processSessionManager.write(key.getSessionId(), key.getTerminalKind(), input.getData());
        } catch (ProcessSessionException e) {
            log.warn("⚠️ Input to {} failed: {}", key, e.getMessage());
            send(connection, new ServerMessage.SessionError(e.getCode(), e.getMessage()));
        }
    }

    @Override
    protected void onClose(RelayConnection connection) {
        SessionKey key = (SessionKey) connection.getRoomKey();
        if (key != null && rooms.leave(key, connection)) {
            log.info("🧹 Terminal viewer {} left {} (room {})", connection.getId(), key,
                    rooms.hasRoom(key) ? "still active" : "pruned");
        }
    }

    // ============= PROCESS EVENTS (event loop) =============

    @Override
    public void onStarted(SessionKey key, long pid) {
        broadcast(key, ServerMessage.Status.running(pid), null);
    }

    @Override
    public void onOutput(SessionKey key, String data) {
        broadcast(key, new ServerMessage.Output(data, System.currentTimeMillis()), null);
    }

    @Override
    public void onExit(SessionKey key, int exitCode, Integer signal) {
        broadcast(key, ServerMessage.Status.exited(exitCode, signal), null);
    }

    @Override
    public void onError(SessionKey key, Exception error) {
        broadcast(key, new ServerMessage.SessionError("PTY_ERROR", error.getMessage()), null);
    }
}
