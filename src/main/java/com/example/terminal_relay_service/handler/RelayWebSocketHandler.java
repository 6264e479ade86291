package com.example.terminal_relay_service.handler;

import com.example.terminal_relay_service.dto.ws.ServerMessage;
import com.example.terminal_relay_service.exception.RelayProtocolException;
import com.example.terminal_relay_service.service.RelayEventLoop;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

@Slf4j
public abstract class RelayWebSocketHandler<K> extends TextWebSocketHandler {

    protected final RelayEventLoop eventLoop;
    protected final RelayMessageCodec codec;
    protected final RoomRegistry<K> rooms = new RoomRegistry<>();

    private final RelayConnection.Channel channel;
    private final Executor sendExecutor;
    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;
    private final Map<String, RelayConnection> connections = new LinkedHashMap<>();

    protected RelayWebSocketHandler(RelayConnection.Channel channel, RelayEventLoop eventLoop, RelayMessageCodec codec,
                                    Executor sendExecutor, int sendTimeLimitMs, int sendBufferLimitBytes) {
        this.channel = channel;
        this.sendExecutor = sendExecutor;
        this.eventLoop = eventLoop;
        this.codec = codec;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferLimitBytes = sendBufferLimitBytes;
    }

    // ============= WEBSOCKET LIFECYCLE =============

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        RelayConnection connection = new RelayConnection(
                session, channel, sendExecutor, sendTimeLimitMs, sendBufferLimitBytes);
        eventLoop.execute(() -> {
            if (onOpen(connection)) {
                connections.put(connection.getId(), connection);
            }
        });
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String payload = message.getPayload();
        eventLoop.execute(() -> {
            RelayConnection connection = connections.get(session.getId());
            if (connection == null) {
                return;
            }
            try {
                onMessage(connection, payload);
            } catch (RelayProtocolException e) {
                log.debug("Rejected frame from {}: {}", connection.getId(), e.getMessage());
                sendError(connection, e.getCode(), e.getMessage());
            }
        });
    }

    @Override
    protected void handlePongMessage(WebSocketSession session, PongMessage message) {
        eventLoop.execute(() -> {
            RelayConnection connection = connections.get(session.getId());
            if (connection != null) {
                connection.setAlive(true);
            }
        });
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("🔌 {} connection {} closed: {}", channel, session.getId(), status);
        eventLoop.execute(() -> remove(session.getId()));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("🚨 Transport error on {} connection {}: {}", channel, session.getId(), exception.getMessage());
        eventLoop.execute(() -> remove(session.getId()));
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.SERVER_ERROR);
            }
        } catch (Exception e) {
            log.debug("Error closing session after transport error: {}", e.getMessage());
        }
    }

    // ============= CHANNEL HOOKS (event loop) =============

    // false if the connection was rejected and closed
    protected abstract boolean onOpen(RelayConnection connection);

    protected abstract void onMessage(RelayConnection connection, String payload);

    protected abstract void onClose(RelayConnection connection);

    // ============= EVENT-LOOP OPERATIONS =============

    public List<RelayConnection> connections() {
        return new ArrayList<>(connections.values());
    }

    public void terminate(RelayConnection connection) {
        log.warn("⚠️ Terminating unresponsive {} connection {}", channel, connection.getId());
        connection.close(CloseStatus.SESSION_NOT_RELIABLE);
        remove(connection.getId());
    }

    public void closeAll(CloseStatus status) {
        List<RelayConnection> open = connections();
        connections.clear();
        open.forEach(connection -> connection.close(status));
        rooms.clear();
        log.info("🧹 Closed {} {} connections", open.size(), channel);
    }

    public int getConnectionCount() {
        return eventLoop.call(connections::size);
    }

    public int getRoomCount() {
        return eventLoop.call(rooms::roomCount);
    }

    // ============= HELPERS =============

    protected void send(RelayConnection connection, ServerMessage message) {
        connection.send(codec.encode(message));
    }

    protected void sendError(RelayConnection connection, String code, String message) {
        send(connection, new ServerMessage.ProtocolError(code, message));
    }

    protected void broadcast(K roomKey, ServerMessage message, RelayConnection exclude) {
        List<RelayConnection> members = rooms.members(roomKey);
        if (members.isEmpty()) {
            return;
        }
        TextMessage payload = new TextMessage(codec.encode(message));
        for (RelayConnection member : members) {
            if (member != exclude) {
                member.send(payload);
            }
        }
    }

    protected void reject(RelayConnection connection, String code, String message) {
        log.warn("❌ Rejecting {} connection {}: {}", channel, connection.getId(), message);
        sendError(connection, code, message);
        connection.close(CloseStatus.POLICY_VIOLATION);
    }

    protected static String attribute(RelayConnection connection, String name) {
        Object value = connection.getSession().getAttributes().get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private void remove(String connectionId) {
        RelayConnection connection = connections.remove(connectionId);
        if (connection != null) {
            onClose(connection);
        }
    }
}
