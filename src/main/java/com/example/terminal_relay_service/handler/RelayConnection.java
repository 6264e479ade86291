package com.example.terminal_relay_service.handler;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.concurrent.Executor;

@Getter
@Setter
public class RelayConnection {

    public enum Channel { TERMINAL, COLLABORATION }

    private final WebSocketSession session;
    private final Channel channel;
    @Getter(AccessLevel.NONE)
    private final SessionSender sender;

    private boolean alive = true;
    // SessionKey for terminal connections, sessionId for collaboration connections
    private Object roomKey;

    // collaboration presence
    private String userId;
    private String userName;
    private String userColor;
    private boolean joined;
    private boolean typing;
    private JsonNode cursor;
    private long lastSeen;

    public RelayConnection(WebSocketSession session, Channel channel, Executor sendExecutor,
                           long sendTimeLimitMs, long sendBufferLimitBytes) {
        this.session = session;
        this.channel = channel;
        this.sender = new SessionSender(session, sendExecutor, sendTimeLimitMs, sendBufferLimitBytes);
        this.lastSeen = System.currentTimeMillis();
    }

    public String getId() {
        return session.getId();
    }

    public boolean isOpen() {
        return session.isOpen() && !sender.isClosing();
    }

    public void send(String payload) {
        send(new TextMessage(payload));
    }

    public void send(TextMessage message) {
        sender.send(message);
    }

    public void ping() {
        sender.send(new PingMessage());
    }

    public void close(CloseStatus status) {
        sender.close(status);
    }
}
