package com.example.terminal_relay_service.handler;

import com.example.terminal_relay_service.dto.ws.CollabClientMessage;
import com.example.terminal_relay_service.dto.ws.ServerMessage;
import com.example.terminal_relay_service.service.RelayEventLoop;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

@Component
@Slf4j
public class CollaborationHandler extends RelayWebSocketHandler<String> {

    public static final String ATTR_SESSION_ID = "sessionId";
    public static final String ATTR_USER_ID = "userId";

    private static final String DEFAULT_COLOR = "#7aa2f7";

    public CollaborationHandler(RelayEventLoop eventLoop,
                                RelayMessageCodec codec,
                                @Qualifier("relaySendExecutor") Executor sendExecutor,
                                @Value("${relay.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                @Value("${relay.websocket.send-buffer-limit-bytes:1048576}") int sendBufferLimitBytes) {
        super(RelayConnection.Channel.COLLABORATION, eventLoop, codec, sendExecutor, sendTimeLimitMs, sendBufferLimitBytes);
    }

    @Override
    protected boolean onOpen(RelayConnection connection) {
        String sessionId = attribute(connection, ATTR_SESSION_ID);
        String userId = attribute(connection, ATTR_USER_ID);
        if (sessionId == null || userId == null) {
            reject(connection, "MISSING_PARAMETER", "sessionId and userId are required");
            return false;
        }
        connection.setRoomKey(sessionId);
        connection.setUserId(userId);
        rooms.join(sessionId, connection);
        log.info("👥 Collaborator {} connected to session {}", userId, sessionId);
        return true;
    }

    @Override
    protected void onMessage(RelayConnection connection, String payload) {
        String sessionId = (String) connection.getRoomKey();
        CollabClientMessage message = codec.decode(payload, CollabClientMessage.class);
        connection.setLastSeen(System.currentTimeMillis());

        if (message instanceof CollabClientMessage.Join join) {
            connection.setUserName(join.getUserName() != null ? join.getUserName() : connection.getUserId());
            connection.setUserColor(join.getUserColor() != null ? join.getUserColor() : DEFAULT_COLOR);
            connection.setJoined(true);
            log.info("👥 {} joined collaboration on {} as {}", connection.getUserId(), sessionId, connection.getUserName());
            broadcastPresence(sessionId);
        } else if (message instanceof CollabClientMessage.Chat chat) {
            broadcast(sessionId, new ServerMessage.Chat(connection.getUserId(), chat.getMessage()), connection);
        } else if (message instanceof CollabClientMessage.Cursor cursor) {
            connection.setCursor(cursor.getCursor());
            broadcast(sessionId, new ServerMessage.Cursor(connection.getUserId(), cursor.getCursor()), connection);
        } else if (message instanceof CollabClientMessage.Typing typing) {
            connection.setTyping(typing.isTyping());
            broadcast(sessionId, new ServerMessage.Typing(connection.getUserId(), typing.isTyping()), connection);
        } else if (message instanceof CollabClientMessage.Ping) {
            send(connection, new ServerMessage.Pong());
        }
        // heartbeat only refreshes lastSeen
    }

    @Override
    protected void onClose(RelayConnection connection) {
        String sessionId = (String) connection.getRoomKey();
        if (sessionId != null && rooms.leave(sessionId, connection)) {
            log.info("👋 Collaborator {} left session {}", connection.getUserId(), sessionId);
            broadcastPresence(sessionId);
        }
    }

    private void broadcastPresence(String sessionId) {
        broadcast(sessionId, new ServerMessage.Presence(roster(sessionId)), null);
    }

    List<ServerMessage.Collaborator> roster(String sessionId) {
        return rooms.members(sessionId).stream()
                .filter(RelayConnection::isJoined)
                .map(c -> new ServerMessage.Collaborator(c.getUserId(), c.getUserName(), c.getUserColor(),
                        c.getCursor(), c.getLastSeen(), c.isTyping()))
                .collect(Collectors.toList());
    }
}
