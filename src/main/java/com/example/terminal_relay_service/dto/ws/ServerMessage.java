package com.example.terminal_relay_service.dto.ws;

import com.example.terminal_relay_service.dto.SessionStatus;
import com.example.terminal_relay_service.dto.TerminalKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything the relay sends to clients on either channel, tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerMessage.ConnectionEstablished.class, name = "connection:established"),
        @JsonSubTypes.Type(value = ServerMessage.Scrollback.class, name = "terminal:scrollback"),
        @JsonSubTypes.Type(value = ServerMessage.Status.class, name = "session:status"),
        @JsonSubTypes.Type(value = ServerMessage.Output.class, name = "terminal:output"),
        @JsonSubTypes.Type(value = ServerMessage.SessionError.class, name = "session:error"),
        @JsonSubTypes.Type(value = ServerMessage.ProtocolError.class, name = "error"),
        @JsonSubTypes.Type(value = ServerMessage.Pong.class, name = "pong"),
        @JsonSubTypes.Type(value = ServerMessage.Presence.class, name = "collab:presence"),
        @JsonSubTypes.Type(value = ServerMessage.Chat.class, name = "collab:chat"),
        @JsonSubTypes.Type(value = ServerMessage.Cursor.class, name = "collab:cursor"),
        @JsonSubTypes.Type(value = ServerMessage.Typing.class, name = "collab:typing")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public interface ServerMessage {

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class ConnectionEstablished implements ServerMessage {
        private String sessionId;
        private TerminalKind terminalKind;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Scrollback implements ServerMessage {
        private List<String> data;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class Status implements ServerMessage {
        private SessionStatus status;
        private Long pid;
        private Integer exitCode;
        private Integer signal;

        public static Status running(Long pid) {
            return new Status(SessionStatus.RUNNING, pid, null, null);
        }

        public static Status exited(int exitCode, Integer signal) {
            return new Status(SessionStatus.IDLE, null, exitCode, signal);
        }
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Output implements ServerMessage {
        private String data;
        private long timestamp;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class SessionError implements ServerMessage {
        private String code;
        private String message;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class ProtocolError implements ServerMessage {
        private String code;
        private String message;
    }

    @Data
    class Pong implements ServerMessage {
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Presence implements ServerMessage {
        private List<Collaborator> collaborators;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    class Collaborator {
        private String id;
        private String name;
        private String color;
        private JsonNode cursor;
        private long lastSeen;
        @JsonProperty("isTyping")
        private boolean typing;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Chat implements ServerMessage {
        private String userId;
        private JsonNode message;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Cursor implements ServerMessage {
        private String userId;
        private JsonNode cursor;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Typing implements ServerMessage {
        private String userId;
        @JsonProperty("isTyping")
        private boolean typing;
    }
}
