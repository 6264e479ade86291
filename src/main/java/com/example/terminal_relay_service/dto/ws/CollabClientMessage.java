package com.example.terminal_relay_service.dto.ws;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Messages a participant sends on the collaboration channel, tagged by {@code type}.
 * Chat payloads and cursors are opaque to the server and relayed as-is.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CollabClientMessage.Join.class, name = "collab:join"),
        @JsonSubTypes.Type(value = CollabClientMessage.Chat.class, name = "collab:chat"),
        @JsonSubTypes.Type(value = CollabClientMessage.Cursor.class, name = "collab:cursor"),
        @JsonSubTypes.Type(value = CollabClientMessage.Typing.class, name = "collab:typing"),
        @JsonSubTypes.Type(value = CollabClientMessage.Heartbeat.class, name = "collab:heartbeat"),
        @JsonSubTypes.Type(value = CollabClientMessage.Ping.class, name = "ping")
})
public interface CollabClientMessage {

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Join implements CollabClientMessage {
        private String userName;
        private String userColor;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Chat implements CollabClientMessage {
        private JsonNode message;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Cursor implements CollabClientMessage {
        private JsonNode cursor;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Typing implements CollabClientMessage {
        @JsonProperty("isTyping")
        private boolean typing;
    }

    @Data
    class Heartbeat implements CollabClientMessage {
    }

    @Data
    class Ping implements CollabClientMessage {
    }
}
