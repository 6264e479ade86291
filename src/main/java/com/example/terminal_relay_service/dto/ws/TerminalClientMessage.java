package com.example.terminal_relay_service.dto.ws;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Messages a viewer sends on the terminal channel, tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TerminalClientMessage.Input.class, name = "terminal:input"),
        @JsonSubTypes.Type(value = TerminalClientMessage.Resize.class, name = "terminal:resize"),
        @JsonSubTypes.Type(value = TerminalClientMessage.Signal.class, name = "terminal:signal"),
        @JsonSubTypes.Type(value = TerminalClientMessage.Ping.class, name = "ping")
})
public interface TerminalClientMessage {

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Input implements TerminalClientMessage {
        private String data;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Resize implements TerminalClientMessage {
        private int cols;
        private int rows;
    }

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    class Signal implements TerminalClientMessage {
        /** SIGINT, SIGTERM or SIGKILL */
        private String signal;
    }

    @Data
    class Ping implements TerminalClientMessage {
    }
}
