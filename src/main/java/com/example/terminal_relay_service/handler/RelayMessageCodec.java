package com.example.terminal_relay_service.handler;

import com.example.terminal_relay_service.dto.ws.ServerMessage;
import com.example.terminal_relay_service.exception.RelayProtocolException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import org.springframework.stereotype.Component;

@Component
public class RelayMessageCodec {

    private final ObjectMapper objectMapper;

    public RelayMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public <T> T decode(String payload, Class<T> type) {
        try {
            T message = objectMapper.readValue(payload, type);
            if (message == null) {
                throw new RelayProtocolException(RelayProtocolException.INVALID_MESSAGE, "Invalid message format");
            }
            return message;
        } catch (InvalidTypeIdException e) {
            if (e.getTypeId() != null) {
                throw new RelayProtocolException(RelayProtocolException.UNKNOWN_MESSAGE_TYPE,
                        "Unknown message type: " + e.getTypeId(), e);
            }
            throw new RelayProtocolException(RelayProtocolException.INVALID_MESSAGE, "Message type is required", e);
        } catch (JsonProcessingException e) {
            throw new RelayProtocolException(RelayProtocolException.INVALID_MESSAGE, "Invalid message format", e);
        }
    }

    public String encode(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + message.getClass().getSimpleName(), e);
        }
    }
}
