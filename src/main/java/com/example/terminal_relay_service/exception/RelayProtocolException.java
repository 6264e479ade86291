package com.example.terminal_relay_service.exception;

import lombok.Getter;

@Getter
public class RelayProtocolException extends RuntimeException {

    public static final String INVALID_MESSAGE = "INVALID_MESSAGE";
    public static final String UNKNOWN_MESSAGE_TYPE = "UNKNOWN_MESSAGE_TYPE";

    private final String code;

    public RelayProtocolException(String code, String message) {
        super(message);
        this.code = code;
    }

    public RelayProtocolException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
