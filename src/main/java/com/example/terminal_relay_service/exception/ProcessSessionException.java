package com.example.terminal_relay_service.exception;

import lombok.Getter;

/**
 * Base class for failures of the process session core. {@link #getCode()} is the stable
 * identifier sent to realtime clients in {@code session:error} frames.
 */
@Getter
public class ProcessSessionException extends RuntimeException {

    private final String code;

    public ProcessSessionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ProcessSessionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
