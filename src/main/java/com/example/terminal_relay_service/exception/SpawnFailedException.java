package com.example.terminal_relay_service.exception;

import com.example.terminal_relay_service.dto.SessionKey;

public class SpawnFailedException extends ProcessSessionException {

    public static final String CODE = "SPAWN_FAILED";

    public SpawnFailedException(SessionKey key, Throwable cause) {
        super(CODE, "Failed to spawn process for " + key + ": " + cause.getMessage(), cause);
    }
}
