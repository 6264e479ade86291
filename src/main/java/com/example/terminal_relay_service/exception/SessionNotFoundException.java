package com.example.terminal_relay_service.exception;

import com.example.terminal_relay_service.dto.SessionKey;

public class SessionNotFoundException extends ProcessSessionException {

    public static final String CODE = "SESSION_NOT_RUNNING";

    public SessionNotFoundException(SessionKey key) {
        super(CODE, "Session " + key + " is not running");
    }
}
