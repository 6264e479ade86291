package com.example.terminal_relay_service.exception;

import com.example.terminal_relay_service.dto.SessionKey;

public class SessionAlreadyRunningException extends ProcessSessionException {

    public static final String CODE = "ALREADY_RUNNING";

    public SessionAlreadyRunningException(SessionKey key) {
        super(CODE, "Session " + key + " already running");
    }
}
