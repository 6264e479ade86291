package com.example.terminal_relay_service.exception;

import com.example.terminal_relay_service.dto.SessionKey;

import java.io.IOException;

public class ProcessIoException extends ProcessSessionException {

    public static final String CODE = "PROCESS_IO";

    public ProcessIoException(SessionKey key, IOException cause) {
        super(CODE, "I/O error on " + key + ": " + cause.getMessage(), cause);
    }
}
