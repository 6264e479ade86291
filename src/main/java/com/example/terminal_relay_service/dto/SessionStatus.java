package com.example.terminal_relay_service.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionStatus {
    STARTING,
    RUNNING,
    STOPPING,
    IDLE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
