package com.example.terminal_relay_service.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum TerminalKind {
    PRIMARY_AGENT("claude", "primary-agent"),
    SHELL("shell", "shell"),
    SECONDARY_AGENT("codex", "secondary-agent");

    private final String id;
    private final String kindName;

    TerminalKind(String id, String kindName) {
        this.id = id;
        this.kindName = kindName;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public static Optional<TerminalKind> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TerminalKind kind : values()) {
            if (kind.id.equals(normalized) || kind.kindName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
