package com.example.terminal_relay_service.pty;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ProcessSignal {
    INTERRUPT("SIGINT"),
    TERMINATE("SIGTERM"),
    KILL("SIGKILL");

    private final String wireName;

    ProcessSignal(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Accepts "SIGINT", "INT", "interrupt" and the like.
     */
    public static Optional<ProcessSignal> fromWire(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(normalized)
                        || s.wireName.substring(3).equals(normalized)
                        || s.name().equals(normalized))
                .findFirst();
    }
}
