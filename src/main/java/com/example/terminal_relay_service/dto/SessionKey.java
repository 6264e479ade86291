package com.example.terminal_relay_service.dto;

import lombok.NonNull;
import lombok.Value;

@Value(staticConstructor = "of")
public class SessionKey {
    @NonNull String sessionId;
    @NonNull TerminalKind terminalKind;

    @Override
    public String toString() {
        return sessionId + "/" + terminalKind.getId();
    }
}
