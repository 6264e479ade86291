package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.dto.SessionKey;

/**
 * Typed lifecycle events of the process session manager. Callbacks run on the
 * {@link RelayEventLoop} thread.
 */
public interface ProcessSessionListener {

    default void onStarted(SessionKey key, long pid) {
    }

    /**
     * @param data raw chunk as read from the PTY, not split into lines
     */
    default void onOutput(SessionKey key, String data) {
    }

    /**
     * @param signal terminating signal number, or null when the process exited normally
     */
    default void onExit(SessionKey key, int exitCode, Integer signal) {
    }

    default void onError(SessionKey key, Exception error) {
    }
}
