package com.example.terminal_relay_service.pty;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal controller for a PTY-attached subprocess.
 *
 * <p>Implementations provide access to the PTY streams, resize, signal delivery
 * and exit monitoring. The exit future completes with the raw exit code.
 */
public interface PtyProcessController {

    InputStream getPtyOutput();

    OutputStream getPtyInput();

    void resize(int columns, int rows);

    void sendSignal(ProcessSignal signal) throws IOException;

    CompletableFuture<Integer> onExit();

    long pid();

    boolean isAlive();
}
