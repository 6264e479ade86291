package com.example.terminal_relay_service.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * PTY controller implemented with pty4j.
 *
 * <p>Signals go to the child by pid. pty4j's process does not support {@code toHandle()}.
 * If SIGINT cannot be raised, ETX is written to the terminal instead.
 */
@Slf4j
public final class PtyProcessControllerPty4j implements PtyProcessController {

    private static final byte ETX = 0x03;

    private final PtyProcess process;
    private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();

    public PtyProcessControllerPty4j(PtyProcessConfig config) throws IOException {
        Validate.notNull(config, "config must not be null");
        Validate.notEmpty(config.getCommand(), "command must not be empty");
        Validate.notNull(config.getWorkingDirectory(), "workingDirectory must not be null");
        Validate.isTrue(config.getInitialColumns() > 0, "initialColumns must be positive");
        Validate.isTrue(config.getInitialRows() > 0, "initialRows must be positive");

        Map<String, String> env = new HashMap<>();
        if (config.getEnvironment() != null) {
            env.putAll(config.getEnvironment());
        }

        this.process = new PtyProcessBuilder(config.getCommand().toArray(new String[0]))
                .setDirectory(config.getWorkingDirectory().toString())
                .setEnvironment(env)
                .setInitialColumns(config.getInitialColumns())
                .setInitialRows(config.getInitialRows())
                .start();

        startExitMonitorThread();
    }

    @Override
    public InputStream getPtyOutput() {
        return process.getInputStream();
    }

    @Override
    public OutputStream getPtyInput() {
        return process.getOutputStream();
    }

    @Override
    public void resize(int columns, int rows) {
        Validate.isTrue(columns > 0, "columns must be positive");
        Validate.isTrue(rows > 0, "rows must be positive");
        process.setWinSize(new WinSize(columns, rows));
    }

    @Override
    public void sendSignal(ProcessSignal signal) throws IOException {
        try {
            if (!PosixSignals.deliver(process.pid(), signal)) {
                log.debug("Process {} already gone, {} not sent", process.pid(), signal.getWireName());
            }
        } catch (IOException e) {
            if (signal != ProcessSignal.INTERRUPT) {
                throw e;
            }
            log.warn("⚠️ SIGINT to {} failed ({}), writing ETX instead", process.pid(), e.getMessage());
            OutputStream in = process.getOutputStream();
            in.write(ETX);
            in.flush();
        }
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exitFuture;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    private void startExitMonitorThread() {
        Thread monitor = new Thread(() -> {
            try {
                exitFuture.complete(process.waitFor());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exitFuture.completeExceptionally(e);
            }
        }, "pty-exit-monitor-" + process.pid());
        monitor.setDaemon(true);
        monitor.start();
    }
}
