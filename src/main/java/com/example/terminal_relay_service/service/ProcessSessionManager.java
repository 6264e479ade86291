package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.dto.SessionConfig;
import com.example.terminal_relay_service.dto.SessionKey;
import com.example.terminal_relay_service.dto.SessionStatus;
import com.example.terminal_relay_service.dto.TerminalKind;
import com.example.terminal_relay_service.exception.InvalidWorkDirectoryException;
import com.example.terminal_relay_service.exception.ProcessIoException;
import com.example.terminal_relay_service.exception.ProcessSessionException;
import com.example.terminal_relay_service.exception.SessionAlreadyRunningException;
import com.example.terminal_relay_service.exception.SessionNotFoundException;
import com.example.terminal_relay_service.exception.SpawnFailedException;
import com.example.terminal_relay_service.pty.ProcessSignal;
import com.example.terminal_relay_service.pty.PtyProcessConfig;
import com.example.terminal_relay_service.pty.PtyProcessController;
import com.example.terminal_relay_service.pty.PtyProcessLauncher;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Owns every PTY process of the service, at most one per {@link SessionKey}.
 *
 * <p>The registry is confined to the {@link RelayEventLoop}. Public operations hop onto the
 * loop and wait, so they can be called from any thread and still see a consistent registry.
 */
@Service
@Slf4j
public class ProcessSessionManager {

    private static final int READ_BUFFER_CHARS = 8192;
    private static final long DRAIN_TIMEOUT_MS = 1000;

    private final PtyProcessLauncher launcher;
    private final ExecutableResolver executableResolver;
    private final SessionEnvironmentResolver environmentResolver;
    private final RelayEventLoop eventLoop;
    private final TaskScheduler taskScheduler;
    private final int maxScrollbackLines;
    private final Duration stopGracePeriod;
    private final int defaultCols;
    private final int defaultRows;

    private final Map<SessionKey, SessionHandle> sessions = new HashMap<>();
    private final List<ProcessSessionListener> listeners = new CopyOnWriteArrayList<>();

    public ProcessSessionManager(PtyProcessLauncher launcher,
                                 ExecutableResolver executableResolver,
                                 SessionEnvironmentResolver environmentResolver,
                                 RelayEventLoop eventLoop,
                                 @Qualifier("relayTaskScheduler") TaskScheduler taskScheduler,
                                 @Value("${relay.scrollback.max-lines:5000}") int maxScrollbackLines,
                                 @Value("${relay.process.stop-grace-period:5s}") Duration stopGracePeriod,
                                 @Value("${relay.process.default-cols:120}") int defaultCols,
                                 @Value("${relay.process.default-rows:30}") int defaultRows) {
        this.launcher = launcher;
        this.executableResolver = executableResolver;
        this.environmentResolver = environmentResolver;
        this.eventLoop = eventLoop;
        this.taskScheduler = taskScheduler;
        this.maxScrollbackLines = maxScrollbackLines;
        this.stopGracePeriod = stopGracePeriod;
        this.defaultCols = defaultCols;
        this.defaultRows = defaultRows;
    }

    public void addListener(ProcessSessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ProcessSessionListener listener) {
        listeners.remove(listener);
    }

    // ============= COMMANDS =============

    /**
     * Spawns the process for {@code (sessionId, terminalKind)}.
     *
     * @return pid of the spawned process
     * @throws SessionAlreadyRunningException if the key already has a live process
     * @throws InvalidWorkDirectoryException if {@code workDir} is not an existing directory
     * @throws com.example.terminal_relay_service.exception.ExecutableNotFoundException if no executable resolves
     * @throws SpawnFailedException if the PTY could not be started
     */
    public long start(String sessionId, String workDir, SessionConfig config, TerminalKind terminalKind) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        return eventLoop.call(() -> doStart(key, workDir, config));
    }

    public void write(String sessionId, TerminalKind terminalKind, String data) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        eventLoop.run(() -> {
            SessionHandle handle = sessions.get(key);
            if (handle == null) {
                throw new SessionNotFoundException(key);
            }
            try {
                OutputStream in = handle.getController().getPtyInput();
                in.write(data.getBytes(StandardCharsets.UTF_8));
                in.flush();
            } catch (IOException e) {
                throw new ProcessIoException(key, e);
            }
            handle.updateActivity();
        });
    }

    /**
     * Resizes the PTY. Absent handles and non-positive sizes are ignored.
     */
    public void resize(String sessionId, TerminalKind terminalKind, int cols, int rows) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        eventLoop.run(() -> {
            SessionHandle handle = sessions.get(key);
            if (handle == null || cols <= 0 || rows <= 0) {
                return;
            }
            try {
                handle.getController().resize(cols, rows);
                handle.setCols(cols);
                handle.setRows(rows);
            } catch (RuntimeException e) {
                log.debug("Resize of {} failed, process is probably exiting: {}", key, e.getMessage());
            }
        });
    }

    public void sendSignal(String sessionId, TerminalKind terminalKind, ProcessSignal signal) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        eventLoop.run(() -> {
            SessionHandle handle = sessions.get(key);
            if (handle != null) {
                deliver(handle, signal);
            }
        });
    }

    /**
     * Stops the process. Without {@code force} the process gets SIGTERM and, if it is still
     * registered when the grace period ends, SIGKILL. With {@code force} it gets SIGKILL at once.
     */
    public void stop(String sessionId, TerminalKind terminalKind, boolean force) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        eventLoop.run(() -> doStop(key, force));
    }

    @PreDestroy
    public void shutdownAll() {
        eventLoop.run(() -> {
            List<SessionKey> keys = new ArrayList<>(sessions.keySet());
            log.info("🧹 Shutting down {} process sessions", keys.size());
            keys.forEach(key -> doStop(key, true));
        });
    }

    // ============= READS =============

    public List<String> getScrollback(String sessionId, TerminalKind terminalKind) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        return eventLoop.call(() -> {
            SessionHandle handle = sessions.get(key);
            return handle == null ? List.of() : handle.getScrollback().snapshot();
        });
    }

    public SessionStatus getStatus(String sessionId, TerminalKind terminalKind) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        return eventLoop.call(() -> {
            SessionHandle handle = sessions.get(key);
            return handle == null ? SessionStatus.IDLE : handle.getStatus();
        });
    }

    public Optional<Long> getPid(String sessionId, TerminalKind terminalKind) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        return eventLoop.call(() -> Optional.ofNullable(sessions.get(key)).map(SessionHandle::getPid));
    }

    public boolean isRunning(String sessionId, TerminalKind terminalKind) {
        SessionKey key = SessionKey.of(sessionId, terminalKind);
        return eventLoop.call(() -> sessions.containsKey(key));
    }

    public int getRunningCount() {
        return eventLoop.call(sessions::size);
    }

    public List<SessionKey> getRunningSessions() {
        return eventLoop.call(() -> List.copyOf(sessions.keySet()));
    }

    // ============= LOOP-CONFINED INTERNALS =============

    private long doStart(SessionKey key, String workDir, SessionConfig config) {
        if (sessions.containsKey(key)) {
            throw new SessionAlreadyRunningException(key);
        }

        PtyProcessController controller;
        PtyProcessConfig ptyConfig;
        try {
            Path dir = resolveWorkDir(workDir);
            ptyConfig = PtyProcessConfig.builder()
                    .command(executableResolver.resolve(key.getTerminalKind()))
                    .workingDirectory(dir)
                    .environment(environmentResolver.resolve(config, key.getTerminalKind()))
                    .initialColumns(positiveOr(config != null ? config.getCols() : null, defaultCols))
                    .initialRows(positiveOr(config != null ? config.getRows() : null, defaultRows))
                    .build();
            controller = launch(key, ptyConfig);
        } catch (ProcessSessionException e) {
            log.error("❌ Failed to start {}: {}", key, e.getMessage());
            emitError(key, e);
            throw e;
        }

        LocalDateTime now = LocalDateTime.now();
        SessionHandle handle = SessionHandle.builder()
                .key(key)
                .controller(controller)
                .pid(controller.pid())
                .workDir(ptyConfig.getWorkingDirectory())
                .scrollback(new ScrollbackBuffer(maxScrollbackLines))
                .startedAt(now)
                .lastActivityAt(now)
                .cols(ptyConfig.getInitialColumns())
                .rows(ptyConfig.getInitialRows())
                .status(SessionStatus.RUNNING)
                .build();
        sessions.put(key, handle);

        startOutputPump(handle);
        controller.onExit().whenComplete((exitCode, error) -> handle.getOutputDrained()
                .completeOnTimeout(null, DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .whenComplete((ignored, drainError) -> eventLoop.execute(() -> handleExit(handle, exitCode, error))));

        log.info("✅ Started {} with pid {} in {} ({})", key, handle.getPid(), handle.getWorkDir(),
                ptyConfig.getCommand().get(0));
        for (ProcessSessionListener listener : listeners) {
            try {
                listener.onStarted(key, handle.getPid());
            } catch (RuntimeException e) {
                log.error("❌ Listener failed on start of {}: {}", key, e.getMessage(), e);
            }
        }
        return handle.getPid();
    }

    private PtyProcessController launch(SessionKey key, PtyProcessConfig ptyConfig) {
        try {
            return launcher.launch(ptyConfig);
        } catch (IOException | RuntimeException e) {
            throw new SpawnFailedException(key, e);
        }
    }

    private static Path resolveWorkDir(String workDir) {
        if (workDir == null || workDir.isBlank()) {
            throw new InvalidWorkDirectoryException(String.valueOf(workDir));
        }
        try {
            Path dir = Path.of(workDir);
            if (!Files.isDirectory(dir)) {
                throw new InvalidWorkDirectoryException(workDir);
            }
            return dir;
        } catch (InvalidPathException e) {
            throw new InvalidWorkDirectoryException(workDir);
        }
    }

    private void doStop(SessionKey key, boolean force) {
        SessionHandle handle = sessions.get(key);
        if (handle == null) {
            return;
        }
        handle.setStatus(SessionStatus.STOPPING);
        if (force) {
            log.info("🛑 Force stopping {}", key);
            handle.cancelEscalation();
            deliver(handle, ProcessSignal.KILL);
            return;
        }

        log.info("🛑 Stopping {} (escalating to SIGKILL after {})", key, stopGracePeriod);
        deliver(handle, ProcessSignal.TERMINATE);
        if (handle.getEscalation() == null) {
            handle.setEscalation(taskScheduler.schedule(
                    () -> eventLoop.execute(() -> escalate(handle)),
                    Instant.now().plus(stopGracePeriod)));
        }
    }

    private void escalate(SessionHandle handle) {
        handle.setEscalation(null);
        if (sessions.get(handle.getKey()) != handle) {
            return;
        }
        log.warn("⚠️ {} did not exit within {}, sending SIGKILL", handle.getKey(), stopGracePeriod);
        deliver(handle, ProcessSignal.KILL);
    }

    private void deliver(SessionHandle handle, ProcessSignal signal) {
        try {
            handle.getController().sendSignal(signal);
        } catch (IOException | RuntimeException e) {
            log.warn("⚠️ Could not deliver {} to {}: {}", signal.getWireName(), handle.getKey(), e.getMessage());
        }
    }

    private void startOutputPump(SessionHandle handle) {
        Reader reader = new InputStreamReader(handle.getController().getPtyOutput(), StandardCharsets.UTF_8);
        Thread pump = new Thread(() -> {
            char[] buffer = new char[READ_BUFFER_CHARS];
            try {
                int read;
                while ((read = reader.read(buffer)) != -1) {
                    String chunk = new String(buffer, 0, read);
                    eventLoop.execute(() -> handleOutput(handle, chunk));
                }
            } catch (IOException e) {
                // Linux reports EIO on the PTY master once the child side is gone
                log.debug("PTY output of {} closed: {}", handle.getKey(), e.getMessage());
            } finally {
                handle.getOutputDrained().complete(null);
            }
        }, "pty-reader-" + handle.getKey());
        pump.setDaemon(true);
        pump.start();
    }

    private void handleOutput(SessionHandle handle, String chunk) {
        if (sessions.get(handle.getKey()) != handle) {
            return;
        }
        handle.getScrollback().append(chunk);
        handle.updateActivity();
        for (ProcessSessionListener listener : listeners) {
            try {
                listener.onOutput(handle.getKey(), chunk);
            } catch (RuntimeException e) {
                log.error("❌ Listener failed on output of {}: {}", handle.getKey(), e.getMessage(), e);
            }
        }
    }

    private void handleExit(SessionHandle handle, Integer exitCode, Throwable error) {
        if (error != null) {
            log.error("❌ Exit monitor of {} failed: {}", handle.getKey(), error.getMessage());
        }
        int code = exitCode != null ? exitCode : -1;
        Integer signal = code > 128 && code < 160 ? code - 128 : null;

        handle.setStatus(SessionStatus.IDLE);
        handle.cancelEscalation();
        log.info("🔚 {} exited with code {}{}", handle.getKey(), code, signal != null ? " (signal " + signal + ")" : "");

        for (ProcessSessionListener listener : listeners) {
            try {
                listener.onExit(handle.getKey(), code, signal);
            } catch (RuntimeException e) {
                log.error("❌ Listener failed on exit of {}: {}", handle.getKey(), e.getMessage(), e);
            }
        }
        sessions.remove(handle.getKey(), handle);
    }

    private void emitError(SessionKey key, Exception error) {
        for (ProcessSessionListener listener : listeners) {
            try {
                listener.onError(key, error);
            } catch (RuntimeException e) {
                log.error("❌ Listener failed on error of {}: {}", key, e.getMessage(), e);
            }
        }
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }
}
