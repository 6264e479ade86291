package com.example.terminal_relay_service.pty;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Delivers {@link ProcessSignal}s to a process by pid.
 */
final class PosixSignals {

    private static final long KILL_COMMAND_TIMEOUT_SECONDS = 2;

    private PosixSignals() {
    }

    /**
     * @return false if no process with that pid exists any more
     */
    static boolean deliver(long pid, ProcessSignal signal) throws IOException {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return false;
        }
        switch (signal) {
            case INTERRUPT -> runKill("-INT", pid);
            case TERMINATE -> handle.get().destroy();
            case KILL -> handle.get().destroyForcibly();
        }
        return true;
    }

    // ProcessHandle only knows SIGTERM and SIGKILL
    private static void runKill(String signalFlag, long pid) throws IOException {
        Process kill = new ProcessBuilder("kill", signalFlag, Long.toString(pid))
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
        try {
            if (!kill.waitFor(KILL_COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                kill.destroyForcibly();
                throw new IOException("kill " + signalFlag + " " + pid + " timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while signalling " + pid, e);
        }
        if (kill.exitValue() != 0) {
            throw new IOException("kill " + signalFlag + " " + pid + " exited with " + kill.exitValue());
        }
    }
}
