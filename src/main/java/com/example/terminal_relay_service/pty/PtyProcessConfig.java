package com.example.terminal_relay_service.pty;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Configuration for spawning a PTY-attached process.
 */
@Value
@Builder
public class PtyProcessConfig {
    /** Command and arguments, e.g. ["claude"] or ["/bin/bash", "-l"]. */
    List<String> command;
    Path workingDirectory;
    /** Complete environment of the child; nothing is inherited implicitly. */
    Map<String, String> environment;
    int initialColumns;
    int initialRows;
}
