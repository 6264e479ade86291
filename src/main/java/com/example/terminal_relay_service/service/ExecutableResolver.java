package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.dto.TerminalKind;
import com.example.terminal_relay_service.exception.ExecutableNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Maps a terminal kind to the command line that should run in its PTY.
 *
 * <p>Agent kinds use their configured binary. The shell kind walks the preferred shell,
 * then {@code bash}, then {@code sh}. Bare names are looked up on the search path.
 */
@Component
@Slf4j
public class ExecutableResolver {

    private final String primaryCommand;
    private final List<String> primaryArgs;
    private final String secondaryCommand;
    private final List<String> secondaryArgs;
    private final String preferredShell;
    private final List<Path> searchPath;

    public ExecutableResolver(
            @Value("${relay.agents.primary.command:claude}") String primaryCommand,
            @Value("${relay.agents.primary.args:}") String[] primaryArgs,
            @Value("${relay.agents.secondary.command:codex}") String secondaryCommand,
            @Value("${relay.agents.secondary.args:}") String[] secondaryArgs,
            @Value("${relay.shell.preferred:${SHELL:}}") String preferredShell,
            @Value("${PATH:}") String searchPath) {
        this.primaryCommand = primaryCommand;
        this.primaryArgs = Arrays.asList(primaryArgs);
        this.secondaryCommand = secondaryCommand;
        this.secondaryArgs = Arrays.asList(secondaryArgs);
        this.preferredShell = preferredShell;
        this.searchPath = parseSearchPath(searchPath);
    }

    public List<String> resolve(TerminalKind terminalKind) {
        switch (terminalKind) {
            case PRIMARY_AGENT:
                return commandLine(List.of(primaryCommand), primaryArgs);
            case SECONDARY_AGENT:
                return commandLine(List.of(secondaryCommand), secondaryArgs);
            case SHELL:
            default:
                List<String> candidates = new ArrayList<>();
                if (preferredShell != null && !preferredShell.isBlank()) {
                    candidates.add(preferredShell);
                }
                candidates.add("bash");
                candidates.add("sh");
                return commandLine(candidates, List.of());
        }
    }

    private List<String> commandLine(List<String> candidates, List<String> args) {
        for (String candidate : candidates) {
            Optional<Path> found = find(candidate);
            if (found.isPresent()) {
                List<String> command = new ArrayList<>(1 + args.size());
                command.add(found.get().toString());
                command.addAll(args);
                return command;
            }
            log.debug("Executable candidate {} not found", candidate);
        }
        throw new ExecutableNotFoundException(candidates);
    }

    Optional<Path> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            if (name.contains(File.separator)) {
                Path path = Path.of(name);
                return isExecutableFile(path) ? Optional.of(path) : Optional.empty();
            }
            for (Path dir : searchPath) {
                Path path = dir.resolve(name);
                if (isExecutableFile(path)) {
                    return Optional.of(path);
                }
            }
        } catch (InvalidPathException e) {
            log.warn("⚠️ Ignoring invalid executable name {}: {}", name, e.getMessage());
        }
        return Optional.empty();
    }

    private static boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    private static List<Path> parseSearchPath(String searchPath) {
        List<Path> dirs = new ArrayList<>();
        if (searchPath == null) {
            return dirs;
        }
        for (String entry : searchPath.split(File.pathSeparator)) {
            if (entry.isBlank()) {
                continue;
            }
            try {
                dirs.add(Path.of(entry));
            } catch (InvalidPathException e) {
                log.debug("Skipping invalid PATH entry {}", entry);
            }
        }
        return dirs;
    }
}
