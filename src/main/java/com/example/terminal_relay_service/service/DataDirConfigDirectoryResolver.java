package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.dto.TerminalKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Gives each user an isolated agent config directory under a data root:
 * {@code <root>/users/<userId>}, or {@code <root>/global} for anonymous sessions.
 */
@Component
public class DataDirConfigDirectoryResolver implements ConfigDirectoryResolver {

    static final String CLAUDE_CONFIG_DIR = "CLAUDE_CONFIG_DIR";
    static final String CODEX_HOME = "CODEX_HOME";

    private final Path primaryDataDir;
    private final Path secondaryDataDir;

    public DataDirConfigDirectoryResolver(
            @Value("${relay.agents.primary.data-dir:/app/data/claude}") String primaryDataDir,
            @Value("${relay.agents.secondary.data-dir:/app/data/codex}") String secondaryDataDir) {
        this.primaryDataDir = Path.of(primaryDataDir);
        this.secondaryDataDir = Path.of(secondaryDataDir);
    }

    @Override
    public Map<String, String> resolve(String userId, TerminalKind terminalKind) {
        switch (terminalKind) {
            case PRIMARY_AGENT:
                return Map.of(CLAUDE_CONFIG_DIR, userDir(primaryDataDir, userId).toString());
            case SECONDARY_AGENT:
                return Map.of(CODEX_HOME, userDir(secondaryDataDir, userId).toString());
            default:
                return Map.of();
        }
    }

    private static Path userDir(Path root, String userId) {
        if (userId == null || userId.isBlank()) {
            return root.resolve("global");
        }
        return root.resolve("users").resolve(userId);
    }
}
