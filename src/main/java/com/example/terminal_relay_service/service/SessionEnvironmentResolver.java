package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.dto.SessionConfig;
import com.example.terminal_relay_service.dto.TerminalKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the complete environment of a spawned process. Later layers override earlier
 * ones: service environment, config directory, credentials, session env, terminal type.
 */
@Component
@RequiredArgsConstructor
public class SessionEnvironmentResolver {

    private final CredentialResolver credentialResolver;
    private final ConfigDirectoryResolver configDirectoryResolver;

    public Map<String, String> resolve(SessionConfig config, TerminalKind terminalKind) {
        return resolve(System.getenv(), config, terminalKind);
    }

    Map<String, String> resolve(Map<String, String> baseEnv, SessionConfig config, TerminalKind terminalKind) {
        String userId = config != null ? config.getUserId() : null;
        Map<String, String> sessionEnv = config != null && config.getEnv() != null ? config.getEnv() : Map.of();

        Map<String, String> env = new LinkedHashMap<>(baseEnv);
        env.putAll(configDirectoryResolver.resolve(userId, terminalKind));
        env.putAll(credentialResolver.resolveCredentials(userId, sessionEnv));
        env.putAll(sessionEnv);
        env.put("TERM", "xterm-256color");
        env.put("COLORTERM", "truecolor");
        return env;
    }
}
