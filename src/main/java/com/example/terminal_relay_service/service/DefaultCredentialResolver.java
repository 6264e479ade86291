package com.example.terminal_relay_service.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Slf4j
public class DefaultCredentialResolver implements CredentialResolver {

    static final String ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    static final String OPENAI_API_KEY = "OPENAI_API_KEY";

    private final Map<String, String> globalKeys = new HashMap<>();
    private final Map<String, String> processEnv;

    @Autowired
    public DefaultCredentialResolver(
            @Value("${relay.credentials.anthropic-api-key:}") String anthropicKey,
            @Value("${relay.credentials.openai-api-key:}") String openaiKey) {
        this(anthropicKey, openaiKey, System.getenv());
    }

    DefaultCredentialResolver(String anthropicKey, String openaiKey, Map<String, String> processEnv) {
        putIfPresent(globalKeys, ANTHROPIC_API_KEY, anthropicKey);
        putIfPresent(globalKeys, OPENAI_API_KEY, openaiKey);
        this.processEnv = processEnv;
    }

    @Override
    public Map<String, String> resolveCredentials(String userId, Map<String, String> sessionEnv) {
        Map<String, String> credentials = new LinkedHashMap<>();
        for (String name : new String[]{ANTHROPIC_API_KEY, OPENAI_API_KEY}) {
            String source;
            if (sessionEnv != null && isPresent(sessionEnv.get(name))) {
                credentials.put(name, sessionEnv.get(name));
                source = "session";
            } else if (globalKeys.containsKey(name)) {
                credentials.put(name, globalKeys.get(name));
                source = "global";
            } else if (isPresent(processEnv.get(name))) {
                credentials.put(name, processEnv.get(name));
                source = "env";
            } else {
                continue;
            }
            log.debug("Resolved {} for user {} from {}", name, userId, source);
        }
        return credentials;
    }

    private static void putIfPresent(Map<String, String> target, String name, String value) {
        if (isPresent(value)) {
            target.put(name, value);
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
