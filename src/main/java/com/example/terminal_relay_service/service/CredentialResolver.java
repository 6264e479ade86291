package com.example.terminal_relay_service.service;

import java.util.Map;

/**
 * Supplies credential environment variables for a spawned process.
 *
 * <p>Priority is session-supplied values, then the user's custom keys, then global admin
 * keys, then the service's own environment. Implementations backed by the user store live
 * outside this service.
 */
public interface CredentialResolver {

    Map<String, String> resolveCredentials(String userId, Map<String, String> sessionEnv);
}
