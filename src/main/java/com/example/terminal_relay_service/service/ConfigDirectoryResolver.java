package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.dto.TerminalKind;

import java.util.Map;

public interface ConfigDirectoryResolver {

    Map<String, String> resolve(String userId, TerminalKind terminalKind);
}
