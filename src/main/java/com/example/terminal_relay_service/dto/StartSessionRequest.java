package com.example.terminal_relay_service.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class StartSessionRequest {
    private String projectPath;
    private SessionConfig config;
    private String userId;
}
