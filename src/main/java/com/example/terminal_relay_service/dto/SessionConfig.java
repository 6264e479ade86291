package com.example.terminal_relay_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SessionConfig {
    private Integer cols;
    private Integer rows;
    /** Session-supplied environment; highest priority in credential resolution. */
    private Map<String, String> env;
    private String userId;
}
