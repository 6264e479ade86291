package com.example.terminal_relay_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TerminalRelayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TerminalRelayServiceApplication.class, args);
    }
}
