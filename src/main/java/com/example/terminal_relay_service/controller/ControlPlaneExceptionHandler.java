package com.example.terminal_relay_service.controller;

import com.example.terminal_relay_service.exception.InvalidWorkDirectoryException;
import com.example.terminal_relay_service.exception.ProcessSessionException;
import com.example.terminal_relay_service.exception.SessionAlreadyRunningException;
import com.example.terminal_relay_service.exception.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ControlPlaneExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(ProcessSessionException.class)
    public ResponseEntity<Map<String, Object>> processSession(ProcessSessionException e) {
        HttpStatus status = isCallerError(e) ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("❌ Process session failure [{}]: {}", e.getCode(), e.getMessage(), e);
        } else {
            log.warn("⚠️ Rejected control-plane request [{}]: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of("error", e.getMessage(), "code", e.getCode()));
    }

    private static boolean isCallerError(ProcessSessionException e) {
        return e instanceof SessionAlreadyRunningException
                || e instanceof InvalidWorkDirectoryException
                || e instanceof SessionNotFoundException;
    }
}
