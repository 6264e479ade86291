package com.example.terminal_relay_service.exception;

import java.util.List;

public class ExecutableNotFoundException extends ProcessSessionException {

    public static final String CODE = "EXECUTABLE_NOT_FOUND";

    public ExecutableNotFoundException(List<String> candidates) {
        super(CODE, "No executable found among " + candidates);
    }
}
