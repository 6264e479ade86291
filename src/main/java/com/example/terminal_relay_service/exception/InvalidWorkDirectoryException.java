package com.example.terminal_relay_service.exception;

public class InvalidWorkDirectoryException extends ProcessSessionException {

    public static final String CODE = "INVALID_WORK_DIR";

    public InvalidWorkDirectoryException(String workDir) {
        super(CODE, "Working directory is not a directory: " + workDir);
    }
}
