package com.example.terminal_relay_service.pty;

import java.io.IOException;

@FunctionalInterface
public interface PtyProcessLauncher {

    PtyProcessController launch(PtyProcessConfig config) throws IOException;
}
