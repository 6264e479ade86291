package com.example.terminal_relay_service.pty;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
@Slf4j
public class Pty4jProcessLauncher implements PtyProcessLauncher {

    @Override
    public PtyProcessController launch(PtyProcessConfig config) throws IOException {
        log.debug("Spawning {} in {} ({}x{})", config.getCommand(), config.getWorkingDirectory(),
                config.getInitialColumns(), config.getInitialRows());
        return new PtyProcessControllerPty4j(config);
    }
}
