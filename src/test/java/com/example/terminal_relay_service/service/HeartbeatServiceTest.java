package com.example.terminal_relay_service.service;

import com.example.terminal_relay_service.dto.SessionStatus;
import com.example.terminal_relay_service.handler.CollaborationHandler;
import com.example.terminal_relay_service.handler.RecordingSocket;
import com.example.terminal_relay_service.handler.RelayMessageCodec;
import com.example.terminal_relay_service.handler.TerminalHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HeartbeatServiceTest {

    private RelayEventLoop eventLoop;
    private TerminalHandler terminalHandler;
    private CollaborationHandler collaborationHandler;
    private TaskScheduler taskScheduler;
    private HeartbeatService heartbeatService;

    @BeforeEach
    void setUp() {
        eventLoop = new RelayEventLoop();
        ProcessSessionManager manager = mock(ProcessSessionManager.class);
        when(manager.getStatus(anyString(), any())).thenReturn(SessionStatus.IDLE);
        when(manager.getPid(anyString(), any())).thenReturn(Optional.empty());
        when(manager.getScrollback(anyString(), any())).thenReturn(List.of());
        RelayMessageCodec codec = new RelayMessageCodec(new ObjectMapper());
        terminalHandler = new TerminalHandler(eventLoop, codec, manager, Runnable::run, 10_000, 1024 * 1024);
        collaborationHandler = new CollaborationHandler(eventLoop, codec, Runnable::run, 10_000, 1024 * 1024);
        taskScheduler = mock(TaskScheduler.class);
        heartbeatService = new HeartbeatService(terminalHandler, collaborationHandler, eventLoop, taskScheduler,
                Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        eventLoop.shutdown();
    }

    private void flush() {
        eventLoop.run(() -> { });
    }

    @Test
    @DisplayName("Should ping live connections and drop the ones that never answered")
    void sweep_DropsSilentConnections() throws Exception {
        RecordingSocket responsive = new RecordingSocket("t1", Map.of("sessionId", "s1", "terminalKind", "shell"));
        RecordingSocket silent = new RecordingSocket("c1", Map.of("sessionId", "s1", "userId", "bob"));
        terminalHandler.afterConnectionEstablished(responsive.session());
        collaborationHandler.afterConnectionEstablished(silent.session());
        flush();

        eventLoop.run(heartbeatService::sweep);

        assertThat(responsive.pings()).isEqualTo(1);
        assertThat(silent.pings()).isEqualTo(1);

        terminalHandler.handleMessage(responsive.session(), new PongMessage());
        flush();
        eventLoop.run(heartbeatService::sweep);

        assertThat(responsive.pings()).isEqualTo(2);
        assertThat(responsive.closes()).isEmpty();
        assertThat(silent.closes()).containsExactly(CloseStatus.SESSION_NOT_RELIABLE);
        assertThat(collaborationHandler.getConnectionCount()).isZero();
        assertThat(collaborationHandler.getRoomCount()).isZero();
        assertThat(terminalHandler.getConnectionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should schedule the sweep once and cancel it on stop")
    void startStop_ManagesSchedule() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(30)));

        heartbeatService.start();
        heartbeatService.start();
        heartbeatService.stop();

        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(30)));
        verify(future).cancel(false);
    }
}
