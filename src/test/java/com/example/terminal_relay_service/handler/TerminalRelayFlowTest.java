package com.example.terminal_relay_service.handler;

import com.example.terminal_relay_service.dto.SessionConfig;
import com.example.terminal_relay_service.dto.TerminalKind;
import com.example.terminal_relay_service.service.ExecutableResolver;
import com.example.terminal_relay_service.service.FakePtyProcessController;
import com.example.terminal_relay_service.service.ProcessSessionManager;
import com.example.terminal_relay_service.service.RelayEventLoop;
import com.example.terminal_relay_service.service.SessionEnvironmentResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.TextMessage;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Manager and terminal channel wired together over a fake PTY.
 */
class TerminalRelayFlowTest {

    @TempDir
    Path workDir;

    private RelayEventLoop eventLoop;
    private ProcessSessionManager manager;
    private TerminalHandler handler;
    private final List<FakePtyProcessController> launched = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        eventLoop = new RelayEventLoop();
        ExecutableResolver executableResolver = mock(ExecutableResolver.class);
        when(executableResolver.resolve(any())).thenReturn(List.of("/bin/bash"));
        SessionEnvironmentResolver environmentResolver = mock(SessionEnvironmentResolver.class);
        when(environmentResolver.resolve(any(), any())).thenReturn(Map.of());

        manager = new ProcessSessionManager(config -> {
            FakePtyProcessController controller = new FakePtyProcessController(500 + launched.size());
            launched.add(controller);
            return controller;
        }, executableResolver, environmentResolver, eventLoop, mock(TaskScheduler.class), 5000,
                Duration.ofSeconds(5), 120, 30);
        handler = new TerminalHandler(eventLoop, new RelayMessageCodec(new ObjectMapper()), manager, Runnable::run, 10_000, 1024 * 1024);
        handler.subscribe();
    }

    @AfterEach
    void tearDown() throws IOException {
        for (FakePtyProcessController controller : launched) {
            controller.exit(0);
        }
        eventLoop.shutdown();
    }

    private RecordingSocket connect(String id) throws IOException {
        RecordingSocket socket = new RecordingSocket(id, Map.of("sessionId", "s1", "terminalKind", "shell"));
        handler.afterConnectionEstablished(socket.session());
        eventLoop.run(() -> { });
        return socket;
    }

    private static String outputOf(RecordingSocket socket) {
        return socket.frames().stream()
                .filter(node -> "terminal:output".equals(node.path("type").asText()))
                .map(node -> node.path("data").asText())
                .collect(Collectors.joining());
    }

    private static void awaitOutput(RecordingSocket socket, String expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!outputOf(socket).contains(expected) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Should show a second viewer the output of input typed by the first")
    void twoViewers_ShareOutput() throws Exception {
        manager.start("s1", workDir.toString(), new SessionConfig(), TerminalKind.SHELL);
        RecordingSocket alice = connect("a");

        List<JsonNode> greeting = alice.frames();
        assertThat(alice.types()).containsExactly("connection:established", "session:status");
        assertThat(greeting.get(1).path("status").asText()).isEqualTo("running");

        handler.handleMessage(alice.session(), new TextMessage("{\"type\":\"terminal:input\",\"data\":\"echo hi\\n\"}"));
        eventLoop.run(() -> { });
        assertThat(launched.get(0).typed()).isEqualTo("echo hi\n");

        RecordingSocket bob = connect("b");
        launched.get(0).emit("hi\r\n");
        awaitOutput(bob, "hi");
        awaitOutput(alice, "hi");

        assertThat(outputOf(bob)).isEqualTo("hi\r\n");
        assertThat(outputOf(alice)).isEqualTo("hi\r\n");
    }

    @Test
    @DisplayName("Should replay scrollback to a late viewer before any live output")
    void lateViewer_GetsScrollbackFirst() throws Exception {
        manager.start("s1", workDir.toString(), new SessionConfig(), TerminalKind.SHELL);
        RecordingSocket early = connect("a");
        launched.get(0).emit("line1\nline2");
        awaitOutput(early, "line2");

        RecordingSocket late = connect("b");
        launched.get(0).emit("\nline3");
        awaitOutput(late, "line3");

        List<String> types = late.types();
        assertThat(types.subList(0, 3)).containsExactly("connection:established", "terminal:scrollback", "session:status");
        assertThat(late.frames().get(1).path("data").get(1).asText()).isEqualTo("line2");
        assertThat(outputOf(late)).isEqualTo("\nline3");
    }

    @Test
    @DisplayName("Should tell every viewer when the process exits")
    void exit_BroadcastToViewers() throws Exception {
        manager.start("s1", workDir.toString(), new SessionConfig(), TerminalKind.SHELL);
        RecordingSocket viewer = connect("a");

        launched.get(0).exit(0);
        long deadline = System.currentTimeMillis() + 5000;
        while (manager.isRunning("s1", TerminalKind.SHELL) && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertThat(viewer.last().path("type").asText()).isEqualTo("session:status");
        assertThat(viewer.last().path("status").asText()).isEqualTo("idle");
        assertThat(viewer.last().path("exitCode").asInt()).isZero();
    }
}
