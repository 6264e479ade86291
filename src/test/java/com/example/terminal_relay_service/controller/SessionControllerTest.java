package com.example.terminal_relay_service.controller;

import com.example.terminal_relay_service.dto.SessionConfig;
import com.example.terminal_relay_service.dto.SessionKey;
import com.example.terminal_relay_service.dto.SessionStatus;
import com.example.terminal_relay_service.dto.TerminalKind;
import com.example.terminal_relay_service.exception.ExecutableNotFoundException;
import com.example.terminal_relay_service.exception.InvalidWorkDirectoryException;
import com.example.terminal_relay_service.exception.SessionAlreadyRunningException;
import com.example.terminal_relay_service.service.ProcessSessionManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProcessSessionManager processSessionManager;

    @Test
    @DisplayName("Should start the primary agent and return its pid")
    void start_PrimaryAgent() throws Exception {
        when(processSessionManager.start(eq("s1"), eq("/work"), any(), eq(TerminalKind.PRIMARY_AGENT))).thenReturn(4242L);

        mockMvc.perform(post("/sessions/s1/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectPath\":\"/work\",\"config\":{\"cols\":100,\"rows\":40,\"env\":{\"A\":\"1\"}},\"userId\":\"u7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.pid").value(4242));

        ArgumentCaptor<SessionConfig> config = ArgumentCaptor.forClass(SessionConfig.class);
        verify(processSessionManager).start(eq("s1"), eq("/work"), config.capture(), eq(TerminalKind.PRIMARY_AGENT));
        assertThat(config.getValue().getCols()).isEqualTo(100);
        assertThat(config.getValue().getEnv()).containsEntry("A", "1");
        assertThat(config.getValue().getUserId()).isEqualTo("u7");
    }

    @Test
    @DisplayName("Should route shell and codex starts to their terminal kinds")
    void start_ShellAndCodex() throws Exception {
        when(processSessionManager.start(anyString(), anyString(), any(), any())).thenReturn(1L);

        mockMvc.perform(post("/sessions/s1/shell/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectPath\":\"/work\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/sessions/s1/codex/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"projectPath\":\"/work\"}"))
                .andExpect(status().isOk());

        verify(processSessionManager).start(eq("s1"), eq("/work"), any(), eq(TerminalKind.SHELL));
        verify(processSessionManager).start(eq("s1"), eq("/work"), any(), eq(TerminalKind.SECONDARY_AGENT));
    }

    @Test
    @DisplayName("Should answer 400 when projectPath is missing")
    void start_MissingProjectPath() throws Exception {
        mockMvc.perform(post("/sessions/s1/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("projectPath is required"));

        verify(processSessionManager, never()).start(anyString(), anyString(), any(), any());
    }

    @Test
    @DisplayName("Should answer 400 for caller errors and 500 for spawn errors")
    void start_ErrorMapping() throws Exception {
        when(processSessionManager.start(eq("busy"), anyString(), any(), any()))
                .thenThrow(new SessionAlreadyRunningException(SessionKey.of("busy", TerminalKind.PRIMARY_AGENT)));
        when(processSessionManager.start(eq("nodir"), anyString(), any(), any()))
                .thenThrow(new InvalidWorkDirectoryException("/nope"));
        when(processSessionManager.start(eq("nobin"), anyString(), any(), any()))
                .thenThrow(new ExecutableNotFoundException(List.of("claude")));

        mockMvc.perform(post("/sessions/busy/start").contentType(MediaType.APPLICATION_JSON).content("{\"projectPath\":\"/w\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("ALREADY_RUNNING"));
        mockMvc.perform(post("/sessions/nodir/start").contentType(MediaType.APPLICATION_JSON).content("{\"projectPath\":\"/w\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
        mockMvc.perform(post("/sessions/nobin/start").contentType(MediaType.APPLICATION_JSON).content("{\"projectPath\":\"/w\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("EXECUTABLE_NOT_FOUND"));
    }

    @Test
    @DisplayName("Should stop a running process and pass the force flag through")
    void stop_Running() throws Exception {
        when(processSessionManager.isRunning("s1", TerminalKind.SHELL)).thenReturn(true);

        mockMvc.perform(post("/sessions/s1/shell/stop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"force\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(processSessionManager).stop("s1", TerminalKind.SHELL, true);
    }

    @Test
    @DisplayName("Should answer 400 when stopping an idle key")
    void stop_NotRunning() throws Exception {
        mockMvc.perform(post("/sessions/s1/stop"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Session is not running"));

        verify(processSessionManager, never()).stop(anyString(), any(), anyBoolean());
    }

    @Test
    @DisplayName("Should report status, pid and the running flag")
    void status_Reported() throws Exception {
        when(processSessionManager.isRunning("s1", TerminalKind.SECONDARY_AGENT)).thenReturn(true);
        when(processSessionManager.getStatus("s1", TerminalKind.SECONDARY_AGENT)).thenReturn(SessionStatus.RUNNING);
        when(processSessionManager.getPid("s1", TerminalKind.SECONDARY_AGENT)).thenReturn(Optional.of(99L));
        when(processSessionManager.getStatus("s1", TerminalKind.PRIMARY_AGENT)).thenReturn(SessionStatus.IDLE);
        when(processSessionManager.getPid("s1", TerminalKind.PRIMARY_AGENT)).thenReturn(Optional.empty());

        mockMvc.perform(get("/sessions/s1/codex/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.pid").value(99));
        mockMvc.perform(get("/sessions/s1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false))
                .andExpect(jsonPath("$.status").value("idle"))
                .andExpect(jsonPath("$.pid").doesNotExist());
    }

    @Test
    @DisplayName("Should list running session keys")
    void list_RunningSessions() throws Exception {
        when(processSessionManager.getRunningSessions())
                .thenReturn(List.of(SessionKey.of("s1", TerminalKind.SHELL)));

        mockMvc.perform(get("/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sessionId").value("s1"))
                .andExpect(jsonPath("$[0].terminalKind").value("shell"));
    }

    @Test
    @DisplayName("Should answer 404 for an unknown terminal kind")
    void unknownKind_NotFound() throws Exception {
        mockMvc.perform(get("/sessions/s1/vim/status"))
                .andExpect(status().isNotFound());
    }
}
