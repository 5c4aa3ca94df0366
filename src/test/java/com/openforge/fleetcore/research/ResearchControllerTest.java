package com.openforge.fleetcore.research;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ResearchControllerTest {

    private ResearchLoopService loopService;
    private ResearchRunRegistry registry;
    private ExecutorService     executor;
    private MockMvc             mockMvc;

    @BeforeEach
    void setUp() {
        loopService = mock(ResearchLoopService.class);
        registry    = new ResearchRunRegistry(ResearchProperties.of(3, 30));
        executor    = mock(ExecutorService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ResearchController(loopService, registry, executor))
                .build();
    }

    @Test
    void startSubmitsTheLoopAndReturnsCreated() throws Exception {
        ResearchRun run = registry.register(new ResearchRun("s1", "MV Ever Given owner", "Ever Given", ""));
        when(loopService.createRun("s1", "MV Ever Given owner", null)).thenReturn(run);

        mockMvc.perform(post("/api/research/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s1\", \"query\": \"MV Ever Given owner\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.runId").value(run.getRunId()))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.wsSubscribePath").value("/topic/research/" + run.getRunId()));
        verify(executor).submit(any(Runnable.class));
    }

    @Test
    void busySessionIsAConflict() throws Exception {
        when(loopService.createRun(any(), any(), any()))
                .thenThrow(new ResearchRunRegistry.ActiveRunException("busy"));

        mockMvc.perform(post("/api/research/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s1\", \"query\": \"q\"}"))
                .andExpect(status().isConflict());
        verifyNoInteractions(executor);
    }

    @Test
    void fullExecutorIsUnavailableAndFreesTheSession() throws Exception {
        ResearchRun run = registry.register(new ResearchRun("s1", "MV Ever Given owner", "Ever Given", ""));
        when(loopService.createRun("s1", "MV Ever Given owner", null)).thenReturn(run);
        when(executor.submit(any(Runnable.class))).thenThrow(new RejectedExecutionException("queue full"));

        mockMvc.perform(post("/api/research/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s1\", \"query\": \"MV Ever Given owner\"}"))
                .andExpect(status().isServiceUnavailable());

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(registry.findActiveForSession("s1")).isEmpty();
    }

    @Test
    void blankQueryIsRejected() throws Exception {
        mockMvc.perform(post("/api/research/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\": \"s1\", \"query\": \" \"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(loopService);
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/research/runs/missing")).andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/research/runs/missing")).andExpect(status().isNotFound());
    }

    @Test
    void cancelPendingRunThenConflict() throws Exception {
        ResearchRun run = registry.register(new ResearchRun("s1", "q", "e", ""));

        mockMvc.perform(delete("/api/research/runs/" + run.getRunId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
        mockMvc.perform(delete("/api/research/runs/" + run.getRunId()))
                .andExpect(status().isConflict());
    }
}
