package com.narrativelens.backend.pipeline;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.narrativelens.backend.config.LabelingConfig;
import com.narrativelens.backend.enrichment.EnrichmentService;
import com.narrativelens.backend.labeling.LabelScoringService;
import com.narrativelens.backend.model.dto.EnrichmentStatusDTO;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class EnrichmentControllerTest {

    private static final String BODY = """
            [{"headline": "Putin says Russia will deepen ties", "url": "https://news.example.com/a",
              "datePublished": "2025-08-28 14:52:06"}]""";

    @Mock
    private ArticlePipelineService pipelineService;

    @Mock
    private EnrichmentService enrichmentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        LabelScoringService labelScoringService = new LabelScoringService(new LabelingConfig(), new Random(1));
        mockMvc = MockMvcBuilders
                .standaloneSetup(new EnrichmentController(pipelineService, enrichmentService, labelScoringService))
                .build();
    }

    @Test
    void shouldScoreLabelsWithoutEnrichment() throws Exception {
        mockMvc.perform(post("/api/enrichment/labels").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].datePublished").value("2025-08-28"))
                .andExpect(jsonPath("$[0].labelScores['Pro-Russia']").value(0.4))
                .andExpect(jsonPath("$[0].labelScores['Factual']").value(0.0));
    }

    @Test
    void shouldStartAsyncRun() throws Exception {
        when(pipelineService.newTaskId()).thenReturn("pipeline-1234abcd");

        mockMvc.perform(post("/api/enrichment/run-async").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.taskId").value("pipeline-1234abcd"))
                .andExpect(jsonPath("$.statusUrl").value("/api/enrichment/status/pipeline-1234abcd"));

        verify(pipelineService).executeAsync(eq("pipeline-1234abcd"), anyList());
    }

    @Test
    void shouldAnswerTooManyRequestsWhenExecutorIsSaturated() throws Exception {
        when(pipelineService.newTaskId()).thenReturn("pipeline-full");
        when(pipelineService.executeAsync(eq("pipeline-full"), anyList()))
                .thenThrow(new RejectedExecutionException("queue full"));

        mockMvc.perform(post("/api/enrichment/run-async").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void shouldReturnTaskStatus() throws Exception {
        EnrichmentStatusDTO dto = new EnrichmentStatusDTO();
        dto.setTaskId("pipeline-1");
        dto.setStatus("RUNNING");
        when(pipelineService.getTaskStatus("pipeline-1")).thenReturn(dto);

        mockMvc.perform(get("/api/enrichment/status/pipeline-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    void shouldReturnNotFoundForUnknownTask() throws Exception {
        mockMvc.perform(get("/api/enrichment/status/pipeline-none"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectCancelOfFinishedTask() throws Exception {
        when(pipelineService.requestCancel("pipeline-1")).thenReturn(false);

        mockMvc.perform(post("/api/enrichment/cancel/pipeline-1"))
                .andExpect(status().isConflict());
    }

    @Test
    void shouldExposeAndClearCache() throws Exception {
        when(enrichmentService.getCacheStats()).thenReturn(Map.of("entries", 3L));

        mockMvc.perform(get("/api/enrichment/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries").value(3));
        mockMvc.perform(delete("/api/enrichment/cache"))
                .andExpect(status().isOk());

        verify(enrichmentService).clearCache();
    }
}
