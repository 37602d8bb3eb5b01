package com.narrativelens.backend.pipeline;

import com.narrativelens.backend.enrichment.EnrichmentService;
import com.narrativelens.backend.labeling.LabelScoringService;
import com.narrativelens.backend.model.dto.ArticleDTO;
import com.narrativelens.backend.model.dto.EnrichmentStatusDTO;
import com.narrativelens.backend.model.dto.PipelineResultDTO;
import com.narrativelens.backend.model.entity.Article;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for enrichment and labeling runs
 */
@RestController
@RequestMapping("/api/enrichment")
@RequiredArgsConstructor
@Slf4j
@Validated
public class EnrichmentController {

    private final ArticlePipelineService pipelineService;
    private final EnrichmentService enrichmentService;
    private final LabelScoringService labelScoringService;

    /**
     * Enrich and label a batch synchronously
     */
    @PostMapping("/run")
    public ResponseEntity<?> run(@RequestBody @NotEmpty List<ArticleDTO> request) {
        try {
            List<Article> articles = request.stream().map(ArticleDTO::toArticle).toList();
            PipelineResult result = pipelineService.execute(articles, null);
            return ResponseEntity.ok(toDto(result));

        } catch (Exception e) {
            log.error("Error during synchronous pipeline run", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Pipeline failed: " + e.getMessage()));
        }
    }

    /**
     * Start a pipeline run in the background
     */
    @PostMapping("/run-async")
    public ResponseEntity<?> runAsync(@RequestBody @NotEmpty List<ArticleDTO> request) {
        try {
            List<Article> articles = request.stream().map(ArticleDTO::toArticle).toList();
            String taskId = pipelineService.newTaskId();
            pipelineService.executeAsync(taskId, articles);

            return ResponseEntity.accepted().body(Map.of(
                    "message", "Pipeline started",
                    "taskId", taskId,
                    "statusUrl", "/api/enrichment/status/" + taskId
            ));

        } catch (RejectedExecutionException e) {
            log.warn("Pipeline executor saturated: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(Map.of("error", "Too many pipeline runs in progress"));
        } catch (Exception e) {
            log.error("Error starting async pipeline run", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Failed to start pipeline: " + e.getMessage()));
        }
    }

    @GetMapping("/status/{taskId}")
    public ResponseEntity<?> getStatus(@PathVariable String taskId) {
        EnrichmentStatusDTO status = pipelineService.getTaskStatus(taskId);
        if (status == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(status);
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, EnrichmentStatusDTO>> getAllStatuses() {
        return ResponseEntity.ok(pipelineService.getAllTaskStatuses());
    }

    @PostMapping("/cancel/{taskId}")
    public ResponseEntity<?> cancel(@PathVariable String taskId) {
        if (!pipelineService.requestCancel(taskId)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Task is not running: " + taskId));
        }
        return ResponseEntity.ok(Map.of("message", "Cancellation requested", "taskId", taskId));
    }

    /**
     * Score labels only, without fetching anything
     */
    @PostMapping("/labels")
    public ResponseEntity<List<ArticleDTO>> labels(@RequestBody @NotEmpty List<ArticleDTO> request) {
        List<Article> articles = request.stream().map(ArticleDTO::toArticle).toList();
        labelScoringService.scoreAll(articles);
        return ResponseEntity.ok(articles.stream().map(ArticleDTO::fromArticle).toList());
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> cacheStats() {
        return ResponseEntity.ok(enrichmentService.getCacheStats());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, String>> clearCache() {
        enrichmentService.clearCache();
        return ResponseEntity.ok(Map.of("message", "Enrichment cache cleared"));
    }

    private PipelineResultDTO toDto(PipelineResult result) {
        return new PipelineResultDTO(
                result.getArticles().stream().map(ArticleDTO::fromArticle).toList(),
                result.getReport());
    }
}
