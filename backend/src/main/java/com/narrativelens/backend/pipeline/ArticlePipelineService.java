package com.narrativelens.backend.pipeline;

import com.narrativelens.backend.enrichment.EnrichmentProgressListener;
import com.narrativelens.backend.enrichment.EnrichmentService;
import com.narrativelens.backend.labeling.LabelScoringService;
import com.narrativelens.backend.model.dto.EnrichmentReport;
import com.narrativelens.backend.model.dto.EnrichmentStatusDTO;
import com.narrativelens.backend.model.entity.Article;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Raw articles → enrichment (network) → label scoring (pure) → final dataset.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticlePipelineService {

    private final EnrichmentService enrichmentService;
    private final LabelScoringService labelScoringService;

    // Store async pipeline task statuses
    private final Map<String, EnrichmentStatusDTO> taskStatuses = new ConcurrentHashMap<>();
    private final Map<String, Boolean> cancelRequests = new ConcurrentHashMap<>();

    public List<Article> run(List<Article> articles) {
        return run(articles, EnrichmentProgressListener.NOOP);
    }

    public List<Article> run(List<Article> articles, EnrichmentProgressListener listener) {
        return execute(articles, listener).getArticles();
    }

    public PipelineResult execute(List<Article> articles, EnrichmentProgressListener listener) {
        log.info("Starting pipeline for {} articles", articles.size());
        EnrichmentReport report = enrichmentService.enrich(articles, listener);
        labelScoringService.scoreAll(articles);
        log.info("Pipeline finished for {} articles", articles.size());
        return new PipelineResult(articles, report);
    }

    public String newTaskId() {
        return "pipeline-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Run the pipeline on the pipeline executor, tracking progress under {@code taskId}
     */
    @Async("pipelineTaskExecutor")
    public CompletableFuture<PipelineResult> executeAsync(String taskId, List<Article> articles) {
        EnrichmentStatusDTO status = new EnrichmentStatusDTO();
        status.setTaskId(taskId);
        status.setStatus("RUNNING");
        status.setTotalArticles(articles.size());
        status.setProgressPercentage(0.0);
        status.setStartedAt(now());
        taskStatuses.put(taskId, status);

        EnrichmentProgressListener listener = new EnrichmentProgressListener() {
            @Override
            public void onProgress(double fraction, String message) {
                status.setProgressPercentage(Math.round(fraction * 1000) / 10.0);
                status.setLastMessage(message);
            }

            @Override
            public boolean isCancelled() {
                return cancelRequests.containsKey(taskId);
            }
        };

        try {
            PipelineResult result = execute(articles, listener);

            status.setStatus(result.getReport().isCancelled() ? "CANCELLED" : "COMPLETED");
            status.setReport(result.getReport());
            status.setCompletedAt(now());
            log.info("Completed async pipeline task {}: {}", taskId, status.getStatus());
            return CompletableFuture.completedFuture(result);

        } catch (Exception e) {
            log.error("Error in async pipeline task {}: {}", taskId, e.getMessage());
            status.setStatus("FAILED");
            status.setError(e.getMessage());
            status.setCompletedAt(now());
            return CompletableFuture.failedFuture(e);
        } finally {
            cancelRequests.remove(taskId);
        }
    }

    public boolean requestCancel(String taskId) {
        EnrichmentStatusDTO status = taskStatuses.get(taskId);
        if (status == null || !"RUNNING".equals(status.getStatus())) {
            return false;
        }
        cancelRequests.put(taskId, Boolean.TRUE);
        return true;
    }

    public EnrichmentStatusDTO getTaskStatus(String taskId) {
        return taskStatuses.get(taskId);
    }

    public Map<String, EnrichmentStatusDTO> getAllTaskStatuses() {
        return new ConcurrentHashMap<>(taskStatuses);
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
