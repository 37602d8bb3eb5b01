package com.narrativelens.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate outcome of one enrichment batch
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentReport {
    private int totalArticles;
    private int distinctUrls;
    private int fetchedUrls;
    private int cacheHits;
    private int failedSnippets;
    private int failedImages;
    private boolean cancelled;
    private double durationSeconds;

    public boolean hasFailures() {
        return failedSnippets > 0 || failedImages > 0;
    }

    public String failureSummary() {
        return String.format("%d snippets / %d images could not be fetched", failedSnippets, failedImages);
    }

    public static EnrichmentReport empty(int totalArticles) {
        return EnrichmentReport.builder().totalArticles(totalArticles).build();
    }
}
