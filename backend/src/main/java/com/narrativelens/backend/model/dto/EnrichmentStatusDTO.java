package com.narrativelens.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for asynchronous pipeline task status responses
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentStatusDTO {
    private String taskId;
    private String status; // RUNNING, COMPLETED, CANCELLED, FAILED
    private Integer totalArticles;
    private Double progressPercentage;
    private String lastMessage;
    private String startedAt;
    private String completedAt;
    private String error;
    private EnrichmentReport report;
}
