package com.narrativelens.backend.pipeline;

import com.narrativelens.backend.model.dto.EnrichmentReport;
import com.narrativelens.backend.model.entity.Article;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PipelineResult {
    private final List<Article> articles;
    private final EnrichmentReport report;
}
