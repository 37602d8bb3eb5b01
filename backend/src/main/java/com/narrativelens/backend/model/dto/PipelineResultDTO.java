package com.narrativelens.backend.model.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResultDTO {
    private List<ArticleDTO> articles;
    private EnrichmentReport report;
}
