package com.narrativelens.backend.model.entity;

import com.narrativelens.backend.model.enums.NarrativeLabel;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A news article row as handed over by ingestion. The enrichment stage fills {@code text} and
 * {@code imageUrl} in place, the labeling stage fills {@code labelScores}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    private String headline;
    private String url;
    private String sourceName;
    private LocalDate datePublished;
    private String text;
    private String imageUrl;

    @Builder.Default
    private Map<NarrativeLabel, Double> labelScores = new EnumMap<>(NarrativeLabel.class);

    public boolean needsText() {
        return isMissing(text);
    }

    public boolean needsImage() {
        return isMissing(imageUrl);
    }

    // Ingestion exports write absent values as the literal "None"
    private static boolean isMissing(String value) {
        return value == null || value.isBlank() || "None".equals(value.trim());
    }
}
