package com.narrativelens.backend.model.dto;

import com.narrativelens.backend.model.entity.Article;
import com.narrativelens.backend.model.enums.NarrativeLabel;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArticleDTO {

    // Export format of the ingestion CSV, e.g. 2025-08-28 14:52:06.123456
    private static final DateTimeFormatter EXPORT_TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private String headline;
    private String url;
    private String sourceName;
    private String datePublished;
    private String text;
    private String imageUrl;
    private Map<String, Double> labelScores;

    public Article toArticle() {
        return Article.builder()
                .headline(headline)
                .url(url)
                .sourceName(sourceName)
                .datePublished(parseDate(datePublished))
                .text(text)
                .imageUrl(imageUrl)
                .build();
    }

    public static ArticleDTO fromArticle(Article article) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (NarrativeLabel label : NarrativeLabel.values()) {
            scores.put(label.getDisplayName(), article.getLabelScores().getOrDefault(label, 0.0));
        }
        return new ArticleDTO(
                article.getHeadline(),
                article.getUrl(),
                article.getSourceName(),
                article.getDatePublished() != null ? article.getDatePublished().toString() : null,
                article.getText(),
                article.getImageUrl(),
                scores);
    }

    /**
     * Parse an ingestion date, coercing anything unparsable to null
     */
    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException ignored) {
            // not a plain ISO date, try the timestamp layouts below
        }
        try {
            return LocalDateTime.parse(trimmed, EXPORT_TIMESTAMP).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // fall through to ISO timestamp
        }
        try {
            return LocalDateTime.parse(trimmed).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
