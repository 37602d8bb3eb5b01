package com.narrativelens.backend.model.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.narrativelens.backend.model.entity.Article;
import com.narrativelens.backend.model.enums.NarrativeLabel;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ArticleDTOTest {

    @Test
    void shouldParseSupportedDateLayouts() {
        assertThat(ArticleDTO.parseDate("2025-08-28")).isEqualTo(LocalDate.of(2025, 8, 28));
        assertThat(ArticleDTO.parseDate("2025-08-28 14:52:06")).isEqualTo(LocalDate.of(2025, 8, 28));
        assertThat(ArticleDTO.parseDate("2025-08-28 14:52:06.123456")).isEqualTo(LocalDate.of(2025, 8, 28));
        assertThat(ArticleDTO.parseDate("2025-08-28T14:52:06")).isEqualTo(LocalDate.of(2025, 8, 28));
    }

    @Test
    void shouldCoerceUnparsableDatesToNull() {
        assertThat(ArticleDTO.parseDate("yesterday")).isNull();
        assertThat(ArticleDTO.parseDate("28/08/2025")).isNull();
        assertThat(ArticleDTO.parseDate(" ")).isNull();
        assertThat(ArticleDTO.parseDate(null)).isNull();
    }

    @Test
    void shouldConvertToArticle() {
        ArticleDTO dto = new ArticleDTO();
        dto.setHeadline("Mali summit");
        dto.setUrl("https://news.example.com/a");
        dto.setDatePublished("not a date");

        Article article = dto.toArticle();

        assertThat(article.getHeadline()).isEqualTo("Mali summit");
        assertThat(article.getDatePublished()).isNull();
        assertThat(article.needsText()).isTrue();
    }

    @Test
    void shouldExposeEveryLabelInFixedOrder() {
        Article article = Article.builder().headline("A").datePublished(LocalDate.of(2025, 1, 2)).build();
        article.getLabelScores().put(NarrativeLabel.POLITICS, 0.4);

        ArticleDTO dto = ArticleDTO.fromArticle(article);

        assertThat(dto.getDatePublished()).isEqualTo("2025-01-02");
        assertThat(dto.getLabelScores()).hasSize(NarrativeLabel.values().length);
        assertThat(dto.getLabelScores().keySet()).first().isEqualTo(NarrativeLabel.FACTUAL.getDisplayName());
        assertThat(dto.getLabelScores()).containsEntry(NarrativeLabel.POLITICS.getDisplayName(), 0.4);
        assertThat(dto.getLabelScores()).containsEntry(NarrativeLabel.NEUTRAL.getDisplayName(), 0.0);
    }
}
