package com.narrativelens.backend.labeling;

import com.narrativelens.backend.config.LabelingConfig;
import com.narrativelens.backend.model.entity.Article;
import com.narrativelens.backend.model.enums.NarrativeLabel;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Keyword-based narrative label scores.
 * <p>
 * Each keyword found as a whole word in the lower-cased headline and text adds
 * {@code keywordWeight} to its label, capped at 1.0. When no label reaches the strong threshold
 * the article is marked Factual/Neutral around fixed baselines with a small uniform jitter.
 * The only state touched is the injected random source.
 */
@Service
@Slf4j
public class LabelScoringService {

    private final LabelingConfig config;
    private final Random random;

    @Autowired
    public LabelScoringService(LabelingConfig config) {
        this(config, new Random());
    }

    public LabelScoringService(LabelingConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    public Map<NarrativeLabel, Double> score(Article article) {
        Map<NarrativeLabel, Double> scores = new EnumMap<>(NarrativeLabel.class);
        for (NarrativeLabel label : NarrativeLabel.values()) {
            scores.put(label, 0.0);
        }

        String combined = combinedText(article);
        boolean foundStrongLabel = false;

        for (Map.Entry<NarrativeLabel, List<String>> entry : config.getKeywords().entrySet()) {
            if (entry.getKey().isCatchAll() || entry.getValue() == null) {
                continue;
            }
            int hits = 0;
            for (String keyword : entry.getValue()) {
                if (containsWord(combined, keyword)) {
                    hits++;
                }
            }
            if (hits > 0) {
                double score = Math.min(hits * config.getKeywordWeight(), 1.0);
                scores.put(entry.getKey(), score);
                if (score >= config.getStrongLabelThreshold()) {
                    foundStrongLabel = true;
                }
            }
        }

        if (!foundStrongLabel) {
            scores.put(NarrativeLabel.FACTUAL, config.getFactualBaseline() + jitter());
            scores.put(NarrativeLabel.NEUTRAL, config.getNeutralBaseline() + jitter());
        }

        scores.replaceAll((label, value) -> clip(value));
        return scores;
    }

    public List<Article> scoreAll(List<Article> articles) {
        for (Article article : articles) {
            article.setLabelScores(score(article));
        }
        log.debug("Assigned label scores to {} articles", articles.size());
        return articles;
    }

    /**
     * Word match bounded by spaces or by the start/end of the text. Punctuation is not a boundary.
     */
    static boolean containsWord(String text, String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return false;
        }
        String kw = keyword.toLowerCase(Locale.ROOT);
        return text.equals(kw)
                || text.contains(" " + kw + " ")
                || text.startsWith(kw + " ")
                || text.endsWith(" " + kw);
    }

    private static String combinedText(Article article) {
        String headline = article.getHeadline() != null ? article.getHeadline() : "";
        String text = article.getText() != null ? article.getText() : "";
        return (headline.toLowerCase(Locale.ROOT) + " " + text.toLowerCase(Locale.ROOT));
    }

    // Uniform in [-fallbackJitter, +fallbackJitter]
    private double jitter() {
        return (random.nextDouble() * 2 - 1) * config.getFallbackJitter();
    }

    private static double clip(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
