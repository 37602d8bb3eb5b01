package com.narrativelens.backend.config;

import com.narrativelens.backend.model.enums.NarrativeLabel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Keyword table and scoring constants for narrative labels.
 * <p>
 * The weights and thresholds are heuristics carried over from the monitoring dashboard; they are
 * exposed here so a trained classifier can replace them without touching the scorer.
 */
@Component
@ConfigurationProperties(prefix = "labeling")
@Data
public class LabelingConfig {

    private double keywordWeight = 0.2;
    private double strongLabelThreshold = 0.3;
    private double factualBaseline = 0.7;
    private double neutralBaseline = 0.6;
    private double fallbackJitter = 0.1;

    private Map<NarrativeLabel, List<String>> keywords = defaultKeywords();

    private static Map<NarrativeLabel, List<String>> defaultKeywords() {
        Map<NarrativeLabel, List<String>> table = new EnumMap<>(NarrativeLabel.class);
        table.put(NarrativeLabel.PRO_RUSSIA, List.of(
                "russia", "kremlin", "putin", "russian forces", "moscow", "russian influence", "russia partnership"));
        table.put(NarrativeLabel.ANTI_WEST, List.of(
                "western sanctions", "western interference", "nato", "eu policy", "western powers",
                "western interests", "western hypocrisy"));
        table.put(NarrativeLabel.ANTI_FRANCE, List.of(
                "france colonialism", "french influence", "paris policy", "french troops", "francafrique",
                "anti-france sentiment", "french withdrawal"));
        table.put(NarrativeLabel.ANTI_US, List.of(
                "anti-american", "us aggression", "us interference", "us sanctions", "american hegemony",
                "us imperialism", "us military presence", "us meddling", "us failed policy", "us-led",
                "criticism of us", "condemn us", "us withdraw"));
        table.put(NarrativeLabel.SENSATIONALIST, List.of(
                "shocking", "urgent", "breaking news", "exclusive", "bombshell", "crisis", "scandal",
                "explosive", "reveal", "warning", "catastrophe", "unprecedented"));
        table.put(NarrativeLabel.OPINION, List.of(
                "opinion", "analysis", "commentary", "viewpoint", "perspective", "column", "editorial",
                "blog", "critique"));
        table.put(NarrativeLabel.BUSINESS, List.of(
                "economy", "business", "market", "finance", "investment", "trade", "growth", "industry",
                "currency", "revenue", "jobs", "commerce", "development"));
        table.put(NarrativeLabel.POLITICS, List.of(
                "government", "election", "parliament", "president", "policy", "diplomacy", "governance",
                "democracy", "coup", "protest", "legislation", "political party", "reforms"));
        return table;
    }
}
