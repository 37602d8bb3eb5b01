package com.narrativelens.backend.scraping;

import com.narrativelens.backend.config.ScrapingConfig;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Rejects image URLs that point at logos, ads, icons and tracking pixels rather than article
 * photos.
 */
@Component
@RequiredArgsConstructor
public class ImageValidator {

    private final ScrapingConfig scrapingConfig;

    public boolean isValidImage(String imageUrl) {
        return isWellFormed(imageUrl) && !matchesAny(imageUrl, scrapingConfig.getExcludedImagePatterns());
    }

    /**
     * Looser check for the domain logo and favicon fallbacks, which only need to be free of ad and
     * tracking markers.
     */
    public boolean isUsableFallback(String imageUrl) {
        return isWellFormed(imageUrl) && !matchesAny(imageUrl, scrapingConfig.getFallbackExcludedImagePatterns());
    }

    private boolean isWellFormed(String imageUrl) {
        if (imageUrl == null || imageUrl.isBlank()) {
            return false;
        }
        String lower = imageUrl.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") || lower.startsWith("//");
    }

    private boolean matchesAny(String imageUrl, List<String> patterns) {
        String lower = imageUrl.toLowerCase(Locale.ROOT);
        return patterns.stream().anyMatch(pattern -> lower.contains(pattern.toLowerCase(Locale.ROOT)));
    }
}
