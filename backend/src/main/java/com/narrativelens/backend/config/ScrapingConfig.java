package com.narrativelens.backend.config;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "scraping")
@Data
public class ScrapingConfig {

    // Master switch; when off every article goes straight to the fallback values
    private boolean enabled = true;

    // "http" (Jsoup) or "browser" (Selenium)
    private String fetcher = "http";

    // Default configurations
    private double defaultDelay = 1.0;
    private int defaultMaxRetries = 3;
    private int defaultTimeout = 15;
    private boolean parallelEnabled = true;
    private int maxConcurrentFetches = 4;

    // Snippet sizing
    private int snippetMaxLength = 500;
    private int summarizerSnippetMaxLength = 1000;
    private int headlineFallbackLength = 250;
    private String truncationMarker = "...";
    private String noSnippetText = "No snippet available";

    // Default headers for HTTP requests
    private Map<String, String> defaultHeaders = Map.of(
            "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.5",
            "Accept-Encoding", "gzip, deflate"
    );

    // Article body containers in priority order, CMS variants last
    private List<String> articleBodySelectors = Arrays.asList(
            "article",
            "div.article-body", "div.content-body", "div.story-content", "div.main-content",
            "div[itemprop=articleBody]", "div.entry-content", "div.post-content",
            "div.td-post-content", "div.field-name-body"
    );

    // Image URL patterns that mark non-content images
    private List<String> excludedImagePatterns = Arrays.asList(
            "logo", "ad.", "/ads/", "advert", "banner", "sponsor", "doubleclick",
            "favicon", "icon", ".gif", "pixel", "tracking", "spacer", "avatar"
    );

    // Subset applied to fallback images, which are branding images by construction
    private List<String> fallbackExcludedImagePatterns = Arrays.asList(
            "ad.", "/ads/", "advert", "sponsor", "doubleclick", ".gif", "pixel", "tracking"
    );

    // Fallback image chain, {domain} is replaced by the article host.
    // No public logo service is assumed; an empty logo template goes straight to the favicon.
    private String logoUrlTemplate = "";
    private String faviconUrlTemplate = "https://www.google.com/s2/favicons?domain={domain}&sz=128";
    private String placeholderImageUrl = "https://placehold.co/600x400?text=No+Image";

    public int effectiveConcurrency() {
        return parallelEnabled ? Math.max(1, maxConcurrentFetches) : 1;
    }
}
