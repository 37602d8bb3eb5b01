package com.narrativelens.backend.enrichment;

import com.narrativelens.backend.config.ScrapingConfig;
import com.narrativelens.backend.scraping.ImageValidator;
import java.net.URI;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Terminal values for articles whose page yielded nothing usable. Both chains always end in a
 * non-empty value.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FallbackValueResolver {

    private final ScrapingConfig scrapingConfig;
    private final ImageValidator imageValidator;

    public String fallbackText(String headline) {
        if (headline == null || headline.isBlank() || "None".equals(headline.trim())) {
            return scrapingConfig.getNoSnippetText();
        }
        String trimmed = headline.trim();
        int limit = Math.min(trimmed.length(), scrapingConfig.getHeadlineFallbackLength());
        return trimmed.substring(0, limit) + scrapingConfig.getTruncationMarker();
    }

    /**
     * Domain logo, then favicon, then the generic placeholder
     */
    public String fallbackImage(String articleUrl) {
        String domain = extractDomain(articleUrl);
        if (domain != null) {
            String logo = fromTemplate(scrapingConfig.getLogoUrlTemplate(), domain);
            if (imageValidator.isUsableFallback(logo)) {
                return logo;
            }
            String favicon = fromTemplate(scrapingConfig.getFaviconUrlTemplate(), domain);
            if (imageValidator.isUsableFallback(favicon)) {
                return favicon;
            }
        }
        return scrapingConfig.getPlaceholderImageUrl();
    }

    private static String fromTemplate(String template, String domain) {
        if (template == null || template.isBlank()) {
            return null;
        }
        return template.replace("{domain}", domain);
    }

    String extractDomain(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null || host.isBlank()) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            log.debug("Cannot derive domain from {}: {}", url, e.getMessage());
            return null;
        }
    }
}
