package com.narrativelens.backend.scraping.fetch;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(exclude = "html")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchResult {

    private final String url;
    private final boolean success;
    private final String html;
    private final String finalUrl;
    private final FetchFailureCategory failureCategory;
    private final int attempts;
    private final String message;
    // Interrupted before a verdict was reached; says nothing about the page itself
    private final boolean interrupted;

    public static FetchResult success(String url, FetchedPage page, int attempts) {
        return new FetchResult(url, true, page.getHtml(), page.getFinalUrl(), null, attempts, null, false);
    }

    public static FetchResult failure(String url, FetchFailureCategory category, int attempts, String message) {
        return new FetchResult(url, false, null, null, category, attempts, message, false);
    }

    public static FetchResult interrupted(String url, FetchFailureCategory lastCategory, int attempts) {
        return new FetchResult(url, false, null, null, lastCategory, attempts, "Interrupted while backing off", true);
    }

    /**
     * Base URL for resolving relative links in the page
     */
    public String getBaseUrl() {
        return finalUrl != null && !finalUrl.isBlank() ? finalUrl : url;
    }
}
