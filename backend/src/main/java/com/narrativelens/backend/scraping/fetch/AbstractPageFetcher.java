package com.narrativelens.backend.scraping.fetch;

import java.time.Duration;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Retry loop shared by the fetcher implementations: linear backoff for transient failures, no
 * retry at all for terminal ones.
 */
@Slf4j
public abstract class AbstractPageFetcher implements PageFetcher {

    protected abstract FetchedPage fetchOnce(String url) throws PageFetchException;

    @Override
    public FetchResult fetch(String url, int maxRetries, Duration baseDelay) {
        if (!hasHttpScheme(url)) {
            return FetchResult.failure(url, FetchFailureCategory.INVALID_URL, 0, "Not an http(s) URL");
        }

        int attempts = Math.max(1, maxRetries);
        PageFetchException lastFailure = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                FetchedPage page = fetchOnce(url);
                if (attempt > 1) {
                    log.debug("Fetched {} on attempt {}", url, attempt);
                }
                return FetchResult.success(url, page, attempt);
            } catch (PageFetchException e) {
                lastFailure = e;
                if (!e.getCategory().isRetryable()) {
                    log.debug("Terminal failure for {}: {} ({})", url, e.getMessage(), e.getCategory());
                    return FetchResult.failure(url, e.getCategory(), attempt, e.getMessage());
                }
                log.debug("Attempt {}/{} failed for {}: {} ({})", attempt, attempts, url, e.getMessage(), e.getCategory());
                if (attempt < attempts && !pause(baseDelay.multipliedBy(attempt))) {
                    log.debug("Interrupted while backing off from {}", url);
                    return FetchResult.interrupted(url, e.getCategory(), attempt);
                }
            }
        }

        log.debug("Giving up on {} after {} attempts", url, attempts);
        return FetchResult.failure(url, lastFailure.getCategory(), attempts, lastFailure.getMessage());
    }

    private static boolean hasHttpScheme(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
