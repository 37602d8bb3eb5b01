package com.narrativelens.backend.scraping.fetch;

import java.time.Duration;

/**
 * Loads the HTML of an article page. Implementations never throw; every outcome, including
 * exhausted retries, is reported through the returned {@link FetchResult}.
 */
public interface PageFetcher {

    /**
     * @param url        page to load
     * @param maxRetries total number of attempts for retryable failures
     * @param baseDelay  backoff unit, attempt {@code n} is followed by a pause of {@code baseDelay * n}
     */
    FetchResult fetch(String url, int maxRetries, Duration baseDelay);
}
