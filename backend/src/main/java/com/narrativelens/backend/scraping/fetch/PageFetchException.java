package com.narrativelens.backend.scraping.fetch;

import lombok.Getter;

/**
 * A single failed attempt to load a page, classified so the retry loop can tell transient
 * failures from terminal ones.
 */
@Getter
public class PageFetchException extends Exception {

    private final FetchFailureCategory category;

    public PageFetchException(String message, FetchFailureCategory category) {
        super(message);
        this.category = category;
    }

    public PageFetchException(String message, Throwable cause, FetchFailureCategory category) {
        super(message, cause);
        this.category = category;
    }
}
