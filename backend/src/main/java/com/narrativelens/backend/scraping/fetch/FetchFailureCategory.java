package com.narrativelens.backend.scraping.fetch;

public enum FetchFailureCategory {
    TIMEOUT(true),            // Connection/read timeout
    CONNECTION_ERROR(true),   // Refused, reset, unknown host and other I/O trouble
    SERVER_ERROR(true),       // 5xx
    RATE_LIMITED(true),       // 429
    RENDER_ERROR(true),       // Browser failed to load the page
    NOT_FOUND(false),         // 404
    ACCESS_FORBIDDEN(false),  // 403
    CLIENT_ERROR(false),      // Other 4xx or unsupported content
    INVALID_URL(false),       // Malformed or non-http URL
    UNKNOWN(true);

    private final boolean retryable;

    FetchFailureCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static FetchFailureCategory fromStatusCode(int statusCode) {
        if (statusCode == 404) return NOT_FOUND;
        if (statusCode == 403) return ACCESS_FORBIDDEN;
        if (statusCode == 429) return RATE_LIMITED;
        if (statusCode == 408) return TIMEOUT;
        if (statusCode >= 500) return SERVER_ERROR;
        return CLIENT_ERROR;
    }
}
