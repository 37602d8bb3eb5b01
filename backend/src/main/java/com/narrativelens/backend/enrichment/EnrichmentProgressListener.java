package com.narrativelens.backend.enrichment;

/**
 * Progress sink polled between URL completions. Returning true from {@link #isCancelled()} stops
 * new fetches from being issued; fetches already in flight run to their own timeout.
 */
public interface EnrichmentProgressListener {

    EnrichmentProgressListener NOOP = (fraction, message) -> { };

    void onProgress(double fraction, String message);

    default boolean isCancelled() {
        return false;
    }
}
