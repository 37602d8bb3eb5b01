package com.narrativelens.backend.ai;

/**
 * Optional stage that condenses a long extracted snippet. Implementations must never throw: on
 * missing configuration, timeout or error they return a deterministic truncation of the input.
 */
public interface ArticleSummarizer {

    boolean isEnabled();

    /**
     * Whether a snippet of this length should be sent for summarization at all
     */
    boolean shouldSummarize(String text);

    String summarize(String text);
}
