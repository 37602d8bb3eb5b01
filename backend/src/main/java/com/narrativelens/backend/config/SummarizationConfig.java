package com.narrativelens.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "summarization")
@Data
public class SummarizationConfig {

    private boolean enabled = false;

    // Snippets at or below this length are kept verbatim
    private int minTextLength = 150;
    private int timeoutSeconds = 20;
    private int fallbackLength = 500;
    private long cacheMaxSize = 2_000;
}
