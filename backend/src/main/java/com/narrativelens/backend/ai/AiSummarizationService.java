package com.narrativelens.backend.ai;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.narrativelens.backend.config.SummarizationConfig;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Summarizes snippets through the configured Spring AI chat model. Results are cached by exact
 * input text, independently of the enrichment cache.
 */
@Slf4j
@Service
public class AiSummarizationService implements ArticleSummarizer {

    private static final String SUMMARIZATION_PROMPT = """
            Summarize the following news article excerpt in 2-3 concise sentences.
            Focus on the key facts and main events. Keep the summary neutral and factual.
            Return only the summary text without any additional formatting or labels.

            Excerpt: {text}""";

    private final ChatModel chatModel;
    private final SummarizationConfig config;
    private final Executor aiTaskExecutor;
    private final Cache<String, String> summaries;

    public AiSummarizationService(ObjectProvider<ChatModel> chatModelProvider,
                                  SummarizationConfig config,
                                  @Qualifier("aiTaskExecutor") Executor aiTaskExecutor) {
        this.chatModel = chatModelProvider.getIfAvailable();
        this.config = config;
        this.aiTaskExecutor = aiTaskExecutor;
        this.summaries = Caffeine.newBuilder()
                .maximumSize(config.getCacheMaxSize())
                .build();

        if (config.isEnabled() && chatModel == null) {
            log.warn("Summarization is enabled but no chat model is configured; snippets will be truncated instead");
        }
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && chatModel != null;
    }

    @Override
    public boolean shouldSummarize(String text) {
        return isEnabled() && text != null && text.length() > config.getMinTextLength();
    }

    @Override
    public String summarize(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }
        if (!isEnabled()) {
            return fallback(text);
        }

        String cached = summaries.getIfPresent(text);
        if (cached != null) {
            return cached;
        }

        try {
            String summary = callModel(text);
            if (summary == null || summary.isBlank()) {
                log.warn("AI returned an empty summary, using truncated text");
                return fallback(text);
            }
            summaries.put(text, summary);
            return summary;

        } catch (TimeoutException e) {
            log.warn("Summarization timed out after {}s", config.getTimeoutSeconds());
            return fallback(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(text);
        } catch (Exception e) {
            log.error("Error summarizing snippet: {}", e.getMessage());
            return fallback(text);
        }
    }

    public long cachedSummaries() {
        return summaries.estimatedSize();
    }

    private String callModel(String text) throws InterruptedException, ExecutionException, TimeoutException {
        Prompt prompt = new PromptTemplate(SUMMARIZATION_PROMPT).create(Map.of("text", text));
        CompletableFuture<ChatResponse> call = CompletableFuture.supplyAsync(() -> chatModel.call(prompt), aiTaskExecutor);
        ChatResponse response = call.get(config.getTimeoutSeconds(), TimeUnit.SECONDS);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        String content = response.getResult().getOutput().getText();
        return content != null ? content.trim() : null;
    }

    private String fallback(String text) {
        String trimmed = text.trim();
        if (trimmed.length() <= config.getFallbackLength()) {
            return trimmed;
        }
        return trimmed.substring(0, config.getFallbackLength()) + "...";
    }
}
