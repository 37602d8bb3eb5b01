package com.narrativelens.backend.enrichment;

import com.narrativelens.backend.ai.ArticleSummarizer;
import com.narrativelens.backend.config.ScrapingConfig;
import com.narrativelens.backend.model.dto.EnrichmentReport;
import com.narrativelens.backend.model.entity.Article;
import com.narrativelens.backend.model.entity.CacheEntry;
import com.narrativelens.backend.model.enums.ContentKind;
import com.narrativelens.backend.scraping.ArticleExtractorService;
import com.narrativelens.backend.scraping.fetch.FetchResult;
import com.narrativelens.backend.scraping.fetch.PageFetcher;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Fills in missing snippets and images for a batch of articles.
 * <p>
 * Work is planned per distinct URL: URLs already resolved or permanently failed in the
 * {@link EnrichmentCache} are never fetched again, the rest are fetched through a bounded worker
 * pool, and the cached values are finally joined back onto every article row sharing the URL.
 * A failure for one URL only ever costs the rows of that URL their primary values; they receive
 * fallbacks instead, and nothing is thrown to the caller.
 */
@Service
@Slf4j
public class EnrichmentService {

    private static final int PROGRESS_URL_LENGTH = 50;

    private final PageFetcher pageFetcher;
    private final ArticleExtractorService articleExtractorService;
    private final FallbackValueResolver fallbackValueResolver;
    private final EnrichmentCache enrichmentCache;
    private final ArticleSummarizer articleSummarizer;
    private final ScrapingConfig scrapingConfig;
    private final Executor enrichmentTaskExecutor;

    public EnrichmentService(PageFetcher pageFetcher,
                             ArticleExtractorService articleExtractorService,
                             FallbackValueResolver fallbackValueResolver,
                             EnrichmentCache enrichmentCache,
                             ArticleSummarizer articleSummarizer,
                             ScrapingConfig scrapingConfig,
                             @Qualifier("enrichmentTaskExecutor") Executor enrichmentTaskExecutor) {
        this.pageFetcher = pageFetcher;
        this.articleExtractorService = articleExtractorService;
        this.fallbackValueResolver = fallbackValueResolver;
        this.enrichmentCache = enrichmentCache;
        this.articleSummarizer = articleSummarizer;
        this.scrapingConfig = scrapingConfig;
        this.enrichmentTaskExecutor = enrichmentTaskExecutor;
    }

    public List<Article> enrich(List<Article> articles) {
        enrich(articles, EnrichmentProgressListener.NOOP);
        return articles;
    }

    /**
     * Enrich the articles in place. After this returns every article has a non-empty text and
     * image URL.
     */
    public EnrichmentReport enrich(List<Article> articles, EnrichmentProgressListener listener) {
        EnrichmentProgressListener progress = listener != null ? listener : EnrichmentProgressListener.NOOP;
        if (articles == null || articles.isEmpty()) {
            progress.onProgress(1.0, "No articles to enrich");
            return EnrichmentReport.empty(0);
        }

        long startTime = System.currentTimeMillis();
        Map<String, Set<ContentKind>> needed = collectNeededContent(articles);

        if (needed.isEmpty() && articles.stream().noneMatch(a -> a.needsText() || a.needsImage())) {
            log.info("All {} articles already have text and images, skipping enrichment", articles.size());
            progress.onProgress(1.0, "All articles already enriched");
            return EnrichmentReport.empty(articles.size());
        }

        // Drop everything the cache already answers, success or permanent failure
        Map<String, Set<ContentKind>> worklist = new LinkedHashMap<>();
        int cacheHits = 0;
        for (Map.Entry<String, Set<ContentKind>> entry : needed.entrySet()) {
            Set<ContentKind> outstanding = EnumSet.noneOf(ContentKind.class);
            for (ContentKind kind : entry.getValue()) {
                if (!enrichmentCache.contains(entry.getKey(), kind)) {
                    outstanding.add(kind);
                }
            }
            if (outstanding.isEmpty()) {
                cacheHits++;
            } else {
                worklist.put(entry.getKey(), outstanding);
            }
        }

        log.info("Enriching {} articles: {} distinct URLs, {} answered by cache, {} to fetch",
                articles.size(), needed.size(), cacheHits, worklist.size());

        DispatchOutcome dispatch = new DispatchOutcome();
        if (!scrapingConfig.isEnabled()) {
            log.info("Web scraping disabled, using fallback values for {} URLs", worklist.size());
        } else if (!worklist.isEmpty()) {
            dispatch = dispatch(worklist, progress);
        }

        EnrichmentReport report = applyResolvedValues(articles);
        report.setTotalArticles(articles.size());
        report.setDistinctUrls(needed.size());
        report.setCacheHits(cacheHits);
        report.setFetchedUrls(dispatch.completed);
        report.setCancelled(dispatch.cancelled);
        report.setDurationSeconds((System.currentTimeMillis() - startTime) / 1000.0);

        if (report.hasFailures()) {
            log.warn("Content enrichment finished with fallbacks: {}", report.failureSummary());
        }
        log.info("Content enrichment complete in {}s ({} URLs fetched{})",
                report.getDurationSeconds(), dispatch.completed, dispatch.cancelled ? ", cancelled" : "");
        progress.onProgress(1.0, dispatch.cancelled ? "Content enrichment cancelled" : "Content enrichment complete");
        return report;
    }

    public Map<String, Object> getCacheStats() {
        return enrichmentCache.getStats();
    }

    public void clearCache() {
        log.info("Clearing enrichment cache ({} entries)", enrichmentCache.size());
        enrichmentCache.clear();
    }

    private Map<String, Set<ContentKind>> collectNeededContent(List<Article> articles) {
        Map<String, Set<ContentKind>> needed = new LinkedHashMap<>();
        for (Article article : articles) {
            String url = article.getUrl();
            if (url == null || url.isBlank()) {
                continue;
            }
            if (article.needsText()) {
                needed.computeIfAbsent(url, k -> EnumSet.noneOf(ContentKind.class)).add(ContentKind.TEXT);
            }
            if (article.needsImage()) {
                needed.computeIfAbsent(url, k -> EnumSet.noneOf(ContentKind.class)).add(ContentKind.IMAGE);
            }
        }
        return needed;
    }

    /**
     * Run the worklist with at most {@code effectiveConcurrency()} URLs in flight. Cancellation is
     * checked before each new dispatch.
     */
    private DispatchOutcome dispatch(Map<String, Set<ContentKind>> worklist, EnrichmentProgressListener progress) {
        DispatchOutcome outcome = new DispatchOutcome();
        CompletionService<String> completionService = new ExecutorCompletionService<>(enrichmentTaskExecutor);
        Iterator<Map.Entry<String, Set<ContentKind>>> pending = worklist.entrySet().iterator();
        int concurrency = scrapingConfig.effectiveConcurrency();
        int total = worklist.size();
        int inFlight = 0;

        while (inFlight < concurrency && pending.hasNext() && !progress.isCancelled()) {
            submit(completionService, pending.next());
            inFlight++;
        }

        while (inFlight > 0) {
            String url = null;
            try {
                url = completionService.take().get();
            } catch (ExecutionException e) {
                log.error("Enrichment task failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (InterruptedException e) {
                log.warn("Enrichment interrupted with {} URLs in flight", inFlight);
                Thread.currentThread().interrupt();
                outcome.cancelled = true;
                break;
            }
            inFlight--;
            outcome.completed++;
            progress.onProgress((double) outcome.completed / total,
                    String.format("Processing (%d/%d): %s", outcome.completed, total, abbreviate(url)));

            if (pending.hasNext() && !progress.isCancelled()) {
                submit(completionService, pending.next());
                inFlight++;
            }
        }

        if (pending.hasNext()) {
            outcome.cancelled = true;
            log.info("Enrichment cancelled, {} of {} URLs not fetched", total - outcome.completed, total);
        }
        return outcome;
    }

    private void submit(CompletionService<String> completionService, Map.Entry<String, Set<ContentKind>> work) {
        String url = work.getKey();
        Set<ContentKind> kinds = work.getValue();
        completionService.submit(() -> resolveUrl(url, kinds));
    }

    /**
     * Fetch one URL and commit every outstanding kind to the cache, as a value or as a permanent
     * failure. Each URL has exactly one writer since the worklist is deduplicated.
     */
    String resolveUrl(String url, Set<ContentKind> kinds) {
        try {
            FetchResult result = pageFetcher.fetch(url,
                    scrapingConfig.getDefaultMaxRetries(),
                    Duration.ofMillis((long) (scrapingConfig.getDefaultDelay() * 1000)));

            if (result.isInterrupted()) {
                // Left uncached like an undispatched URL, a later run fetches it again
                log.info("Fetch of {} interrupted after {} attempt(s), not caching", url, result.getAttempts());
                return url;
            }
            if (!result.isSuccess()) {
                log.debug("Fetch failed for {}: {} after {} attempt(s) ({})",
                        url, result.getFailureCategory(), result.getAttempts(), result.getMessage());
                kinds.forEach(kind -> enrichmentCache.putPermanentFailure(url, kind));
                return url;
            }

            Document doc = articleExtractorService.parse(result.getHtml(), result.getBaseUrl());

            if (kinds.contains(ContentKind.TEXT)) {
                commit(url, ContentKind.TEXT, extractSnippet(doc));
            }
            if (kinds.contains(ContentKind.IMAGE)) {
                commit(url, ContentKind.IMAGE, articleExtractorService.extractImage(doc));
            }

        } catch (Exception e) {
            log.error("Error enriching {}: {}", url, e.getMessage());
            for (ContentKind kind : kinds) {
                if (!enrichmentCache.contains(url, kind)) {
                    enrichmentCache.putPermanentFailure(url, kind);
                }
            }
        }
        return url;
    }

    private String extractSnippet(Document doc) {
        int maxLength = articleSummarizer.isEnabled()
                ? scrapingConfig.getSummarizerSnippetMaxLength()
                : scrapingConfig.getSnippetMaxLength();
        String snippet = articleExtractorService.extractSnippet(doc, maxLength);
        if (snippet != null && articleSummarizer.shouldSummarize(snippet)) {
            return articleSummarizer.summarize(snippet);
        }
        return snippet;
    }

    private void commit(String url, ContentKind kind, String value) {
        if (value != null && !value.isBlank()) {
            enrichmentCache.putSuccess(url, kind, value);
        } else {
            log.debug("No {} extracted from {}", kind, url);
            enrichmentCache.putPermanentFailure(url, kind);
        }
    }

    // Join cache values back onto the rows; anything unresolved gets its fallback
    private EnrichmentReport applyResolvedValues(List<Article> articles) {
        EnrichmentReport report = new EnrichmentReport();
        for (Article article : articles) {
            if (article.needsText()) {
                Optional<String> text = resolved(article.getUrl(), ContentKind.TEXT);
                if (text.isPresent()) {
                    article.setText(text.get());
                } else {
                    article.setText(fallbackValueResolver.fallbackText(article.getHeadline()));
                    report.setFailedSnippets(report.getFailedSnippets() + 1);
                }
            }
            if (article.needsImage()) {
                Optional<String> image = resolved(article.getUrl(), ContentKind.IMAGE);
                if (image.isPresent()) {
                    article.setImageUrl(image.get());
                } else {
                    article.setImageUrl(fallbackValueResolver.fallbackImage(article.getUrl()));
                    report.setFailedImages(report.getFailedImages() + 1);
                }
            }
        }
        return report;
    }

    private Optional<String> resolved(String url, ContentKind kind) {
        return enrichmentCache.get(url, kind)
                .filter(CacheEntry::isSuccess)
                .map(CacheEntry::getResolvedValue);
    }

    private static String abbreviate(String url) {
        if (url == null) {
            return "?";
        }
        return url.length() > PROGRESS_URL_LENGTH ? url.substring(0, PROGRESS_URL_LENGTH) + "..." : url;
    }

    private static class DispatchOutcome {
        int completed;
        boolean cancelled;
    }
}
