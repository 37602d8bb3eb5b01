package com.narrativelens.backend.enrichment;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.narrativelens.backend.model.entity.CacheEntry;
import com.narrativelens.backend.model.enums.CacheOutcome;
import com.narrativelens.backend.model.enums.ContentKind;
import java.util.Map;
import java.util.Optional;
import lombok.Value;
import org.springframework.stereotype.Component;

/**
 * Resolved snippets and images per URL, plus URLs that permanently failed. Entries never expire;
 * the cache lives as long as the process (or until {@link #clear()} starts a new lifetime).
 */
@Component
public class EnrichmentCache {

    private final Cache<Key, CacheEntry> entries = Caffeine.newBuilder()
            .recordStats()
            .build();

    public Optional<CacheEntry> get(String url, ContentKind kind) {
        if (url == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.getIfPresent(new Key(url, kind)));
    }

    public void put(CacheEntry entry) {
        entries.put(new Key(entry.getUrl(), entry.getKind()), entry);
    }

    public void putSuccess(String url, ContentKind kind, String value) {
        put(CacheEntry.success(url, kind, value));
    }

    public void putPermanentFailure(String url, ContentKind kind) {
        put(CacheEntry.permanentFailure(url, kind));
    }

    public boolean contains(String url, ContentKind kind) {
        return get(url, kind).isPresent();
    }

    public long size() {
        return entries.estimatedSize();
    }

    public void clear() {
        entries.invalidateAll();
    }

    public Map<String, Object> getStats() {
        long failures = entries.asMap().values().stream()
                .filter(entry -> entry.getOutcome() == CacheOutcome.PERMANENT_FAILURE)
                .count();
        CacheStats stats = entries.stats();
        return Map.of(
                "entries", entries.estimatedSize(),
                "permanentFailures", failures,
                "hits", stats.hitCount(),
                "misses", stats.missCount(),
                "hitRate", stats.hitRate()
        );
    }

    @Value
    private static class Key {
        String url;
        ContentKind kind;
    }
}
