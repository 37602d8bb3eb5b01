package com.narrativelens.backend.model.entity;

import com.narrativelens.backend.model.enums.CacheOutcome;
import com.narrativelens.backend.model.enums.ContentKind;
import lombok.Value;

/**
 * Resolution of one content kind for one URL. A permanent failure carries no value; callers
 * synthesize the fallback for each article row instead.
 */
@Value
public class CacheEntry {

    String url;
    ContentKind kind;
    String resolvedValue;
    CacheOutcome outcome;

    public static CacheEntry success(String url, ContentKind kind, String value) {
        return new CacheEntry(url, kind, value, CacheOutcome.SUCCESS);
    }

    public static CacheEntry permanentFailure(String url, ContentKind kind) {
        return new CacheEntry(url, kind, null, CacheOutcome.PERMANENT_FAILURE);
    }

    public boolean isSuccess() {
        return outcome == CacheOutcome.SUCCESS;
    }
}
