package com.narrativelens.backend.model.enums;

public enum CacheOutcome {
    SUCCESS,
    PERMANENT_FAILURE
}
