package com.narrativelens.backend.model.enums;

/**
 * Kind of content resolved per article URL. Cache entries are keyed independently per kind.
 */
public enum ContentKind {
    TEXT,
    IMAGE
}
