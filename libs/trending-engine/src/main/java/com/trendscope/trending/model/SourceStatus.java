package com.trendscope.trending.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Last known outcome of fetching from a source.
 */
public enum SourceStatus {

    /** No fetch attempted yet. */
    UNKNOWN,

    OK,

    ERROR;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
