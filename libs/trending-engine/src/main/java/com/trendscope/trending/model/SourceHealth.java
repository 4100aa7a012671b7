package com.trendscope.trending.model;

import java.time.Instant;

/**
 * Heartbeat record for one source, replaced as a whole after every fetch attempt.
 * <p>
 * The record reflects the latest attempt only: a success clears the previous error message
 * and error timestamp, a failure clears the previous success timestamp.
 *
 * @param source        source name
 * @param status        outcome of the latest attempt
 * @param message       failure detail, null unless {@code status} is {@link SourceStatus#ERROR}
 * @param lastSuccessAt when the latest attempt succeeded, if it did
 * @param lastErrorAt   when the latest attempt failed, if it did
 */
public record SourceHealth(
        String source,
        SourceStatus status,
        String message,
        Instant lastSuccessAt,
        Instant lastErrorAt
) {

    public SourceHealth {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public static SourceHealth unknown(String source) {
        return new SourceHealth(source, SourceStatus.UNKNOWN, null, null, null);
    }

    public static SourceHealth ok(String source, Instant at) {
        return new SourceHealth(source, SourceStatus.OK, null, at, null);
    }

    public static SourceHealth error(String source, String message, Instant at) {
        return new SourceHealth(source, SourceStatus.ERROR, message, null, at);
    }
}
