package com.trendscope.trending.source;

/**
 * Raised by a {@link TrendingSource} when its upstream cannot be read.
 * <p>
 * The engine catches it per source and turns it into an error health record; it never
 * reaches callers of the engine.
 */
public class SourceFetchException extends RuntimeException {

    private final String source;

    public SourceFetchException(String source, String message) {
        super(message);
        this.source = source;
    }

    public SourceFetchException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
