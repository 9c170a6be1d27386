package com.genserver;

import java.time.Duration;

/**
 * Thrown to a caller whose {@code call} or {@code stop} did not complete within its timeout.
 * Only the caller's wait is abandoned; the server keeps processing.
 */
public class GenServerTimeoutException extends GenServerException {

    private final Duration timeout;

    public GenServerTimeoutException(String message, Duration timeout, String serverName) {
        super(message, serverName);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
