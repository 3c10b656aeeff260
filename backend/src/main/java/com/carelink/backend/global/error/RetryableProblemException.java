package com.carelink.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * Failure that clears by itself, such as a login lockout. Rendered with a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter) {
        super(status, code, detail);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be a non-negative duration");
        }
        this.retryAfter = retryAfter;
    }

    /**
     * Whole seconds, rounded up so a client never retries before the window closes.
     */
    public long getRetryAfterSeconds() {
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}
