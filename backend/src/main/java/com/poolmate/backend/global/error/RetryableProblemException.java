package com.poolmate.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds) {
        this(status, code, detail, Map.of(), retryAfterSeconds);
    }

    public RetryableProblemException(
            HttpStatus status,
            String code,
            String detail,
            Map<String, Object> properties,
            int retryAfterSeconds
    ) {
        super(status, code, detail, properties);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
