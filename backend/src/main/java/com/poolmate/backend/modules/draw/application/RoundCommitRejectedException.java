package com.poolmate.backend.modules.draw.application;

import java.util.Map;

import com.poolmate.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * The ledger refused a draw. Nothing was written, so starting a new round is safe.
 */
public class RoundCommitRejectedException extends RetryableProblemException {

    public RoundCommitRejectedException(String detail, Map<String, Object> properties, int retryAfterSeconds) {
        super(HttpStatus.CONFLICT, "ROUND_ABORTED_RETRY_LATER", detail, properties, retryAfterSeconds);
    }
}
