package com.poolmate.backend.modules.draw.application;

import java.util.Map;

import com.poolmate.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * An invariant that upstream components should have guaranteed does not hold. The round is aborted.
 */
public class DrawIntegrityException extends ProblemException {

    public DrawIntegrityException(String detail, Map<String, Object> properties) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "DRAW_INTEGRITY_VIOLATION", detail, properties);
    }
}
