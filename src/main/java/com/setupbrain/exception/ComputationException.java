package com.setupbrain.exception;

import java.util.Map;

/**
 * Raised when a numeric computation cannot produce a meaningful result for a candidate.
 * The candidate is rejected; the cycle continues.
 */
public class ComputationException extends BaseException {

    public ComputationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ComputationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
