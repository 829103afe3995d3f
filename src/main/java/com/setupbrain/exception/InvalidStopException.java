package com.setupbrain.exception;

import java.util.Map;

public class InvalidStopException extends ComputationException {

    public InvalidStopException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_STOP, message, details);
    }
}
