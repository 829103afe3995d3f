package com.setupbrain.exception;

import java.util.Map;

public class PersistenceException extends BaseException {

    public PersistenceException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, details, cause);
    }
}
