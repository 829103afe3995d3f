package com.setupbrain.exception;

import java.util.Map;

/**
 * Raised when a paper trading write no longer matches the stored ledger: the open
 * position it refers to is gone, or the open slot is already taken.
 */
public class LedgerConflictException extends BaseException {

    public LedgerConflictException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFLICT, message, details);
    }
}
