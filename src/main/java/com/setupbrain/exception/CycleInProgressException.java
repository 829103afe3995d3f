package com.setupbrain.exception;

/**
 * A brain cycle was requested while another one is still running.
 */
public class CycleInProgressException extends BaseException {

    public CycleInProgressException() {
        super(ErrorCode.CONFLICT, "A brain cycle is already running");
    }
}
