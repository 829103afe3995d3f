package com.setupbrain.exception;

import java.util.Map;

/**
 * Raised for any fault inside paper trading. Never allowed to escape the brain cycle:
 * the runner catches it at the activation boundary.
 */
public class SimulationException extends BaseException {

    public SimulationException(String message) {
        super(ErrorCode.SIMULATION_ERROR, message);
    }

    public SimulationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public SimulationException(String message, Map<String, Object> details) {
        super(ErrorCode.SIMULATION_ERROR, message, details);
    }

    public SimulationException(String message, Throwable cause) {
        super(ErrorCode.SIMULATION_ERROR, message, cause);
    }
}
