package com.setupbrain.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    INSUFFICIENT_DATA("INSUFFICIENT_DATA", 422),
    INVALID_STOP("INVALID_STOP", 422),
    SIMULATION_ERROR("SIMULATION_ERROR", 500),
    PERSISTENCE_ERROR("PERSISTENCE_ERROR", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    MARKET_DATA_ERROR("MARKET_DATA_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
