package com.setupbrain.api.dto.response;

import com.setupbrain.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope returned by every REST endpoint on failure:
 * {@code {"success": false, "error": {code, message, details, timestamp, path}}}.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
