package com.setupbrain.exception;

import com.setupbrain.api.dto.response.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Turns failures on the brain's REST endpoints into the {@link ApiErrorResponse} envelope.
 *
 * <p>Brain exceptions carry their status in their {@link ErrorCode}: a cycle trigger
 * while one is running or a close racing a cycle is 409, a missing paper position 404,
 * a close price that is not positive 400. Anything else is a 500 without internals.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /** Bean validation on request bodies and query parameters. */
    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiErrorResponse> handleInvalidInput(Exception ex, HttpServletRequest request) {
        Map<String, Object> violations = new LinkedHashMap<>();
        if (ex instanceof MethodArgumentNotValidException notValid) {
            notValid.getBindingResult()
                    .getFieldErrors()
                    .forEach(error -> violations.put(error.getField(), error.getDefaultMessage()));
        } else {
            ((ConstraintViolationException) ex)
                    .getConstraintViolations()
                    .forEach(violation -> violations.put(violation.getPropertyPath().toString(), violation.getMessage()));
        }
        log.debug("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), violations);
        return respond(ErrorCode.VALIDATION_ERROR, "Request failed validation", violations, request);
    }

    /** Unknown enum names such as {@code ?source=NOPE}, missing parameters, unparseable JSON. */
    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex, HttpServletRequest request) {
        String message;
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            message = "Unsupported value for " + mismatch.getName();
            details.put(mismatch.getName(), String.valueOf(mismatch.getValue()));
        } else if (ex instanceof MissingServletRequestParameterException missing) {
            message = "Missing parameter " + missing.getParameterName();
        } else {
            message = "Request body is not valid JSON";
        }
        return respond(ErrorCode.BAD_REQUEST, message, details, request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBrainException(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("{} {} failed with {}: {} {}",
                    request.getMethod(), request.getRequestURI(), errorCode, ex.getMessage(), ex.getDetails(), ex);
        } else if (errorCode == ErrorCode.CONFLICT) {
            log.info("{} {} refused: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        } else {
            log.warn("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(), errorCode, ex.getMessage());
        }
        return respond(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, "Internal error", null, request);
    }

    private static ResponseEntity<ApiErrorResponse> respond(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        return ResponseEntity.status(errorCode.getHttpStatus())
                .body(ApiErrorResponse.of(errorCode, message, details, request.getRequestURI()));
    }
}
