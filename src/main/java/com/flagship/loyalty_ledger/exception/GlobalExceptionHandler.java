package com.flagship.loyalty_ledger.exception;

import com.flagship.loyalty_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain rejections and framework errors to {@link ApiError} bodies.
 *
 * Every rejection is logged. Security rejections (bad QR signatures, replays,
 * audience mismatches) are additionally written to the SECURITY_AUDIT logger so
 * they can be routed separately.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private static final Logger SECURITY_AUDIT = LoggerFactory.getLogger("SECURITY_AUDIT");

    private final Clock clock;

    @ExceptionHandler(LoyaltyException.class)
    public ResponseEntity<ApiError> handleLoyaltyException(LoyaltyException e) {
        if (e.getCategory() == ErrorCategory.SECURITY) {
            SECURITY_AUDIT.warn("Rejected request: code={}, correlationId={}, message={}",
                    e.getCode(), CorrelationContext.current(), e.getMessage());
        }
        log.warn("Request rejected: code={}, category={}, message={}",
                e.getCode(), e.getCategory(), e.getMessage());

        return respond(e.getHttpStatus(), base(e.getHttpStatus().getReasonPhrase(), e.getMessage())
            .code(e.getCode())
            .category(e.getCategory()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return badRequest("Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return badRequest("Missing Required Parameter",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return badRequest("Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return badRequest("Malformed Request", "Request could not be parsed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return badRequest("Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());

        return respond(HttpStatus.CONFLICT, base("Invalid State", e.getMessage())
            .category(ErrorCategory.CONFLICT));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
            base("Internal Server Error", "An unexpected error occurred"));
    }

    private ResponseEntity<ApiError> badRequest(String error, String message, Map<String, String> details) {
        return respond(HttpStatus.BAD_REQUEST, base(error, message)
            .category(ErrorCategory.VALIDATION)
            .details(details));
    }

    private ApiError.ApiErrorBuilder base(String error, String message) {
        return ApiError.builder()
            .error(error)
            .message(message)
            .correlationId(CorrelationContext.current())
            .timestamp(clock.instant());
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, ApiError.ApiErrorBuilder body) {
        return ResponseEntity.status(status).body(body.build());
    }
}
