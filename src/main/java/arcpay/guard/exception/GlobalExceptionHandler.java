package arcpay.guard.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import arcpay.guard.util.LogSanitizer;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for all controllers.
 * Every failure leaves as a non-2xx response so the admission filter can
 * count it against the caller.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handles validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = body(ErrorKind.VALIDATION_ERROR, "Validation failed");
        response.put("errors", errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    /**
     * Handles malformed JSON bodies
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", LogSanitizer.sanitize(ex.getMessage()));
        return ResponseEntity.badRequest().body(body(ErrorKind.VALIDATION_ERROR, "Malformed request body"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing request parameter: {}", ex.getParameterName());
        return ResponseEntity.badRequest()
            .body(body(ErrorKind.VALIDATION_ERROR, "Missing parameter: " + ex.getParameterName()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Invalid value for parameter {}", ex.getName());
        return ResponseEntity.badRequest()
            .body(body(ErrorKind.VALIDATION_ERROR, "Invalid value for parameter: " + ex.getName()));
    }

    /**
     * Handles requests that match no endpoint: unknown path, unsupported
     * method or content type. Keeps the framework's 4xx status and headers.
     */
    @ExceptionHandler({
        NoResourceFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class,
        HttpMediaTypeNotAcceptableException.class
    })
    public ResponseEntity<Map<String, Object>> handleNonConformingRequest(Exception ex) {
        ErrorResponse errorResponse = (ErrorResponse) ex;
        String detail = errorResponse.getBody().getDetail();
        String message = detail != null ? detail : "Request not supported";
        log.warn("Non-conforming request ({}): {}", errorResponse.getStatusCode().value(),
            LogSanitizer.sanitize(message));
        return ResponseEntity.status(errorResponse.getStatusCode())
            .headers(errorResponse.getHeaders())
            .body(body(ErrorKind.VALIDATION_ERROR, message));
    }

    /**
     * Handles every typed pipeline and orchestrator failure
     */
    @ExceptionHandler(PaymentGuardException.class)
    public ResponseEntity<Map<String, Object>> handlePaymentGuardException(PaymentGuardException ex) {
        ErrorKind kind = ex.getKind();
        Map<String, Object> response = body(kind, ex.getMessage());
        if (ex.getDetail() != null) {
            response.put("detail", ex.getDetail());
        }

        switch (kind) {
            case EXECUTION_FAILED -> log.error("Payment processing failed: {}", LogSanitizer.sanitize(ex.getMessage()));
            case SIGNATURE_INVALID -> log.warn("Rejected intent signature: {}", LogSanitizer.sanitize(ex.getMessage()));
            default -> log.warn("Request rejected [{}]: {}", kind.getCode(), LogSanitizer.sanitize(ex.getMessage()));
        }
        return ResponseEntity.status(kind.getHttpStatus()).body(response);
    }

    /**
     * Handles all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        // Log full stack trace for debugging but don't expose to client
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(ErrorKind.INTERNAL_ERROR, "An unexpected error occurred"));
    }

    private Map<String, Object> body(ErrorKind kind, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("error", kind.getCode());
        response.put("message", message);
        return response;
    }
}
