package arcpay.guard.exception;

import org.springframework.http.HttpStatus;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure categories surfaced to callers. Each kind has a stable wire code and
 * the HTTP status it maps to.
 */
public enum ErrorKind {
    ACCESS_DENIED("access_denied", HttpStatus.FORBIDDEN),
    VALIDATION_ERROR("validation_error", HttpStatus.BAD_REQUEST),
    SIGNATURE_INVALID("signature_invalid", HttpStatus.UNAUTHORIZED),
    INTENT_EXPIRED("intent_expired", HttpStatus.BAD_REQUEST),
    NONCE_REPLAYED("nonce_replayed", HttpStatus.CONFLICT),
    GUARD_VIOLATION("guard_violation", HttpStatus.UNPROCESSABLE_ENTITY),
    EXECUTION_FAILED("execution_failed", HttpStatus.BAD_GATEWAY),
    WALLET_POLICY_VIOLATION("wallet_policy_violation", HttpStatus.FORBIDDEN),
    INTERNAL_ERROR("internal_error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final HttpStatus httpStatus;

    ErrorKind(String code, HttpStatus httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
