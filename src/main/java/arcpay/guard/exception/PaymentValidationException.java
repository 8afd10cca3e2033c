package arcpay.guard.exception;

/**
 * Exception thrown when a request does not have the expected shape
 */
public class PaymentValidationException extends PaymentGuardException {

    public PaymentValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public PaymentValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
