package arcpay.guard.exception;

/**
 * Exception thrown when an intent has no expiry or its expiry has passed
 */
public class IntentExpiredException extends PaymentGuardException {

    public IntentExpiredException(String message) {
        super(ErrorKind.INTENT_EXPIRED, message);
    }
}
