package arcpay.guard.exception;

/**
 * Exception thrown when an intent nonce has already been consumed
 */
public class NonceReplayedException extends PaymentGuardException {

    public NonceReplayedException(String message) {
        super(ErrorKind.NONCE_REPLAYED, message);
    }
}
