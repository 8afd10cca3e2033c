package arcpay.guard.exception;

/**
 * Exception thrown when an intent signature is missing, malformed or from the wrong signer
 */
public class SignatureInvalidException extends PaymentGuardException {

    public SignatureInvalidException(String message) {
        super(ErrorKind.SIGNATURE_INVALID, message);
    }
}
