package arcpay.guard.exception;

/**
 * Base exception for every typed failure raised by the intent pipeline and
 * the payment orchestrator.
 */
public abstract class PaymentGuardException extends RuntimeException {

    private final ErrorKind kind;

    protected PaymentGuardException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PaymentGuardException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Backend supplied detail worth returning to the caller, if any.
     */
    public String getDetail() {
        return null;
    }
}
