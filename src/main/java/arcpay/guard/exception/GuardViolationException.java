package arcpay.guard.exception;

/**
 * Exception thrown when the backend simulation rejects a payment
 */
public class GuardViolationException extends PaymentGuardException {

    private final String reason;

    public GuardViolationException(String reason) {
        super(ErrorKind.GUARD_VIOLATION, "Payment simulation failed: " + (reason == null ? "Unknown error" : reason));
        this.reason = reason;
    }

    @Override
    public String getDetail() {
        return reason;
    }
}
