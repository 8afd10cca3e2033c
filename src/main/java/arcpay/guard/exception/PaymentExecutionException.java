package arcpay.guard.exception;

/**
 * Exception thrown when the payment backend fails to carry out a transfer
 */
public class PaymentExecutionException extends PaymentGuardException {

    private final String detail;

    public PaymentExecutionException(String message, String detail) {
        super(ErrorKind.EXECUTION_FAILED, message);
        this.detail = detail;
    }

    public PaymentExecutionException(String message, Throwable cause) {
        super(ErrorKind.EXECUTION_FAILED, message, cause);
        this.detail = cause == null ? null : cause.getMessage();
    }

    @Override
    public String getDetail() {
        return detail;
    }
}
