package arcpay.guard.exception;

/**
 * Exception thrown when the source wallet belongs to a class that needs
 * interactive end-user signing
 */
public class WalletPolicyException extends PaymentGuardException {

    public WalletPolicyException(String message) {
        super(ErrorKind.WALLET_POLICY_VIOLATION, message);
    }
}
