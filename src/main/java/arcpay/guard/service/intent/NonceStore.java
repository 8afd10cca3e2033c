package arcpay.guard.service.intent;

/**
 * Set of consumed intent nonces.
 */
public interface NonceStore {

    /**
     * Atomically records {@code nonce} as consumed.
     *
     * @return true if the nonce was new, false if it had already been consumed
     */
    boolean register(String nonce);

    /**
     * Forgets nonces consumed longer ago than the retention period.
     *
     * @return number of nonces removed
     */
    int sweep();

    int size();
}
