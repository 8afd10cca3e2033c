package arcpay.guard.service.payment;

/**
 * Parameters of one transfer as sent to the payment backend. The same
 * command is used for simulation and execution.
 *
 * @param idempotencyKey per-attempt token the backend may deduplicate on; may be null
 */
public record TransferCommand(
    String walletId,
    String recipient,
    String amount,
    String currency,
    String destinationChain,
    String idempotencyKey
) {

    public static TransferCommand of(String walletId, String recipient, String amount, String currency) {
        return new TransferCommand(walletId, recipient, amount, currency, null, null);
    }
}
