package arcpay.guard.service.payment;

import java.io.IOException;

/**
 * Contract for the external payment backend that owns wallets, guard
 * policies and fund transfers.
 */
public interface PaymentExecutionClient {

    /**
     * Dry-runs a transfer against the wallet's guard policies without moving funds.
     *
     * @throws IOException if the backend cannot be reached or answers with an error
     */
    SimulationResult simulate(TransferCommand command) throws IOException;

    /**
     * Executes a transfer. Callers must check {@link TransferResult#isSuccessful()}.
     *
     * @throws IOException if the backend cannot be reached or answers with an error
     */
    TransferResult execute(TransferCommand command) throws IOException;
}
