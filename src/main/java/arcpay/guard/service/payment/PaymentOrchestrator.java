package arcpay.guard.service.payment;

import java.util.UUID;

import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import arcpay.guard.dto.PaymentReceipt;
import arcpay.guard.dto.PaymentRequest;
import arcpay.guard.exception.GuardViolationException;
import arcpay.guard.exception.PaymentExecutionException;
import arcpay.guard.exception.PaymentValidationException;
import arcpay.guard.exception.WalletPolicyException;
import arcpay.guard.util.LogSanitizer;
import arcpay.guard.util.WalletIdentifiers;
import lombok.extern.slf4j.Slf4j;

/**
 * Direct payments from a custodial agent wallet: validate, simulate, then execute.
 * Execution never starts unless the simulation passed.
 */
@Service
@Slf4j
public class PaymentOrchestrator {

    static final String SUCCESS_MESSAGE = "Payment processed successfully";
    static final String RAW_ADDRESS_REJECTED =
        "Autonomous payments require a custodial wallet id. Raw 0x addresses need end-user signing "
            + "and cannot be used for agent execution.";

    private final PaymentExecutionClient paymentClient;

    public PaymentOrchestrator(@Lazy PaymentExecutionClient paymentClient) {
        this.paymentClient = paymentClient;
    }

    public PaymentReceipt execute(PaymentRequest request) {
        validate(request);

        if (WalletIdentifiers.isRawAddress(request.fromWalletId())) {
            log.warn("Raw address wallet rejected: {}", LogSanitizer.maskIdentifier(request.fromWalletId()));
            throw new WalletPolicyException(RAW_ADDRESS_REJECTED);
        }
        if (!WalletIdentifiers.isCustodialWalletId(request.fromWalletId())) {
            throw new PaymentValidationException("from_wallet_id is not a valid custodial wallet id");
        }

        String idempotencyKey = UUID.randomUUID().toString();
        TransferCommand command = new TransferCommand(
            request.fromWalletId(),
            request.toAddress(),
            request.amount(),
            request.currency(),
            request.destinationChain(),
            idempotencyKey
        );
        log.info("Orchestrating payment: wallet={}, amount={}, idempotencyKey={}",
            LogSanitizer.maskIdentifier(request.fromWalletId()),
            LogSanitizer.sanitize(request.amount()),
            idempotencyKey);

        SimulationResult simulation = simulate(command);
        TransferResult result = executeTransfer(command);

        return PaymentReceipt.builder()
            .status("success")
            .paymentId(result.transferId())
            .transferId(result.transferId())
            .transactionId(result.transferId())
            .blockchainTx(result.blockchainTx())
            .amount(request.amount())
            .currency(request.currency())
            .destinationChain(request.destinationChain())
            .estimatedFee(simulation.estimatedFee())
            .message(SUCCESS_MESSAGE)
            .idempotencyKey(idempotencyKey)
            .build();
    }

    private SimulationResult simulate(TransferCommand command) {
        SimulationResult simulation;
        try {
            simulation = paymentClient.simulate(command);
        } catch (Exception e) {
            log.error("Payment simulation call failed: {}", LogSanitizer.sanitize(e.getMessage()));
            throw new PaymentExecutionException("Payment simulation could not be completed: " + e.getMessage(), e);
        }
        if (simulation == null || !simulation.wouldSucceed()) {
            String reason = simulation == null || simulation.reason() == null ? "Unknown error" : simulation.reason();
            log.warn("Payment simulation rejected: {}", LogSanitizer.sanitize(reason));
            throw new GuardViolationException(reason);
        }
        return simulation;
    }

    private TransferResult executeTransfer(TransferCommand command) {
        TransferResult result;
        try {
            result = paymentClient.execute(command);
        } catch (Exception e) {
            log.error("Payment execution failed: {}", LogSanitizer.sanitize(e.getMessage()));
            throw new PaymentExecutionException("Payment execution failed: " + e.getMessage(), e);
        }
        if (result == null || !result.isSuccessful()) {
            String reason = result == null ? "backend returned no result" : result.failureReason();
            log.error("Payment execution failed: {}", LogSanitizer.sanitize(reason));
            throw new PaymentExecutionException("Payment execution failed: " + reason, reason);
        }
        return result;
    }

    private static void validate(PaymentRequest request) {
        if (request == null) {
            throw new PaymentValidationException("Payment request is required");
        }
        if (request.fromWalletId() == null || request.fromWalletId().isBlank()) {
            throw new PaymentValidationException("from_wallet_id is required");
        }
        if (request.toAddress() == null || request.toAddress().isBlank()) {
            throw new PaymentValidationException("to_address is required");
        }
        try {
            WalletIdentifiers.parsePositiveAmount(request.amount(), "amount");
        } catch (IllegalArgumentException e) {
            throw new PaymentValidationException(e.getMessage(), e);
        }
    }
}
