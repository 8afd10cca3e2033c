package arcpay.guard.service.intent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import arcpay.guard.config.X402Properties;
import arcpay.guard.dto.IntentReceipt;
import arcpay.guard.dto.SignedIntent;
import arcpay.guard.exception.IntentExpiredException;
import arcpay.guard.exception.NonceReplayedException;
import arcpay.guard.exception.PaymentExecutionException;
import arcpay.guard.exception.PaymentValidationException;
import arcpay.guard.exception.SignatureInvalidException;
import arcpay.guard.service.payment.PaymentExecutionClient;
import arcpay.guard.service.payment.TransferCommand;
import arcpay.guard.service.payment.TransferResult;
import arcpay.guard.util.LogSanitizer;
import arcpay.guard.util.WalletIdentifiers;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a signed x402 intent through signature, expiry and replay checks and
 * hands it to the payment backend. The first failing check ends the intent;
 * nothing before the nonce registration consumes the nonce.
 */
@Service
@Slf4j
public class X402IntentService {

    static final String MODE = "x402";
    static final String SUCCESS_MESSAGE = "X402 gasless payment executed successfully";

    private final X402IntentVerifier verifier;
    private final NonceStore nonceStore;
    private final PaymentExecutionClient paymentClient;
    private final X402Properties properties;
    private final Clock clock;

    public X402IntentService(
        X402IntentVerifier verifier,
        NonceStore nonceStore,
        @Lazy PaymentExecutionClient paymentClient,
        X402Properties properties,
        Clock clock
    ) {
        this.verifier = verifier;
        this.nonceStore = nonceStore;
        this.paymentClient = paymentClient;
        this.properties = properties;
        this.clock = clock;
    }

    public IntentReceipt execute(SignedIntent intent) {
        validateShape(intent);
        String intentId = LogSanitizer.sanitize(intent.intentId());
        transition(intentId, IntentStage.RECEIVED);

        X402IntentVerifier.VerificationResult verification = verifier.verify(intent);
        if (!verification.valid()) {
            log.warn("Intent signature rejected: intent={}, reason={}, recovered={}",
                intentId, verification.error(), verification.recoveredAddress());
            fail(intentId, IntentStage.RECEIVED);
            throw new SignatureInvalidException("Invalid intent signature: " + verification.error());
        }
        transition(intentId, IntentStage.SIGNATURE_VERIFIED);

        long now = clock.instant().getEpochSecond();
        if (intent.expiresAt() == null || now > intent.expiresAt()) {
            fail(intentId, IntentStage.SIGNATURE_VERIFIED);
            throw new IntentExpiredException(intent.expiresAt() == null
                ? "Intent has no expiry"
                : "Intent expired at " + intent.expiresAt());
        }
        transition(intentId, IntentStage.EXPIRY_OK);

        if (!nonceStore.register(intent.nonce())) {
            fail(intentId, IntentStage.EXPIRY_OK);
            throw new NonceReplayedException("Nonce already used: " + LogSanitizer.maskIdentifier(intent.nonce()));
        }
        transition(intentId, IntentStage.NONCE_REGISTERED);

        TransferResult result = delegate(intentId, intent);

        String txHash = result.transferId();
        IntentReceipt receipt = IntentReceipt.builder()
            .status("success")
            .intentId(intent.intentId())
            .intentHash(computeIntentHash(intent))
            .txHash(txHash)
            .explorerUrl(properties.getExplorerTxUrl() + txHash)
            .amount(intent.amount())
            .currency(intent.currency())
            .from(intent.fromAgent())
            .to(intent.to())
            .mode(MODE)
            .message(SUCCESS_MESSAGE)
            .build();
        transition(intentId, IntentStage.SUCCEEDED);
        log.info("x402 intent executed: intent={}, tx={}", intentId, LogSanitizer.sanitize(txHash));
        return receipt;
    }

    /**
     * Hex SHA-256 over {@code intentId:fromAgent:to:amount:nonce}.
     */
    public String computeIntentHash(SignedIntent intent) {
        String material = intent.intentId() + ":" + intent.fromAgent() + ":" + intent.to() + ":"
            + intent.amount() + ":" + intent.nonce();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private TransferResult delegate(String intentId, SignedIntent intent) {
        transition(intentId, IntentStage.EXECUTING);
        TransferCommand command = TransferCommand.of(intent.fromAgent(), intent.to(), intent.amount(), intent.currency());
        TransferResult result;
        try {
            result = paymentClient.execute(command);
        } catch (Exception e) {
            fail(intentId, IntentStage.EXECUTING);
            log.error("Payment execution failed for intent {}: {}", intentId, LogSanitizer.sanitize(e.getMessage()));
            throw new PaymentExecutionException("X402 execution failed: " + e.getMessage(), e);
        }
        if (result == null || !result.isSuccessful()) {
            String reason = result == null ? "backend returned no result" : result.failureReason();
            fail(intentId, IntentStage.EXECUTING);
            log.error("Payment execution failed for intent {}: {}", intentId, LogSanitizer.sanitize(reason));
            throw new PaymentExecutionException("X402 execution failed: " + reason, reason);
        }
        return result;
    }

    private void validateShape(SignedIntent intent) {
        if (intent == null) {
            throw new PaymentValidationException("Intent is required");
        }
        requirePresent(intent.intentId(), "intentId");
        requirePresent(intent.fromAgent(), "fromAgent");
        requirePresent(intent.to(), "to");
        requirePresent(intent.amount(), "amount");
        requirePresent(intent.nonce(), "nonce");
        if (!WalletIdentifiers.isRawAddress(intent.to())) {
            throw new PaymentValidationException("to must be a 0x-prefixed 40 hex character address");
        }
        try {
            WalletIdentifiers.parsePositiveAmount(intent.amount(), "amount");
        } catch (IllegalArgumentException e) {
            throw new PaymentValidationException(e.getMessage(), e);
        }
    }

    private static void requirePresent(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new PaymentValidationException(field + " is required");
        }
    }

    private static void transition(String intentId, IntentStage stage) {
        log.debug("Intent {} -> {}", intentId, stage);
    }

    private static void fail(String intentId, IntentStage reached) {
        log.debug("Intent {} -> {} (after {})", intentId, IntentStage.FAILED, reached);
    }
}
