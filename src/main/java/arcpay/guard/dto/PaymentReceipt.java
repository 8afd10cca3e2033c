package arcpay.guard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * Result of a direct payment. The transfer id is repeated under several keys
 * because downstream readers disagree on its name.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentReceipt(
    @JsonProperty("status") String status,
    @JsonProperty("payment_id") String paymentId,
    @JsonProperty("transfer_id") String transferId,
    @JsonProperty("transaction_id") String transactionId,
    @JsonProperty("blockchain_tx") String blockchainTx,
    @JsonProperty("amount") String amount,
    @JsonProperty("currency") String currency,
    @JsonProperty("destination_chain") String destinationChain,
    @JsonProperty("estimated_fee") String estimatedFee,
    @JsonProperty("message") String message,
    @JsonProperty("idempotency_key") String idempotencyKey
) { }
