package arcpay.guard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntentReceipt(
    String status,
    String intentId,
    String intentHash,
    String txHash,
    String explorerUrl,
    String amount,
    String currency,
    String from,
    String to,
    String mode,
    String message
) { }
