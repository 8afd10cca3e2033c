package arcpay.guard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

/**
 * Direct wallet-to-address payment requested by an agent.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentRequest(
    @JsonProperty("from_wallet_id") @NotBlank String fromWalletId,
    @JsonProperty("to_address") @NotBlank String toAddress,
    @JsonProperty("amount") @NotBlank String amount,
    @JsonProperty("currency") String currency,
    @JsonProperty("destination_chain") String destinationChain
) {

    public PaymentRequest {
        if (currency == null || currency.isBlank()) {
            currency = SignedIntent.DEFAULT_CURRENCY;
        }
    }
}
