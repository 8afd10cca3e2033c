package arcpay.guard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

/**
 * Off-chain signed x402 payment intent. Mirrors the X402Intent EIP-712 struct
 * plus the signature over it.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SignedIntent(
    @NotBlank String intentId,
    @NotBlank String fromAgent,  // custodial wallet id funds move from
    @NotBlank String to,         // recipient address
    @NotBlank String amount,     // decimal string, signed as EIP-712 string
    String currency,
    Long expiresAt,              // unix seconds
    @NotBlank String nonce,
    String signature             // 65-byte hex
) {

    public static final String DEFAULT_CURRENCY = "USD";

    public SignedIntent {
        if (currency == null || currency.isBlank()) {
            currency = DEFAULT_CURRENCY;
        }
    }
}
