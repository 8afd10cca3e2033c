package arcpay.guard.service.payment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a dry run against the backend's guard policies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SimulationResult(
    @JsonProperty("would_succeed") boolean wouldSucceed,
    @JsonProperty("estimated_fee") String estimatedFee,
    @JsonProperty("reason") String reason
) {

    public static SimulationResult passed(String estimatedFee) {
        return new SimulationResult(true, estimatedFee, null);
    }

    public static SimulationResult rejected(String reason) {
        return new SimulationResult(false, null, reason);
    }
}
