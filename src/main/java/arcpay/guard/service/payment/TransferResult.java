package arcpay.guard.service.payment;

import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of an executed transfer as reported by the backend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransferResult(
    @JsonProperty("transfer_id") String transferId,
    @JsonProperty("status") String status,
    @JsonProperty("blockchain_tx") String blockchainTx,
    @JsonProperty("amount") String amount,
    @JsonProperty("error") String error
) {

    private static final Set<String> FAILURE_STATUSES =
        Set.of("failed", "failure", "error", "rejected", "denied", "cancelled", "canceled", "blocked");

    public TransferResult(String transferId, String status, String blockchainTx, String amount) {
        this(transferId, status, blockchainTx, amount, null);
    }

    /**
     * A transfer counts as done only with an id and a status that is not a failure.
     */
    @JsonIgnore
    public boolean isSuccessful() {
        if (transferId == null || transferId.isBlank() || status == null || status.isBlank()) {
            return false;
        }
        return !FAILURE_STATUSES.contains(status.trim().toLowerCase(Locale.ROOT));
    }

    @JsonIgnore
    public String failureReason() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        if (transferId == null || transferId.isBlank()) {
            return "backend returned no transfer id";
        }
        return "backend reported status " + status;
    }
}
