package arcpay.guard.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;

/**
 * Admin request to block or unblock a client
 */
@Getter
@Setter
public class BlockRequest {
    @NotBlank
    private String ip;
    private String userId;          // optional
    @Positive
    private Long durationSeconds;   // ignored by unblock; default block duration when absent
}
