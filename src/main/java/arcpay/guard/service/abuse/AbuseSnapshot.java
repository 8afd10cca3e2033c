package arcpay.guard.service.abuse;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read-only view of what is tracked for one client.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AbuseSnapshot(String ip, String userId, BlockStatus status, AbuseEntry ipEntry, AbuseEntry userEntry) { }
