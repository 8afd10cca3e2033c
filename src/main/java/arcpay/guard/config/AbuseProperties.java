package arcpay.guard.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "abuse")
public class AbuseProperties {

    /** Failed requests within one window that trigger an automatic block. */
    private int threshold = 50;

    /** Length of the failure counting window. */
    private Duration window = Duration.ofMinutes(15);

    /** Block length used for automatic blocks and for explicit blocks without a duration. */
    private Duration defaultBlockDuration = Duration.ofHours(1);

    /** How often idle, unblocked entries are evicted. */
    private Duration cleanupInterval = Duration.ofMinutes(5);

    /** Trusted headers carrying the caller's user id, checked in order. */
    private List<String> userIdHeaders = new ArrayList<>(List.of("X-Privy-User-Id", "X-User-Id"));
}
