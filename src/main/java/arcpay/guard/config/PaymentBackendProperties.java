package arcpay.guard.config;

import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "payments.backend")
public class PaymentBackendProperties {

    /** Base URL of the payment execution backend. */
    private String baseUrl = "http://localhost:8090";

    /** Bearer key sent with every backend call; may be blank in dev. */
    private String apiKey;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(30);
}
