package arcpay.guard.config;

import java.time.Duration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "x402")
public class X402Properties {

    /**
     * Address every intent must be signed by. Empty accepts any recoverable signer.
     */
    private String expectedSigner = "";

    private Domain domain = new Domain();

    /** How long a consumed nonce is remembered. */
    private Duration nonceRetention = Duration.ofHours(1);

    /** Number of nonce registrations between two opportunistic sweeps. */
    private int nonceSweepEvery = 1000;

    /** Explorer prefix the transfer id is appended to. */
    private String explorerTxUrl = "https://testnet.arcscan.app/tx/";

    @Data
    public static class Domain {
        private String name = "OmniAgentPay";
        private String version = "1";
        private long chainId = 5042002L;
    }
}
