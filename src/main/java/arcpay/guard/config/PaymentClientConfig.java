package arcpay.guard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import com.fasterxml.jackson.databind.ObjectMapper;

import arcpay.guard.service.payment.OmniAgentPayHttpClient;
import arcpay.guard.service.payment.PaymentExecutionClient;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

/**
 * Wires the single payment backend client shared by the intent pipeline and
 * the orchestrator. Created on first use.
 */
@Configuration
@Slf4j
public class PaymentClientConfig {

    @Bean
    @Lazy
    public OkHttpClient paymentBackendHttpClient(PaymentBackendProperties properties) {
        return new OkHttpClient.Builder()
            .connectTimeout(properties.getConnectTimeout())
            .readTimeout(properties.getReadTimeout())
            .writeTimeout(properties.getReadTimeout())
            .retryOnConnectionFailure(false)
            .build();
    }

    @Bean
    @Lazy
    public PaymentExecutionClient paymentExecutionClient(
        OkHttpClient paymentBackendHttpClient,
        ObjectMapper objectMapper,
        PaymentBackendProperties properties
    ) {
        log.info("Payment backend client initialised for {}", properties.getBaseUrl());
        return new OmniAgentPayHttpClient(paymentBackendHttpClient, objectMapper, properties);
    }
}
