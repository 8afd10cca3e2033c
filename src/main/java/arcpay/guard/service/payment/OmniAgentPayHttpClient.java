package arcpay.guard.service.payment;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import arcpay.guard.config.PaymentBackendProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link PaymentExecutionClient} that talks JSON over HTTP to the OmniAgentPay backend.
 */
@Slf4j
public class OmniAgentPayHttpClient implements PaymentExecutionClient {

    static final String SIMULATE_PATH = "/v1/payments/simulate";
    static final String EXECUTE_PATH = "/v1/payments";
    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;

    public OmniAgentPayHttpClient(OkHttpClient httpClient, ObjectMapper mapper, PaymentBackendProperties properties) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = stripTrailingSlash(properties.getBaseUrl());
        this.apiKey = properties.getApiKey();
    }

    @Override
    public SimulationResult simulate(TransferCommand command) throws IOException {
        return post(SIMULATE_PATH, command, SimulationResult.class);
    }

    @Override
    public TransferResult execute(TransferCommand command) throws IOException {
        return post(EXECUTE_PATH, command, TransferResult.class);
    }

    private <T> T post(String path, TransferCommand command, Class<T> responseType) throws IOException {
        String payload = mapper.writeValueAsString(toPayload(command));
        Request.Builder builder = new Request.Builder()
            .url(baseUrl + path)
            .post(RequestBody.create(payload, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.addHeader("Authorization", "Bearer " + apiKey);
        }
        if (command.idempotencyKey() != null) {
            builder.addHeader(IDEMPOTENCY_HEADER, command.idempotencyKey());
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                log.warn("Payment backend {} responded with {}", path, response.code());
                throw new IOException("Payment backend returned HTTP " + response.code() + describe(text));
            }
            if (text.isBlank()) {
                throw new IOException("Payment backend returned an empty body for " + path);
            }
            return mapper.readValue(text, responseType);
        }
    }

    private static Map<String, Object> toPayload(TransferCommand command) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("wallet_id", command.walletId());
        payload.put("recipient", command.recipient());
        payload.put("amount", command.amount());
        payload.put("currency", command.currency());
        if (command.destinationChain() != null) {
            payload.put("destination_chain", command.destinationChain());
        }
        return payload;
    }

    private static String describe(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.length() > 200 ? body.substring(0, 200) + "..." : body;
        return ": " + trimmed;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
