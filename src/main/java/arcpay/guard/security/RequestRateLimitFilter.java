package arcpay.guard.security;

import arcpay.guard.service.abuse.ClientIdentity;
import arcpay.guard.util.LogSanitizer;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import jakarta.annotation.Nonnull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket limits per client:
 * - general: every path except health, per IP
 * - strict: payment endpoints (/x402, /payments), per IP
 * - user: every path, per user id (IP for anonymous callers)
 * Oversized bodies are refused before any bucket is touched.
 */
@Component
@Order(1) // After LocalhostOnlyFilter
@Slf4j
public class RequestRateLimitFilter extends OncePerRequestFilter {

    static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    static final String REQUEST_TOO_LARGE = "request_too_large";

    @Value("${rate.limit.enabled:true}")
    private boolean rateLimitEnabled;

    @Value("${rate.limit.window-minutes:15}")
    private long windowMinutes;

    @Value("${rate.limit.general.requests:100}")
    private int generalRequests;

    @Value("${rate.limit.strict.requests:20}")
    private int strictRequests;

    @Value("${rate.limit.user.requests:200}")
    private int userRequests;

    @Value("${rate.limit.max-body-bytes:1048576}")
    private long maxBodyBytes;

    private final ClientIdentityResolver identityResolver;

    private final Map<String, Bucket> generalBuckets = new ConcurrentHashMap<>();
    private final Map<String, Bucket> strictBuckets = new ConcurrentHashMap<>();
    private final Map<String, Bucket> userBuckets = new ConcurrentHashMap<>();

    // Maximum buckets to prevent memory exhaustion
    private static final int MAX_BUCKETS = 50000;

    public RequestRateLimitFilter(ClientIdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    protected void doFilterInternal(
            @Nonnull HttpServletRequest request,
            @Nonnull HttpServletResponse response,
            @Nonnull FilterChain filterChain
    ) throws ServletException, IOException {

        if (!rateLimitEnabled) {
            filterChain.doFilter(request, response);
            return;
        }

        String path = request.getRequestURI();
        ClientIdentity identity = identityResolver.resolve(request);

        if (request.getContentLengthLong() > maxBodyBytes) {
            log.warn("Request body too large: path={}, ip={}, length={}",
                LogSanitizer.sanitize(path), LogSanitizer.maskIp(identity.ip()), request.getContentLengthLong());
            request.setAttribute(AbuseDetectionFilter.FAILURE_REASON_ATTRIBUTE, REQUEST_TOO_LARGE);
            response.setStatus(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE);
            response.setContentType("application/json");
            response.getWriter().write("{\"error\":\"Request entity too large\"}");
            return;
        }

        if (!isHealthEndpoint(path)) {
            ConsumptionProbe general = consume(generalBuckets, identity.ip(), generalRequests);
            if (!general.isConsumed()) {
                rejectTooManyRequests(request, response, "general", path, identity, general);
                return;
            }
        }

        if (isPaymentEndpoint(path)) {
            ConsumptionProbe strict = consume(strictBuckets, identity.ip(), strictRequests);
            if (!strict.isConsumed()) {
                rejectTooManyRequests(request, response, "payment", path, identity, strict);
                return;
            }
        }

        String userKey = identity.hasUser() ? identity.userId() : identity.ip();
        ConsumptionProbe user = consume(userBuckets, userKey, userRequests);
        if (!user.isConsumed()) {
            rejectTooManyRequests(request, response, "user", path, identity, user);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private boolean isHealthEndpoint(String path) {
        return path.equals("/health") || path.startsWith("/actuator/health");
    }

    private boolean isPaymentEndpoint(String path) {
        return path.startsWith("/x402/") || path.equals("/x402")
                || path.startsWith("/payments/") || path.equals("/payments");
    }

    private ConsumptionProbe consume(Map<String, Bucket> buckets, String key, int limit) {
        cleanupBucketsIfNeeded(buckets);
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket(limit));
        return bucket.tryConsumeAndReturnRemaining(1);
    }

    private Bucket createBucket(int limit) {
        return Bucket.builder()
                .addLimit(Bandwidth.builder()
                        .capacity(limit)
                        .refillGreedy(limit, Duration.ofMinutes(windowMinutes))
                        .build())
                .build();
    }

    private void rejectTooManyRequests(
            HttpServletRequest request,
            HttpServletResponse response,
            String limit,
            String path,
            ClientIdentity identity,
            ConsumptionProbe probe
    ) throws IOException {
        log.warn("Rate limit exceeded ({}): path={}, ip={}, user={}", limit,
                LogSanitizer.sanitize(path), LogSanitizer.maskIp(identity.ip()),
                LogSanitizer.maskIdentifier(identity.userId()));
        long retryAfterSeconds = Math.max(1L,
                TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()) + 1);

        request.setAttribute(AbuseDetectionFilter.FAILURE_REASON_ATTRIBUTE, RATE_LIMIT_EXCEEDED);
        response.setStatus(429);
        response.setContentType("application/json");
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.getWriter().write("{\"error\":\"Too many requests. Please try again later.\"}");
    }

    private void cleanupBucketsIfNeeded(Map<String, Bucket> buckets) {
        if (buckets.size() > MAX_BUCKETS) {
            log.info("Cleaning up rate limit buckets, current size: {}", buckets.size());
            buckets.clear();
        }
    }
}
