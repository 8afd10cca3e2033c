package arcpay.guard.security;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.annotation.Nonnull;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;

import arcpay.guard.service.abuse.AbuseTrackerService;
import arcpay.guard.service.abuse.BlockStatus;
import arcpay.guard.service.abuse.ClientIdentity;
import arcpay.guard.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Admission gate in front of every endpoint. Blocked clients are turned away
 * with 403; for everyone else failed responses and unhandled faults are
 * reported back to the abuse tracker.
 */
@Component
@Order(-200) // Ahead of the Spring Security chain
@Slf4j
public class AbuseDetectionFilter extends OncePerRequestFilter {

    /**
     * Request attribute through which downstream filters name the failure they produced.
     */
    public static final String FAILURE_REASON_ATTRIBUTE = AbuseDetectionFilter.class.getName() + ".failureReason";

    static final String UNHANDLED_EXCEPTION = "unhandled_exception";

    private final AbuseTrackerService abuseTracker;
    private final ClientIdentityResolver identityResolver;
    private final ObjectMapper objectMapper;

    public AbuseDetectionFilter(
            AbuseTrackerService abuseTracker,
            ClientIdentityResolver identityResolver,
            ObjectMapper objectMapper
    ) {
        this.abuseTracker = abuseTracker;
        this.identityResolver = identityResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            @Nonnull HttpServletRequest request,
            @Nonnull HttpServletResponse response,
            @Nonnull FilterChain filterChain
    ) throws ServletException, IOException {

        ClientIdentity identity = identityResolver.resolve(request);
        BlockStatus status = abuseTracker.isBlocked(identity);
        if (status.blocked()) {
            log.warn("Denied blocked client: path={}, ip={}, user={}",
                LogSanitizer.sanitize(request.getRequestURI()),
                LogSanitizer.maskIp(identity.ip()),
                LogSanitizer.maskIdentifier(identity.userId()));
            sendAccessDenied(response, status.reason());
            return;
        }

        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            abuseTracker.recordFailure(identity, UNHANDLED_EXCEPTION);
            throw e;
        }

        int code = response.getStatus();
        if (code >= 400) {
            Object signalled = request.getAttribute(FAILURE_REASON_ATTRIBUTE);
            String reason = signalled != null ? signalled.toString() : "http_" + code;
            abuseTracker.recordFailure(identity, reason);
        }
    }

    private void sendAccessDenied(HttpServletResponse response, String reason) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Access denied");
        body.put("details", reason);
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
