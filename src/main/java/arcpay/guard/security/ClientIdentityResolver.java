package arcpay.guard.security;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import arcpay.guard.config.AbuseProperties;
import arcpay.guard.service.abuse.ClientIdentity;

/**
 * Derives the caller's IP and optional user id from a request.
 */
@Component
public class ClientIdentityResolver {

    private final List<String> userIdHeaders;

    public ClientIdentityResolver(AbuseProperties properties) {
        this.userIdHeaders = List.copyOf(properties.getUserIdHeaders());
    }

    public ClientIdentity resolve(HttpServletRequest request) {
        return new ClientIdentity(resolveIp(request), resolveUserId(request));
    }

    String resolveIp(HttpServletRequest request) {
        // Left-most X-Forwarded-For entry is the original client
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            String first = xForwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return request.getRemoteAddr();
    }

    String resolveUserId(HttpServletRequest request) {
        for (String header : userIdHeaders) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
