package arcpay.guard.security;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import arcpay.guard.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the abuse administration endpoints reachable from the local host only.
 * The socket peer decides; forwarded headers are ignored because any caller
 * can set them.
 */
@Component
@Order(0)
@Slf4j
public class LocalhostOnlyFilter extends OncePerRequestFilter {

    static final String ADMIN_PREFIX = "/admin";

    /** IPv4/IPv6 literals only, so address parsing never turns into a DNS lookup. */
    private static final Pattern IP_LITERAL = Pattern.compile("^[0-9a-fA-F:.%]+$");

    private static final String DENIED_BODY =
        "{\"success\":false,\"error\":\"access_denied\",\"message\":\"Admin endpoints are available from localhost only\"}";

    private final boolean allowPrivateNetworks;

    public LocalhostOnlyFilter(@Value("${security.allow-private-networks:false}") boolean allowPrivateNetworks) {
        this.allowPrivateNetworks = allowPrivateNetworks;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !(path.equals(ADMIN_PREFIX) || path.startsWith(ADMIN_PREFIX + "/"));
    }

    @Override
    protected void doFilterInternal(
        @NonNull HttpServletRequest request,
        @NonNull HttpServletResponse response,
        @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        InetAddress peer = parsePeer(request.getRemoteAddr());
        if (peer != null && isTrusted(peer)) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Admin request from non-local peer refused: path={}, peer={}",
            LogSanitizer.sanitize(request.getRequestURI()), LogSanitizer.maskIp(request.getRemoteAddr()));
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(DENIED_BODY);
    }

    private boolean isTrusted(InetAddress peer) {
        // Docker bridge peers (172.x/10.x/192.168.x) only when explicitly enabled
        return peer.isLoopbackAddress() || (allowPrivateNetworks && peer.isSiteLocalAddress());
    }

    private static InetAddress parsePeer(String remoteAddr) {
        if (remoteAddr == null || !IP_LITERAL.matcher(remoteAddr.trim()).matches()) {
            return null;
        }
        try {
            return InetAddress.getByName(remoteAddr.trim());
        } catch (UnknownHostException e) {
            log.debug("Unparseable peer address {}", LogSanitizer.sanitize(remoteAddr));
            return null;
        }
    }
}
