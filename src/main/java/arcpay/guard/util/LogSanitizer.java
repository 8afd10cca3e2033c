package arcpay.guard.util;

import java.util.regex.Pattern;

/**
 * Helpers that make caller supplied values safe for log statements.
 * Control characters are stripped to prevent log injection, and wallet ids,
 * nonces and client addresses can be masked down to a debuggable prefix.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Removes control characters that could be abused for log injection.
     *
     * @param value caller provided value
     * @return sanitized value, never {@code null}
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Masks identifiers such as wallet ids or nonces while keeping a prefix and
     * suffix for correlation.
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        if (sanitized.length() == 1) {
            return "*";
        }
        if (sanitized.length() <= 4) {
            return sanitized.charAt(0) + "***";
        }
        int prefixLength = Math.min(6, sanitized.length() / 2);
        int suffixLength = Math.min(4, Math.max(1, sanitized.length() - prefixLength));
        return sanitized.substring(0, prefixLength) + "..." + sanitized.substring(sanitized.length() - suffixLength);
    }

    /**
     * Masks the last IPv4 octet, or the tail of any other address form.
     */
    public static String maskIp(String ip) {
        if (ip == null || ip.isBlank()) {
            return "unknown";
        }
        String sanitized = sanitize(ip);
        int lastDot = sanitized.lastIndexOf('.');
        if (lastDot > 0 && sanitized.indexOf(':') < 0) {
            return sanitized.substring(0, lastDot) + ".***";
        }
        if (sanitized.length() > 8) {
            return sanitized.substring(0, sanitized.length() - 4) + "****";
        }
        return sanitized;
    }
}
