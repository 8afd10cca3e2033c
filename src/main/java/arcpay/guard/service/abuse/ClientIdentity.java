package arcpay.guard.service.abuse;

/**
 * Who is calling, derived per request. {@code userId} is null for anonymous callers.
 */
public record ClientIdentity(String ip, String userId) {

    public ClientIdentity {
        ip = (ip == null || ip.isBlank()) ? "unknown" : ip.trim();
        userId = (userId == null || userId.isBlank()) ? null : userId.trim();
    }

    public static ClientIdentity ofIp(String ip) {
        return new ClientIdentity(ip, null);
    }

    public boolean hasUser() {
        return userId != null;
    }
}
