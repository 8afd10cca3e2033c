package arcpay.guard.service.abuse;

/**
 * The two independent key spaces abuse is tracked in.
 */
public enum AbuseScope {
    IP,
    USER
}
