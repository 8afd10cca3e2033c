package arcpay.guard.service.abuse;

public record BlockStatus(boolean blocked, String reason) {

    private static final BlockStatus ALLOWED = new BlockStatus(false, null);

    public static BlockStatus allowed() {
        return ALLOWED;
    }

    public static BlockStatus denied(String reason) {
        return new BlockStatus(true, reason);
    }
}
