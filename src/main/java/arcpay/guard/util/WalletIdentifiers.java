package arcpay.guard.util;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Format checks for wallet identifiers, recipient addresses and amounts.
 */
public final class WalletIdentifiers {

    /** 0x + 40 hex chars: the address of a wallet that needs end-user signing. */
    private static final Pattern RAW_ADDRESS = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    /** Custodial wallet ids: opaque tokens such as UUIDs or "wallet-..." handles. */
    private static final Pattern CUSTODIAL_WALLET_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{2,127}$");

    private WalletIdentifiers() {
        // Utility class
    }

    public static boolean isRawAddress(String value) {
        return value != null && RAW_ADDRESS.matcher(value.trim()).matches();
    }

    /**
     * A custodial id is any well-formed opaque id that is not a raw address.
     */
    public static boolean isCustodialWalletId(String value) {
        if (value == null || isRawAddress(value)) {
            return false;
        }
        return CUSTODIAL_WALLET_ID.matcher(value).matches();
    }

    /**
     * Parses a positive decimal amount given in string form.
     *
     * @throws IllegalArgumentException if the value is missing, not numeric or not positive
     */
    public static BigDecimal parsePositiveAmount(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " cannot be null or empty");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(fieldName + " must be a valid numeric string: " + value, ex);
        }
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException(fieldName + " must be positive: " + value);
        }
        return amount;
    }
}
