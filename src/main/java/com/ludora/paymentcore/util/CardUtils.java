package com.ludora.paymentcore.util;

import java.util.Locale;
import java.util.Map;

/**
 * Utility class for card metadata reported by the payment provider.
 *
 * Features:
 *  - Masking from the last four digits (the full PAN never reaches this service).
 *  - Brand normalisation across the provider's spellings.
 */
public final class CardUtils {

    private static final String MASK_PREFIX = "************";

    private static final Map<String, String> BRANDS = Map.of(
            "visa", "VISA",
            "mastercard", "MASTERCARD",
            "master", "MASTERCARD",
            "mc", "MASTERCARD",
            "amex", "AMEX",
            "american_express", "AMEX",
            "american express", "AMEX",
            "diners", "DINERS",
            "discover", "DISCOVER",
            "isracard", "ISRACARD"
    );

    private CardUtils() {
    }

    /**
     * Builds a masked card number from whatever digits the provider sent.
     *
     * Example:
     *  - Input:  "1111" or "4580-xxxx-xxxx-1111"
     *  - Output: ************1111
     *
     * @return masked card, or null when fewer than four digits are available
     */
    public static String masked(String lastDigits) {
        if (lastDigits == null) return null;
        String digits = lastDigits.replaceAll("\\D", "");
        if (digits.length() < 4) return null;
        return MASK_PREFIX + digits.substring(digits.length() - 4);
    }

    /**
     * Normalises a provider brand name.
     *
     * @return upper-case brand, "UNKNOWN" when missing
     */
    public static String brand(String raw) {
        if (raw == null || raw.isBlank()) return "UNKNOWN";
        String key = raw.trim().toLowerCase(Locale.ROOT);
        return BRANDS.getOrDefault(key, key.toUpperCase(Locale.ROOT));
    }
}
