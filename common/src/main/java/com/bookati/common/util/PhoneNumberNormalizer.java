package com.bookati.common.util;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Brings customer phone numbers into one international form so that the same person
 * typed as "010 3256 0826", "00201032560826" or "+2001032560826" resolves to one customer.
 *
 * Egyptian numbers get special handling: the trunk "0" after the +20 country code is dropped
 * for mobile and landline prefixes 1, 2 and 5.
 */
public final class PhoneNumberNormalizer {

    private static final String EGYPT_CODE = "+20";
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-()]");
    private static final Pattern INTERNATIONAL = Pattern.compile("\\+\\d{8,15}");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private PhoneNumberNormalizer() {
        // Utility class
    }

    /**
     * @return the normalized number, or empty when the format cannot be recognised
     */
    public static Optional<String> normalize(String phone) {
        if (phone == null || phone.isBlank()) {
            return Optional.empty();
        }
        String cleaned = SEPARATORS.matcher(phone).replaceAll("");

        if (cleaned.startsWith("00")) {
            cleaned = "+" + cleaned.substring(2);
        }
        if (cleaned.startsWith("+")) {
            if (cleaned.startsWith(EGYPT_CODE)) {
                cleaned = dropTrunkZero(cleaned.substring(EGYPT_CODE.length()));
            }
            return international(cleaned);
        }
        if (!DIGITS.matcher(cleaned).matches()) {
            return Optional.empty();
        }

        // 01XXXXXXXXX local format
        if (cleaned.length() == 11 && cleaned.startsWith("0") && isEgyptianPrefix(cleaned.charAt(1))) {
            return Optional.of(EGYPT_CODE + cleaned.substring(1));
        }
        // country code without the plus
        if (cleaned.startsWith("20") && cleaned.length() >= 12) {
            return international(dropTrunkZero(cleaned.substring(2)));
        }
        // local number without its trunk zero
        if (cleaned.length() == 10 && isEgyptianPrefix(cleaned.charAt(0))) {
            return Optional.of(EGYPT_CODE + cleaned);
        }
        return Optional.empty();
    }

    private static Optional<String> international(String candidate) {
        return INTERNATIONAL.matcher(candidate).matches() ? Optional.of(candidate) : Optional.empty();
    }

    private static String dropTrunkZero(String afterCode) {
        if (afterCode.length() >= 10 && afterCode.charAt(0) == '0' && isEgyptianPrefix(afterCode.charAt(1))) {
            return EGYPT_CODE + afterCode.substring(1);
        }
        return EGYPT_CODE + afterCode;
    }

    private static boolean isEgyptianPrefix(char c) {
        return c == '1' || c == '2' || c == '5';
    }
}
