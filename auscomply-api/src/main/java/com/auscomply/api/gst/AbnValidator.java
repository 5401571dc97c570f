package com.auscomply.api.gst;

/**
 * Australian Business Number checks using the ATO weighted checksum:
 * subtract 1 from the first digit, weight the digits, and the sum must divide by 89.
 */
public final class AbnValidator {

    private static final int[] WEIGHTS = {10, 1, 3, 5, 7, 9, 11, 13, 15, 17, 19};
    private static final int MODULUS = 89;

    private AbnValidator() {}

    /**
     * Strips spaces and any other non-digit characters.
     */
    public static String normalize(String abn) {
        return abn == null ? "" : abn.replaceAll("\\D", "");
    }

    public static boolean isValid(String abn) {
        String digits = normalize(abn);
        if (digits.length() != WEIGHTS.length) {
            return false;
        }
        int sum = 0;
        for (int i = 0; i < WEIGHTS.length; i++) {
            int digit = digits.charAt(i) - '0';
            if (i == 0) {
                digit -= 1;
            }
            sum += digit * WEIGHTS[i];
        }
        return sum % MODULUS == 0;
    }

    /**
     * Formats an 11-digit ABN as {@code XX XXX XXX XXX}.
     */
    public static String format(String abn) {
        String digits = normalize(abn);
        if (digits.length() != WEIGHTS.length) {
            throw new IllegalArgumentException("ABN must have 11 digits");
        }
        return digits.substring(0, 2) + " " + digits.substring(2, 5) + " "
                + digits.substring(5, 8) + " " + digits.substring(8, 11);
    }
}
