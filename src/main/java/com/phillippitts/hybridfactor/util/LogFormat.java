package com.phillippitts.hybridfactor.util;

import java.math.BigInteger;

/** Utility for compact logging of very large integers. */
public final class LogFormat {
    private LogFormat() {}

    /**
     * Returns the decimal form of {@code n} when it has at most {@code maxDigits} digits,
     * otherwise its leading and trailing digits around an ellipsis plus the digit count.
     * Returns "" for null.
     */
    public static String abbreviate(BigInteger n, int maxDigits) {
        if (n == null) {
            return "";
        }
        String digits = n.toString();
        if (maxDigits <= 0 || digits.length() <= maxDigits) {
            return digits;
        }
        int half = Math.max(1, maxDigits / 2);
        return digits.substring(0, half) + "..." + digits.substring(digits.length() - half)
                + " (" + digits.length() + " digits)";
    }
}
