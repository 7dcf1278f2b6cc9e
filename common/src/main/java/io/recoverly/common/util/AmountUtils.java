package io.recoverly.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed-point money arithmetic for the ledger.
 *
 * All money values are BigDecimal with scale 2 (HALF_UP). Every value that
 * is stored or reported must pass through {@link #round(BigDecimal)} so that
 * repeated recomputation never drifts by a cent.
 */
public final class AmountUtils {

    public static final int MONEY_SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Pattern NUMERIC_PATTERN = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private AmountUtils() {
        // Utility class - no instantiation
    }

    /**
     * Parse amount from a stored value.
     *
     * Handles:
     * - Numbers (Double/Long from Firestore documents)
     * - Strings with spaces or thousands separators
     * - Comma used as decimal separator
     *
     * @param value Value to parse
     * @return BigDecimal amount or ZERO if parsing fails
     */
    public static BigDecimal parseAmount(Object value) {
        if (value == null) {
            return zero();
        }

        if (value instanceof BigDecimal) {
            return round((BigDecimal) value);
        }

        if (value instanceof Number) {
            // toString avoids binary expansion of doubles like 0.1
            return new BigDecimal(value.toString()).setScale(MONEY_SCALE, ROUNDING);
        }

        String stringValue = value.toString()
                .replaceAll("[\\s\\u00A0\\u202F\\u2009]+", "")
                .trim();

        if (stringValue.contains(",") && !stringValue.contains(".")) {
            stringValue = stringValue.replace(",", ".");
        } else {
            stringValue = stringValue.replace(",", "");
        }

        Matcher matcher = NUMERIC_PATTERN.matcher(stringValue);
        if (!matcher.find()) {
            return zero();
        }

        try {
            return new BigDecimal(matcher.group()).setScale(MONEY_SCALE, ROUNDING);
        } catch (NumberFormatException e) {
            return zero();
        }
    }

    /**
     * Nullable variant of {@link #parseAmount(Object)}: returns null for a null input.
     */
    public static BigDecimal parseNullableAmount(Object value) {
        return value == null ? null : parseAmount(value);
    }

    /**
     * Round amount to 2 decimal places.
     */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return zero();
        }
        return amount.setScale(MONEY_SCALE, ROUNDING);
    }

    /**
     * Zero with money scale (0.00).
     */
    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(MONEY_SCALE);
    }

    /**
     * Null-safe zero substitution, rounded to money scale.
     */
    public static BigDecimal nullToZero(BigDecimal amount) {
        return amount == null ? zero() : round(amount);
    }

    /**
     * Check if amount is positive (greater than zero).
     */
    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.compareTo(BigDecimal.ZERO) > 0;
    }

    /**
     * Check if amount is null or zero.
     */
    public static boolean isZero(BigDecimal amount) {
        return amount == null || amount.signum() == 0;
    }

    /**
     * Sum amounts, ignoring nulls.
     */
    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        BigDecimal total = zero();
        if (amounts == null) {
            return total;
        }
        for (BigDecimal amount : amounts) {
            if (amount != null) {
                total = total.add(amount);
            }
        }
        return round(total);
    }

    /**
     * Smaller of two amounts.
     */
    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Clamp negative amounts to zero.
     */
    public static BigDecimal floorAtZero(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            return zero();
        }
        return round(amount);
    }

    /**
     * part / whole x 100, rounded to 2 decimals.
     *
     * @return percentage, or null when whole is null or zero
     */
    public static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        if (isZero(whole)) {
            return null;
        }
        return nullToZero(part)
                .multiply(HUNDRED)
                .divide(whole, MONEY_SCALE, ROUNDING);
    }

    /**
     * Simple interest: amount x annualRate% x days / (100 x daysInYear), in one quantization step.
     *
     * @param amount     principal of the tranche
     * @param annualRate annual rate in percent (18 = 18% p.a.)
     * @param days       overdue days, never negative
     * @param daysInYear day-count basis
     */
    public static BigDecimal simpleInterest(BigDecimal amount, BigDecimal annualRate, long days, int daysInYear) {
        if (amount == null || annualRate == null || days <= 0 || annualRate.signum() <= 0) {
            return zero();
        }
        return amount
                .multiply(annualRate)
                .multiply(BigDecimal.valueOf(days))
                .divide(HUNDRED.multiply(BigDecimal.valueOf(daysInYear)), MONEY_SCALE, ROUNDING);
    }
}
