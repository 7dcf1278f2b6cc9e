package io.recoverly.common.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for date parsing and calendar-day arithmetic.
 * Day counts are calendar days, not business days.
 */
public final class DateUtils {

    private static final DateTimeFormatter ISO_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final Pattern YMD_PATTERN = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");
    // ISO datetime pattern: YYYY-MM-DDTHH:mm:ss (with optional milliseconds)
    private static final Pattern ISO_DATETIME_PATTERN = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})T.*$");

    private DateUtils() {
        // Utility class - no instantiation
    }

    /**
     * Parse date from a stored value.
     *
     * Supports:
     * - LocalDate instances
     * - YYYY-MM-DD strings
     * - ISO datetime strings (time part ignored)
     *
     * @param dateValue Date value in any supported format
     * @return LocalDate or null if parsing fails
     */
    public static LocalDate parseDate(Object dateValue) {
        if (dateValue == null) {
            return null;
        }

        if (dateValue instanceof LocalDate) {
            return (LocalDate) dateValue;
        }

        String dateStr = dateValue.toString().trim();
        if (dateStr.isEmpty()) {
            return null;
        }

        Matcher ymdMatcher = YMD_PATTERN.matcher(dateStr);
        if (!ymdMatcher.matches()) {
            ymdMatcher = ISO_DATETIME_PATTERN.matcher(dateStr);
        }
        if (ymdMatcher.matches()) {
            try {
                return LocalDate.of(
                        Integer.parseInt(ymdMatcher.group(1)),
                        Integer.parseInt(ymdMatcher.group(2)),
                        Integer.parseInt(ymdMatcher.group(3)));
            } catch (DateTimeException e) {
                return null;
            }
        }

        try {
            return LocalDate.parse(dateStr, ISO_FORMAT);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    /**
     * Format LocalDate to YYYY-MM-DD string.
     */
    public static String formatDate(LocalDate date) {
        return date == null ? null : date.format(ISO_FORMAT);
    }

    /**
     * Signed calendar days from {@code from} to {@code to}.
     */
    public static long daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }

    /**
     * Days a payment was late, floored at zero.
     * A payment on or before the due date is 0 days overdue.
     *
     * @param dueDate invoice due date
     * @param paidOn  payment date (or the as-of date for an unpaid balance)
     */
    public static int daysOverdue(LocalDate dueDate, LocalDate paidOn) {
        if (dueDate == null || paidOn == null) {
            return 0;
        }
        long days = daysBetween(dueDate, paidOn);
        return days > 0 ? Math.toIntExact(days) : 0;
    }

    /**
     * Effective due date of an invoice.
     *
     * @param invoiceDate      invoice date
     * @param paymentTermsDays payment terms (null = 0)
     * @param override         manual override, wins when present
     */
    public static LocalDate resolveDueDate(LocalDate invoiceDate, Integer paymentTermsDays, LocalDate override) {
        if (override != null) {
            return override;
        }
        if (invoiceDate == null) {
            return null;
        }
        int terms = paymentTermsDays != null ? paymentTermsDays : 0;
        return invoiceDate.plusDays(terms);
    }
}
