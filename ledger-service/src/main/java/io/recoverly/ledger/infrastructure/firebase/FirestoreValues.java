package io.recoverly.ledger.infrastructure.firebase;

import com.google.cloud.Timestamp;
import io.recoverly.common.util.AmountUtils;
import io.recoverly.common.util.DateUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;

/**
 * Conversions between ledger field types and Firestore document values.
 *
 * Money is stored as a plain decimal string ("1234.50") and dates as
 * YYYY-MM-DD strings, so values round-trip without binary floating point.
 */
public final class FirestoreValues {

    private FirestoreValues() {
        // Utility class - no instantiation
    }

    public static String fromAmount(BigDecimal amount) {
        return amount != null ? AmountUtils.round(amount).toPlainString() : null;
    }

    public static BigDecimal toAmount(Object value) {
        return AmountUtils.parseNullableAmount(value);
    }

    public static String fromDate(LocalDate date) {
        return DateUtils.formatDate(date);
    }

    public static LocalDate toDate(Object value) {
        return DateUtils.parseDate(value);
    }

    public static Integer toInteger(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return null;
    }

    public static Timestamp fromDateTime(LocalDateTime dateTime) {
        if (dateTime == null) {
            return null;
        }
        return Timestamp.of(Date.from(dateTime.atZone(ZoneId.systemDefault()).toInstant()));
    }

    public static LocalDateTime toDateTime(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toDate()
                    .toInstant().atZone(ZoneId.systemDefault()).toLocalDateTime();
        }
        return null;
    }

    public static <E extends Enum<E>> E toEnum(Class<E> type, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
