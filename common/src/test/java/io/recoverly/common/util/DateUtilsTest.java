package io.recoverly.common.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateUtilsTest {

    @Test
    void parseDate_ShouldHandleSupportedFormats() {
        assertEquals(LocalDate.of(2025, 3, 5), DateUtils.parseDate("2025-03-05"));
        assertEquals(LocalDate.of(2025, 3, 5), DateUtils.parseDate("2025-3-5"));
        assertEquals(LocalDate.of(2025, 3, 5), DateUtils.parseDate("2025-03-05T10:15:30.000Z"));
        assertEquals(LocalDate.of(2025, 3, 5), DateUtils.parseDate(LocalDate.of(2025, 3, 5)));
    }

    @Test
    void parseDate_ShouldReturnNullForInvalidInput() {
        assertNull(DateUtils.parseDate(null));
        assertNull(DateUtils.parseDate(""));
        assertNull(DateUtils.parseDate("2025-02-30"));
        assertNull(DateUtils.parseDate("not a date"));
    }

    @Test
    void daysOverdue_ShouldBeFlooredAtZero() {
        LocalDate due = LocalDate.of(2025, 1, 15);

        assertEquals(0, DateUtils.daysOverdue(due, LocalDate.of(2025, 1, 10)));
        assertEquals(0, DateUtils.daysOverdue(due, due));
        assertEquals(25, DateUtils.daysOverdue(due, LocalDate.of(2025, 2, 9)));
        assertEquals(0, DateUtils.daysOverdue(null, due));
    }

    @Test
    void daysBetween_ShouldCountCalendarDaysAcrossLeapYear() {
        assertEquals(366, DateUtils.daysBetween(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1)));
        assertEquals(-1, DateUtils.daysBetween(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)));
    }

    @Test
    void resolveDueDate_ShouldPreferOverride() {
        LocalDate invoiceDate = LocalDate.of(2025, 1, 1);

        assertEquals(LocalDate.of(2025, 1, 31), DateUtils.resolveDueDate(invoiceDate, 30, null));
        assertEquals(invoiceDate, DateUtils.resolveDueDate(invoiceDate, null, null));
        assertEquals(LocalDate.of(2025, 2, 10),
                DateUtils.resolveDueDate(invoiceDate, 30, LocalDate.of(2025, 2, 10)));
        assertNull(DateUtils.resolveDueDate(null, 30, null));
    }

    @Test
    void formatDate_ShouldUseIsoFormat() {
        assertEquals("2025-01-05", DateUtils.formatDate(LocalDate.of(2025, 1, 5)));
        assertNull(DateUtils.formatDate(null));
    }
}
