package com.flagship.budget_ledger.spend;

import com.flagship.budget_ledger.budget.BudgetMonth;
import com.flagship.budget_ledger.exception.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Normalizes every ledger date and every query boundary to the single
 * budgeting time zone ({@code budget.timezone}).
 *
 * Dates without an offset are read as wall-clock time in that zone; dates
 * with an offset are converted. Month windows are half-open
 * {@code [first day 00:00, first day of next month 00:00)} in the same zone,
 * which covers the whole of the inclusive calendar range.
 */
@Component
public class DateNormalizer {

    private final ZoneId zone;

    public DateNormalizer(@Value("${budget.timezone:UTC}") String timezone) {
        this.zone = ZoneId.of(timezone);
    }

    /**
     * Parses {@code YYYY-MM-DD}, a local date-time, or an ISO-8601 timestamp
     * with offset into an instant.
     */
    public Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw ValidationException.forField("date", "Date is required");
        }
        String value = text.trim();
        try {
            if (value.length() == 10) {
                return startOf(LocalDate.parse(value));
            }
            if (hasOffset(value)) {
                return OffsetDateTime.parse(value).toInstant();
            }
            return LocalDateTime.parse(value).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw ValidationException.forField("date", "Invalid date '" + text + "'");
        }
    }

    public Instant startOf(LocalDate date) {
        return date.atStartOfDay(zone).toInstant();
    }

    public LocalDate toLocalDate(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    public BudgetMonth monthOf(Instant instant) {
        return BudgetMonth.from(toLocalDate(instant));
    }

    /**
     * Window covering the inclusive calendar range {@code [start, end]}.
     */
    public DateWindow window(LocalDate start, LocalDate end) {
        if (end.isBefore(start)) {
            throw ValidationException.forField("end_date", "End date " + end + " is before start date " + start);
        }
        return new DateWindow(startOf(start), startOf(end.plusDays(1)));
    }

    public DateWindow monthWindow(BudgetMonth month) {
        return window(month.firstDay(), month.lastDay());
    }

    private static boolean hasOffset(String value) {
        if (value.endsWith("Z") || value.endsWith("z")) {
            return true;
        }
        int timeStart = value.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = value.substring(timeStart);
        return time.contains("+") || time.contains("-");
    }

    /**
     * Half-open instant range {@code [start, endExclusive)}.
     */
    @lombok.Value
    public static class DateWindow {
        Instant start;
        Instant endExclusive;
    }
}
