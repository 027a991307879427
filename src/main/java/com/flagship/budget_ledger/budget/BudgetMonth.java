package com.flagship.budget_ledger.budget;

import com.flagship.budget_ledger.exception.ValidationException;
import lombok.Value;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.regex.Pattern;

/**
 * A budgeting month in the canonical zero-padded {@code YYYY-MM} form.
 *
 * The string form sorts the same way as the months themselves, which the
 * repositories rely on when they compare {@code year_month} columns.
 */
@Value
public class BudgetMonth implements Comparable<BudgetMonth> {

    private static final Pattern FORMAT = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])$");

    YearMonth value;

    public static BudgetMonth of(int year, int month) {
        try {
            return new BudgetMonth(YearMonth.of(year, month));
        } catch (DateTimeException e) {
            throw ValidationException.forField("year_month", "Invalid month: " + year + "-" + month);
        }
    }

    public static BudgetMonth of(YearMonth yearMonth) {
        return new BudgetMonth(yearMonth);
    }

    public static BudgetMonth from(LocalDate date) {
        return new BudgetMonth(YearMonth.from(date));
    }

    /**
     * Parses a {@code YYYY-MM} string.
     *
     * @throws ValidationException if the value is missing or malformed
     */
    public static BudgetMonth parse(String text) {
        if (text == null || !FORMAT.matcher(text.trim()).matches()) {
            throw ValidationException.forField("year_month",
                "Invalid month '" + text + "': expected format YYYY-MM");
        }
        return new BudgetMonth(YearMonth.parse(text.trim()));
    }

    public BudgetMonth previous() {
        return new BudgetMonth(value.minusMonths(1));
    }

    public LocalDate firstDay() {
        return value.atDay(1);
    }

    public LocalDate lastDay() {
        return value.atEndOfMonth();
    }

    public boolean isAfter(BudgetMonth other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(BudgetMonth other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return String.format("%04d-%02d", value.getYear(), value.getMonthValue());
    }
}
