package com.flagship.budget_ledger.spend;

import com.flagship.budget_ledger.budget.BudgetMonth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Realized spend per category, read from the ledger.
 *
 * Only reportable entries of live (not soft-deleted) transactions count.
 * Amounts are signed, so a refund posted as a credit to the category
 * reduces spend. Both the stored timestamps and the query bounds are
 * compared as instants in the budgeting zone; an empty match is zero.
 */
@Component
@Slf4j
public class SpendAggregator {

    private static final String SPEND_FILTER =
        "FROM ledger_entries e JOIN ledger_transactions t ON t.id = e.transaction_id " +
        "WHERE t.owner_id = ? AND t.deleted_at IS NULL AND e.is_reportable " +
        "AND t.occurred_at >= ? AND t.occurred_at < ?";

    private final JdbcTemplate jdbcTemplate;
    private final DateNormalizer dateNormalizer;

    public SpendAggregator(JdbcTemplate jdbcTemplate, DateNormalizer dateNormalizer) {
        this.jdbcTemplate = jdbcTemplate;
        this.dateNormalizer = dateNormalizer;
    }

    /**
     * Spend on a category within the inclusive date range {@code [start, end]}.
     */
    public BigDecimal spend(UUID ownerId, UUID categoryId, LocalDate start, LocalDate end) {
        DateNormalizer.DateWindow window = dateNormalizer.window(start, end);

        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(e.amount), 0) " + SPEND_FILTER + " AND e.account_id = ?",
            BigDecimal.class,
            ownerId,
            window.getStart().atOffset(ZoneOffset.UTC),
            window.getEndExclusive().atOffset(ZoneOffset.UTC),
            categoryId
        );

        log.debug("Spend for category {} between {} and {}: {}", categoryId, start, end, total);
        return total != null ? total : BigDecimal.ZERO;
    }

    public BigDecimal spendForMonth(UUID ownerId, UUID categoryId, BudgetMonth month) {
        return spend(ownerId, categoryId, month.firstDay(), month.lastDay());
    }

    /**
     * Spend per account for a whole month, used for budget status reports.
     * Accounts without entries are absent from the map.
     */
    public Map<UUID, BigDecimal> spendByAccountForMonth(UUID ownerId, BudgetMonth month) {
        DateNormalizer.DateWindow window = dateNormalizer.monthWindow(month);
        Map<UUID, BigDecimal> totals = new HashMap<>();

        jdbcTemplate.query(
            "SELECT e.account_id, SUM(e.amount) AS total " + SPEND_FILTER + " GROUP BY e.account_id",
            rs -> {
                totals.put(rs.getObject("account_id", UUID.class), rs.getBigDecimal("total"));
            },
            ownerId,
            window.getStart().atOffset(ZoneOffset.UTC),
            window.getEndExclusive().atOffset(ZoneOffset.UTC)
        );
        return totals;
    }
}
