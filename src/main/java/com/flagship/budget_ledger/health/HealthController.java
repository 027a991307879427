package com.flagship.budget_ledger.health;

import com.flagship.budget_ledger.budget.BudgetRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint for probes. Reports the database and, when it is up,
 * how many budgets are waiting for a rollover recomputation.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final BudgetRepository budgetRepository;

    public HealthController(DataSource dataSource, BudgetRepository budgetRepository) {
        this.dataSource = dataSource;
        this.budgetRepository = budgetRepository;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("pending_rollover_budgets", budgetRepository.countByRolloverNeedsRecalcTrue());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
