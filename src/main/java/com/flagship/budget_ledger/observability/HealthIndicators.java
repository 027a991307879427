package com.flagship.budget_ledger.observability;

import com.flagship.budget_ledger.budget.BudgetRepository;
import com.flagship.budget_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the service's dependencies and backlogs.
 */
public class HealthIndicators {

    private HealthIndicators() {
    }

    /**
     * Unhealthy when too many events wait to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();

                return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Budgets left flagged by failed chain walks. A non-empty backlog is a
     * warning: the retry job picks them up.
     */
    @Component("rolloverHealth")
    public static class RolloverHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_CRITICAL_THRESHOLD = 500;

        private final BudgetRepository budgetRepository;

        public RolloverHealthIndicator(BudgetRepository budgetRepository) {
            this.budgetRepository = budgetRepository;
        }

        @Override
        public Health health() {
            try {
                long pending = budgetRepository.countByRolloverNeedsRecalcTrue();
                Health.Builder builder = pending == 0
                    ? Health.up()
                    : pending < BACKLOG_CRITICAL_THRESHOLD ? Health.status("WARNING") : Health.down();
                return builder
                    .withDetail("budgetsNeedingRecalculation", pending)
                    .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    /**
     * Redis only backs the external-id fast path; without it the service
     * falls back to the database, so it is reported as degraded, not down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return degraded("No connection factory configured");
            }
            try (var connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                return "PONG".equals(result)
                    ? Health.up().withDetail("response", result).build()
                    : degraded("Unexpected response: " + result);
            } catch (Exception e) {
                return degraded(describe(e));
            }
        }

        private static Health degraded(String error) {
            return Health.status("DEGRADED")
                .withDetail("error", error)
                .withDetail("note", "External id lookups fall back to the database")
                .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                return metrics.isEmpty()
                    ? Health.down().withDetail("error", "No Kafka producer metrics available").build()
                    : Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
