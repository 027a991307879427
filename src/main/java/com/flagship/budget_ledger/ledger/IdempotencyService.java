package com.flagship.budget_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves a caller-supplied external id (bank import id, client request id)
 * to the ledger transaction already recorded for it.
 *
 * Redis is the fast path and may be unavailable; the
 * {@code ledger_transactions} table is the source of truth, guarded by its
 * {@code UNIQUE (owner_id, external_id)} constraint.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger-external-id:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final JdbcTemplate jdbcTemplate;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(JdbcTemplate jdbcTemplate,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Looks up the transaction recorded for an external id, Redis first and
     * the database second.
     */
    public Optional<UUID> findTransactionId(UUID ownerId, String externalId) {
        requireKey(externalId);
        String redisKey = redisKey(ownerId, externalId);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("External id found in Redis: {}", externalId);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for external id {}, falling back to database: {}",
                    externalId, e.getMessage());
            }
        }

        Optional<UUID> stored;
        try {
            stored = jdbcTemplate.queryForList(
                "SELECT id FROM ledger_transactions WHERE owner_id = ? AND external_id = ?",
                UUID.class,
                ownerId,
                externalId
            ).stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Database lookup failed for external id {}: {}", externalId, e.getMessage());
            throw e;
        }

        stored.ifPresent(transactionId -> {
            log.debug("External id found in database: {}", externalId);
            cache(redisKey, transactionId);
        });
        return stored;
    }

    /**
     * Caches the mapping once the surrounding database transaction commits,
     * so a rolled-back write never leaves a dangling key behind.
     */
    public void rememberAfterCommit(UUID ownerId, String externalId, UUID transactionId) {
        requireKey(externalId);
        String redisKey = redisKey(ownerId, externalId);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(redisKey, transactionId);
                }
            });
        } else {
            cache(redisKey, transactionId);
        }
    }

    public void forget(UUID ownerId, String externalId) {
        if (externalId == null || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().delete(redisKey(ownerId, externalId));
        } catch (Exception e) {
            log.warn("Failed to evict external id {} from Redis: {}", externalId, e.getMessage());
        }
    }

    private void cache(String redisKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache external id in Redis: {}", e.getMessage());
        }
    }

    private static String redisKey(UUID ownerId, String externalId) {
        return REDIS_KEY_PREFIX + ownerId + ":" + externalId;
    }

    private static void requireKey(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("External id cannot be null or blank");
        }
    }
}
