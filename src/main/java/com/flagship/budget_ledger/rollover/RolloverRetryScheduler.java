package com.flagship.budget_ledger.rollover;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically retries budgets that a failed chain walk left flagged.
 */
@Component
@ConditionalOnProperty(name = "rollover.retry.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RolloverRetryScheduler {

    private final RolloverEngine rolloverEngine;

    @Scheduled(fixedDelayString = "${rollover.retry.interval-ms:300000}")
    public void retryPending() {
        try {
            List<RolloverChainResult> results = rolloverEngine.retryPendingRecalculations();
            if (!results.isEmpty()) {
                long stillFailing = results.stream().filter(result -> !result.isFullySucceeded()).count();
                log.info("Retried rollover chains for {} users, {} still failing", results.size(), stillFailing);
            }
        } catch (Exception e) {
            log.error("Error in rollover retry loop", e);
        }
    }
}
