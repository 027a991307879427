package com.flagship.budget_ledger.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Forwards rollover events from Kafka to the websocket sessions of the
 * affected user.
 *
 * Every instance consumes the whole topic (its consumer group id is unique)
 * because any instance may hold the user's sessions. Delivery is
 * best-effort: a message that cannot be parsed or has no listening session
 * is acknowledged and dropped.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RolloverUpdateListener {

    private final RolloverConnectionManager connectionManager;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.rollover-updates:rollover-updates}",
        groupId = "${spring.kafka.consumer.group-id:budget-ledger}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        RolloverUpdatedEvent event;
        try {
            event = objectMapper.readValue(record.value(), RolloverUpdatedEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Could not parse rollover event at offset {}, skipping: {}", record.offset(), e.getMessage());
            ack.acknowledge();
            return;
        }

        int delivered = connectionManager.broadcast(event.getUserId(), record.value());
        ack.acknowledge();
        log.debug("Rollover update for budget {} ({}) delivered to {} sessions",
            event.getBudgetId(), event.getYearMonth(), delivered);
    }
}
