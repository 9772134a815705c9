package com.bookati.reservation.job;

import com.bookati.reservation.domain.model.OutboxEvent;
import com.bookati.reservation.domain.repository.OutboxEventRepository;
import com.bookati.reservation.events.BookingEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Relays outbox rows to Kafka. Ticket, invoice and notification consumers live on the other side;
 * a failed send is logged and retried on the next run, never reported to the booking caller.
 * Each run row-locks its batch with SKIP LOCKED, so several instances relay disjoint batches.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Clock clock;

    @Value("${reservation.events.topics.ticket:booking-ticket}")
    private String ticketTopic;

    @Value("${reservation.events.topics.invoice:booking-invoice}")
    private String invoiceTopic;

    @Value("${reservation.events.topics.invoice-update:booking-invoice-update}")
    private String invoiceUpdateTopic;

    @Value("${reservation.events.topics.package-exhausted:package-exhausted}")
    private String packageExhaustedTopic;

    @Value("${reservation.outbox.batch-size:20}")
    private int batchSize;

    @Value("${reservation.outbox.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Value("${reservation.outbox.retention-hours:24}")
    private long retentionHours;

    @Scheduled(fixedDelayString = "${reservation.outbox.publish-interval-ms:2000}")
    @Transactional(timeoutString = "${reservation.outbox.batch-timeout-seconds:120}")
    public void publishOutboxEvents() {
        List<OutboxEvent> events = outboxEventRepository.lockPendingBatch(batchSize);
        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} outbox events to publish", events.size());

        for (OutboxEvent event : events) {
            try {
                String topic = topicFor(event.getType());
                kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload())
                        .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

                event.setProcessed(true);
                outboxEventRepository.save(event);
                log.info("Published outbox event: id={}, type={}, topic={}", event.getId(), event.getType(), topic);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Outbox relay interrupted at event {}", event.getId());
                return;
            } catch (Exception e) {
                log.error("Failed to publish outbox event: id={}, type={}, attempt={}",
                        event.getId(), event.getType(), event.getAttempts() + 1, e);
                event.markFailed(e.getMessage());
                outboxEventRepository.save(event);
            }
        }
    }

    @Scheduled(cron = "${reservation.outbox.cleanup-cron:0 0 3 * * *}")
    @Transactional
    public void cleanupProcessedEvents() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(retentionHours);
        log.info("Starting cleanup of processed outbox events older than {}", cutoff);

        int totalDeleted = 0;
        while (true) {
            List<OutboxEvent> batch = outboxEventRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
            if (batch.isEmpty()) {
                break;
            }
            outboxEventRepository.deleteAll(batch);
            totalDeleted += batch.size();
            log.debug("Deleted batch of {} processed events", batch.size());
        }

        log.info("Outbox cleanup completed. Total deleted: {}", totalDeleted);
    }

    String topicFor(String type) {
        switch (type) {
            case BookingEventPublisher.TYPE_TICKET_REQUESTED:
                return ticketTopic;
            case BookingEventPublisher.TYPE_INVOICE_REQUESTED:
                return invoiceTopic;
            case BookingEventPublisher.TYPE_INVOICE_AMOUNT_CHANGED:
                return invoiceUpdateTopic;
            case BookingEventPublisher.TYPE_PACKAGE_EXHAUSTED:
                return packageExhaustedTopic;
            default:
                throw new IllegalArgumentException("No topic mapped for outbox event type " + type);
        }
    }
}
