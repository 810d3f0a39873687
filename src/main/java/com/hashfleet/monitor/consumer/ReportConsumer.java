package com.hashfleet.monitor.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hashfleet.monitor.ingest.ReportIngestionService;
import com.hashfleet.monitor.ingest.ReportRequest;
import com.hashfleet.monitor.ingest.ReportValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes producer reports published on a Kafka topic.
 * <p>
 * Offsets are acknowledged after the report went through ingestion. Reports
 * that can never succeed (unparseable or invalid) are acknowledged and
 * dropped; a persistence failure is not acknowledged and goes back to the
 * container's error handler, which retries it. Delivery is at-least-once: a
 * retried report whose first attempt did reach the row store is stored twice
 * there, while the wide-column store rewrites the same row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "kafka.enabled", havingValue = "true")
public class ReportConsumer {

    private final ReportIngestionService ingestionService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = "${kafka.topics.reports:producer_reports}",
            groupId = "${kafka.consumer.group-id:hashrate-monitor}",
            containerFactory = "reportListenerContainerFactory"
    )
    public void consumeReport(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        log.debug("Received report from partition {} at offset {}", record.partition(), record.offset());

        ReportRequest request;
        try {
            request = objectMapper.readValue(record.value(), ReportRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable report at partition {} offset {}: {}",
                    record.partition(), record.offset(), e.getOriginalMessage());
            acknowledgment.acknowledge();
            return;
        }

        try {
            ingestionService.ingest(request, "kafka:" + record.partition() + "@" + record.offset());
        } catch (ReportValidationException e) {
            log.warn("Dropping invalid report at partition {} offset {}: {}",
                    record.partition(), record.offset(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing report from partition {} offset {}",
                    record.partition(), record.offset(), e);
            // Don't acknowledge - will be retried
            throw e;
        }
        acknowledgment.acknowledge();
    }
}
