package com.baykanat.insider.funnel.infrastructure.kafka;

import com.baykanat.insider.funnel.api.dto.TrackingEventRequest;
import com.baykanat.insider.funnel.config.AppProperties;
import com.baykanat.insider.funnel.domain.mapper.TrackingEventMapper;
import com.baykanat.insider.funnel.domain.model.EventType;
import com.baykanat.insider.funnel.domain.service.EventIngestionService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * tracking-events topic'ini batch tüketir. Okunamayan ya da doğrulamayı geçemeyen kayıtlar
 * (topic'e API dışından yazılmış olabilir) sebebiyle DLT'ye gider; kalanlar tek transaction'da yazılır.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrackingEventKafkaConsumer {

    /** ErrorHandlingDeserializer hata durumunda bu header'ı set eder; value null olur. */
    static final String VALUE_DESERIALIZATION_EXCEPTION_HEADER = "springDeserializationValueException";

    private final EventIngestionService eventIngestionService;
    private final TrackingEventMapper trackingEventMapper;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Validator validator;
    private final AppProperties appProperties;

    @KafkaListener(
            topics = "${app.kafka.topic.tracking-events}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, Object>> records, Acknowledgment acknowledgment) {
        List<TrackingEventRequest> accepted = new ArrayList<>(records.size());
        int rejected = 0;

        for (ConsumerRecord<String, Object> record : records) {
            if (record.headers().lastHeader(VALUE_DESERIALIZATION_EXCEPTION_HEADER) != null || record.value() == null) {
                publishToDlt(record, "undeserializable value");
                rejected++;
                continue;
            }

            TrackingEventRequest event;
            try {
                event = trackingEventMapper.fromRecordValue(record.value());
            } catch (IllegalArgumentException e) {
                publishToDlt(record, "unconvertible value: " + e.getMessage());
                rejected++;
                continue;
            }

            String invalid = validationFailure(event);
            if (invalid != null) {
                publishToDlt(record, invalid);
                rejected++;
                continue;
            }
            accepted.add(event);
        }

        if (!accepted.isEmpty()) {
            int inserted = eventIngestionService.processBatch(accepted);
            long sessions = accepted.stream().map(TrackingEventRequest::getSessionId).distinct().count();
            long forms = accepted.stream()
                    .filter(event -> EventType.fromValue(event.getEventType()) == EventType.FORM_COMPLETE)
                    .count();
            log.info("Tracking batch: {} records, {} sessions, {} form completions, {} inserted, {} rejected",
                    records.size(), sessions, forms, inserted, rejected);
        } else if (rejected > 0) {
            log.warn("Tracking batch: all {} records rejected to DLT", rejected);
        }

        acknowledgment.acknowledge();
    }

    /** null: event yazılabilir; aksi halde ihlallerin özeti. */
    String validationFailure(TrackingEventRequest event) {
        Set<ConstraintViolation<TrackingEventRequest>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            return violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
        }
        if (event.getTimestamp() == null) {
            return "timestamp missing";
        }
        return null;
    }

    /** DLT gönderimi de başarısızsa yalnızca loglanır; batch'in kalanı bloklanmaz. */
    private void publishToDlt(ConsumerRecord<String, Object> record, String reason) {
        String topic = appProperties.getKafka().getTopic().getTrackingEventsDlt();
        log.warn("Rejecting record partition={} offset={} session={}: {}",
                record.partition(), record.offset(), record.key(), reason);
        try {
            kafkaTemplate.send(topic, Objects.requireNonNullElse(record.key(), ""), record.value());
        } catch (Exception e) {
            log.error("Failed to publish rejected record to {}: {}", topic, e.getMessage());
        }
    }
}
