package com.baykanat.insider.funnel.infrastructure.kafka;

import com.baykanat.insider.funnel.api.dto.TrackingEventRequest;
import com.baykanat.insider.funnel.config.AppProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Tracking event'leri Kafka'ya gönderir; partition key session_id, böylece bir oturumun event'leri
 * sıralı işlenir. Retry + Circuit Breaker; tek event senkron, toplu gönderim paralel.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrackingEventKafkaProducer {

    private static final int RETRY_AFTER_SECONDS = 30;

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final AppProperties appProperties;

    @Retry(name = "kafkaProducer")
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleCircuitBreakerOpen")
    public void send(TrackingEventRequest event) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getTrackingEvents());
        String key = Objects.requireNonNull(event.getSessionId(), "sessionId");
        kafkaTemplate.send(topic, key, event).get(1, TimeUnit.SECONDS);
    }

    /** Tüm ack'ler paralel beklenir. */
    @CircuitBreaker(name = "kafkaProducer", fallbackMethod = "handleBatchCircuitBreakerOpen")
    public void sendBatch(List<TrackingEventRequest> events) throws Exception {
        String topic = Objects.requireNonNull(appProperties.getKafka().getTopic().getTrackingEvents());

        List<CompletableFuture<SendResult<String, Object>>> futures = events.stream()
                .map(event -> kafkaTemplate.send(topic, Objects.requireNonNull(event.getSessionId(), "sessionId"), event))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(10, TimeUnit.SECONDS);
    }

    @SuppressWarnings("unused")
    private void handleCircuitBreakerOpen(TrackingEventRequest event, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting event for session_id={}",
                event.getSessionId());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. Kafka circuit breaker is open.", RETRY_AFTER_SECONDS);
    }

    /** Retry'lar tükendikten sonra. */
    @SuppressWarnings("unused")
    private void handleCircuitBreakerOpen(TrackingEventRequest event, Exception ex) {
        log.error("Kafka produce failed after all retries for session_id={}: {}",
                event.getSessionId(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. " + ex.getMessage(), RETRY_AFTER_SECONDS);
    }

    @SuppressWarnings("unused")
    private void handleBatchCircuitBreakerOpen(List<TrackingEventRequest> events, CallNotPermittedException ex) {
        log.error("Circuit breaker is OPEN for Kafka producer. Rejecting batch of {} events", events.size());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. Kafka circuit breaker is open.", RETRY_AFTER_SECONDS);
    }

    @SuppressWarnings("unused")
    private void handleBatchCircuitBreakerOpen(List<TrackingEventRequest> events, Exception ex) {
        log.error("Kafka batch produce failed for {} events: {}", events.size(), ex.getMessage());
        throw new ServiceUnavailableException(
                "Event ingestion is temporarily unavailable. " + ex.getMessage(), RETRY_AFTER_SECONDS);
    }

    /** Circuit breaker açık veya Kafka erişilemez; GlobalExceptionHandler 503 + Retry-After döner. */
    public static class ServiceUnavailableException extends RuntimeException {
        private final int retryAfterSeconds;

        public ServiceUnavailableException(String message, int retryAfterSeconds) {
            super(message);
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}
