package com.baykanat.insider.funnel.config;

import lombok.RequiredArgsConstructor;
import org.apache.kafka.common.TopicPartition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Tracking batch'i yazılamazsa: geçici DB hatalarında kısa exponential backoff, ardından batch DLT'ye.
 * Veri kaynaklı hatalar (sütun sınırı, constraint) tekrar denenmez.
 */
@Configuration
@RequiredArgsConstructor
public class KafkaConsumerConfig {

    /** Negatif partition: DLT partition'ını producer key'den (session_id) seçer. */
    private static final int PARTITION_BY_KEY = -1;

    private final AppProperties appProperties;

    @Bean
    public CommonErrorHandler kafkaErrorHandler(KafkaOperations<?, ?> kafkaOperations) {
        String dltTopic = appProperties.getKafka().getTopic().getTrackingEventsDlt();
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(
                kafkaOperations,
                (record, ex) -> new TopicPartition(dltTopic, PARTITION_BY_KEY));

        ExponentialBackOff backOff = new ExponentialBackOff(1000L, 2.0);
        backOff.setMaxInterval(4000L);
        backOff.setMaxElapsedTime(4000L);

        DefaultErrorHandler handler = new DefaultErrorHandler(recoverer, backOff);
        handler.addNotRetryableExceptions(DataIntegrityViolationException.class);
        return handler;
    }
}
