package com.baykanat.insider.funnel.config;

import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/** tracking-events ve DLT topic bean'leri. */
@Configuration
@RequiredArgsConstructor
public class KafkaProducerConfig {

    private final AppProperties appProperties;

    /** Key session_id olduğu için bir oturumun event'leri aynı partition'da sıralı kalır. */
    @Bean
    public NewTopic trackingEventsTopic() {
        return TopicBuilder.name(appProperties.getKafka().getTopic().getTrackingEvents())
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic trackingEventsDlt() {
        return TopicBuilder.name(appProperties.getKafka().getTopic().getTrackingEventsDlt())
                .partitions(1)
                .replicas(1)
                .build();
    }
}
