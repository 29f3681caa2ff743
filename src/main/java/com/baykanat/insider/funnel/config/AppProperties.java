package com.baykanat.insider.funnel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** app.* için tip güvenli configuration (Kafka topic adı, inbox temizliği, analitik limitleri). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private KafkaTopicProperties kafka = new KafkaTopicProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private AnalyticsProperties analytics = new AnalyticsProperties();

    @Getter
    @Setter
    public static class KafkaTopicProperties {
        private TopicNames topic = new TopicNames();

        @Getter
        @Setter
        public static class TopicNames {
            private String trackingEvents = "tracking-events";

            public String getTrackingEventsDlt() {
                return trackingEvents + ".DLT";
            }
        }
    }

    @Getter
    @Setter
    public static class SchedulerProperties {
        private long inboxCleanupRate = 3600000;
        private int inboxRetentionDays = 7;
    }

    @Getter
    @Setter
    public static class AnalyticsProperties {
        /** Bir drilldown yolunda en fazla kaç boyut (parent + groupBy). */
        private int maxDrilldownDepth = 3;
        private int sessionPageDefaultLimit = 25;
        private int sessionPageMaxLimit = 200;
        /** Filter options'ta boyut başına en fazla değer. */
        private int filterOptionsLimit = 100;
        private int campaignLimit = 50;
        private int referrerLimit = 20;
    }
}
