package com.baykanat.insider.funnel.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** Swagger UI: tag sırası ve ortak filtre parametrelerinin açıklaması. */
@Configuration
@RequiredArgsConstructor
public class OpenApiConfig {

    private final AppProperties appProperties;

    @Bean
    public OpenAPI funnelAnalyticsOpenApi() {
        int maxDepth = appProperties.getAnalytics().getMaxDrilldownDepth();
        return new OpenAPI()
                .info(new Info()
                        .title("Funnel Drilldown API")
                        .description("""
                                Session reconstruction and funnel drilldown over raw tracking events.

                                Every analytics endpoint accepts the same filter set: `startDate`, `endDate` \
                                (ISO-8601), `funnelId`, and repeated or comma-separated `domain`, `deviceType`, \
                                `utmSource`, `utmCampaign`, `utmMedium`, `geoState`, `selectedState`. \
                                Rows labelled `(unknown)` or `(none)` stand for missing values; pass the label \
                                back as a `parent.<dimension>` value to drill into them. At most %d dimensions \
                                may be combined across `parent.*` and `groupBy`.\
                                """.formatted(maxDepth))
                        .version("1.0.0"))
                .tags(List.of(
                        new Tag().name("Event Ingestion").description("Tracking events are queued to Kafka and stored by the consumer"),
                        new Tag().name("Funnel Analytics").description("Whole-cohort funnel, drilldown and filter options"),
                        new Tag().name("Breakdowns").description("Step option counts, stats, bounce, campaign, referrer and heatmap views"),
                        new Tag().name("Session Log").description("Sessions rebuilt from their raw events")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
