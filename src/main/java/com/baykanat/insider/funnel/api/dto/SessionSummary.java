package com.baykanat.insider.funnel.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Ham event akışından yeniden kurulan oturum özeti. Oturum seviyesindeki boyutlar ilk event'ten,
 * PII ve reklam kimlikleri form_complete event'inden gelir.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Session reconstructed from its raw events")
public class SessionSummary {

    @Schema(example = "3f9c2a4e-8b1d-4c55-9a0e-1b2c3d4e5f60")
    private String sessionId;

    @Schema(description = "All events of the session, oldest first")
    private List<SessionEventResponse> events;

    @Schema(description = "Furthest step number reached", example = "5")
    private int maxStep;

    @Schema(example = "Income")
    private String maxStepName;

    @Schema(description = "form_complete if the session has one, else the type of the furthest event", example = "step_complete")
    private String maxEventType;

    private int eventCount;
    private Instant firstEventAt;
    private Instant lastEventAt;

    private String page;
    private String pageType;
    private String domain;
    private String funnelId;
    private String deviceType;
    private String os;
    private String browser;
    private String geoState;
    private String utmSource;
    private String utmCampaign;
    private String utmMedium;
    private String referrer;

    private String externalId;
    private String fbclid;
    private String adId;

    private String firstName;
    private String lastName;
    private String email;
    private String phone;
}
