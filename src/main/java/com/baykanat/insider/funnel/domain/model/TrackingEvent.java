package com.baykanat.insider.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** tracking_events tablosu satırı için domain model (JDBC, JPA değil). PII alanları yalnızca form_complete'te dolu. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingEvent {

    private Long id;
    private String eventId;
    private String sessionId;
    private String eventType;
    private String page;
    private String pageType;
    private String domain;
    private String funnelId;
    private int stepNumber;
    private String stepName;
    private String selectedValue;
    private Integer timeOnStep;
    private Instant eventTimestamp;

    private String deviceType;
    private String os;
    private String browser;
    private String geoState;
    private String selectedState;
    private String country;
    private String utmSource;
    private String utmCampaign;
    private String utmMedium;
    private String utmContent;
    private String utmTerm;
    private String referrer;
    private String userAgent;
    private String ipAddress;
    private Boolean bot;

    private String externalId;
    private String fbclid;
    private String adId;

    private String firstName;
    private String lastName;
    private String email;
    private String phone;

    private String idempotencyKey;
    private Instant receivedAt;

    /** Null/legacy event_type step_complete olarak yorumlanır. */
    public EventType resolveEventType() {
        return EventType.fromValue(eventType);
    }
}
