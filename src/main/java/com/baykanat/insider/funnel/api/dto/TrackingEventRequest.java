package com.baykanat.insider.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Funnel script'inin gönderdiği event payload'ı; Kafka'ya göndermeden önce API katmanında doğrulanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Funnel tracking event payload")
public class TrackingEventRequest {

    @JsonProperty("event_id")
    @Size(max = 64)
    @Schema(description = "Client generated event id, used for deduplication when present", example = "evt_01HQ3")
    private String eventId;

    @NotBlank(message = "session_id is required")
    @Size(max = 64)
    @JsonProperty("session_id")
    @Schema(example = "3f9c2a4e-8b1d-4c55-9a0e-1b2c3d4e5f60")
    private String sessionId;

    @Pattern(regexp = "page_land|step_complete|form_complete",
            message = "event_type must be one of page_land, step_complete, form_complete")
    @JsonProperty("event_type")
    @Schema(description = "Omitted by legacy scripts; treated as step_complete", example = "step_complete")
    private String eventType;

    @NotBlank(message = "page is required")
    @Size(max = 50)
    @Pattern(regexp = "^(?!\\(unknown\\)$).*", message = "page must not be the reserved value (unknown)")
    @JsonProperty("page")
    @Schema(description = "Audience landing page", example = "seniors")
    private String page;

    @NotBlank(message = "page_type is required")
    @Size(max = 20)
    @JsonProperty("page_type")
    @Schema(example = "lead")
    private String pageType;

    @NotBlank(message = "domain is required")
    @Size(max = 100)
    @Pattern(regexp = "^(?!\\(unknown\\)$).*", message = "domain must not be the reserved value (unknown)")
    @JsonProperty("domain")
    @Schema(example = "blueskylife.net")
    private String domain;

    @Size(max = 100)
    @JsonProperty("funnel_id")
    @Schema(example = "seniors-lead-v2")
    private String funnelId;

    @NotNull(message = "step_number is required")
    @Min(value = 0, message = "step_number must be >= 0")
    @Max(value = 50, message = "step_number must be <= 50")
    @JsonProperty("step_number")
    @Schema(description = "0 for page_land", example = "2")
    private Integer stepNumber;

    @NotBlank(message = "step_name is required")
    @Size(max = 100)
    @JsonProperty("step_name")
    @Schema(example = "State")
    private String stepName;

    @JsonProperty("selected_value")
    @Schema(example = "Florida")
    private String selectedValue;

    @Min(0)
    @JsonProperty("time_on_step")
    @Schema(description = "Seconds spent on the step", example = "8")
    private Integer timeOnStep;

    @JsonProperty("timestamp")
    @Schema(description = "ISO-8601 instant; receive time when omitted", example = "2025-02-10T12:00:00Z")
    private Instant timestamp;

    @JsonProperty("device_type")
    private String deviceType;
    @JsonProperty("os")
    private String os;
    @JsonProperty("browser")
    private String browser;
    @JsonProperty("geo_state")
    private String geoState;
    @JsonProperty("selected_state")
    private String selectedState;
    @JsonProperty("country")
    private String country;

    @JsonProperty("utm_source")
    private String utmSource;
    @JsonProperty("utm_campaign")
    private String utmCampaign;
    @JsonProperty("utm_medium")
    private String utmMedium;
    @JsonProperty("utm_content")
    private String utmContent;
    @JsonProperty("utm_term")
    private String utmTerm;

    @JsonProperty("referrer")
    private String referrer;
    @JsonProperty("user_agent")
    private String userAgent;
    @JsonProperty("ip_address")
    private String ipAddress;

    @JsonProperty("is_bot")
    @Schema(description = "Bot flag set by the upstream classifier")
    private Boolean bot;

    @JsonProperty("external_id")
    private String externalId;
    @JsonProperty("fbclid")
    private String fbclid;
    @JsonProperty("ad_id")
    private String adId;

    @JsonProperty("first_name")
    @Schema(description = "Stored only for form_complete")
    private String firstName;
    @JsonProperty("last_name")
    private String lastName;
    @JsonProperty("email")
    private String email;
    @JsonProperty("phone")
    private String phone;
}
