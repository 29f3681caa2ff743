package com.baykanat.insider.funnel.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Session log içindeki tek event; oturum detayı açıldığında gösterilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Raw event inside a reconstructed session")
public class SessionEventResponse {

    private Long id;
    @Schema(example = "step_complete")
    private String eventType;
    private int stepNumber;
    @Schema(example = "State")
    private String stepName;
    @Schema(example = "Florida")
    private String selectedValue;
    private Integer timeOnStep;
    private Instant eventTimestamp;
    private String page;
    private String pageType;
    private String domain;
    private String deviceType;
    private String utmSource;
    private String utmCampaign;
    private String utmMedium;
    private String utmContent;
    private String referrer;
    private Boolean bot;
}
