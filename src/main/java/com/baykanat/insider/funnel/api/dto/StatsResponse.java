package com.baykanat.insider.funnel.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Headline numbers for the filtered population")
public class StatsResponse {

    @Schema(example = "1920")
    private long totalSessions;

    @Schema(example = "10850")
    private long totalEvents;

    @Schema(description = "Sessions with a form_complete over all sessions (%)", example = "12.5")
    private double overallConversion;

    @Schema(description = "Average furthest step among sessions that completed any step", example = "4.2")
    private double avgStepsCompleted;

    @Schema(description = "Sessions without any completed step (%)", example = "31.0")
    private double bounceRate;
}
