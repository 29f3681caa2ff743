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
@Schema(description = "One answer given at a step")
public class StepOption {

    @Schema(example = "Florida")
    private String value;

    @Schema(description = "Distinct sessions that gave this answer", example = "42")
    private long count;

    @Schema(description = "Share of the step's responses (%)", example = "35.0")
    private double percentage;
}
