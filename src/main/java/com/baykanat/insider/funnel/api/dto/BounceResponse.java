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
@Schema(description = "Sessions that never completed a step")
public class BounceResponse {

    @Schema(example = "1920")
    private long totalVisitors;

    @Schema(example = "595")
    private long bouncedVisitors;

    @Schema(example = "31.0")
    private double bounceRate;
}
