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
@Schema(description = "Sessions and form completions per campaign/source/medium")
public class CampaignRow {

    @Schema(example = "spring_sale")
    private String campaign;

    @Schema(example = "facebook")
    private String source;

    @Schema(example = "cpc")
    private String medium;

    private long sessions;
    private long completions;

    @Schema(example = "8.4")
    private double conversionRate;
}
