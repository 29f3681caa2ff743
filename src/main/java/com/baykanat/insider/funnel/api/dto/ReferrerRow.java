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
@Schema(description = "Sessions and form completions per referrer")
public class ReferrerRow {

    @Schema(description = "Referrer, (direct) when missing", example = "https://www.facebook.com/")
    private String referrer;

    private long sessions;
    private long completions;

    @Schema(example = "6.1")
    private double conversionRate;
}
