package com.baykanat.insider.funnel.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Haftanın günü (0 = Pazar) × saat hücresi, UTC. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Sessions and conversions for one UTC day-of-week/hour cell")
public class HeatmapCell {

    @Schema(description = "0 = Sunday", example = "1")
    private int dayOfWeek;

    @Schema(example = "14")
    private int hour;

    private long sessions;
    private long conversions;

    @Schema(example = "9.5")
    private double conversionRate;
}
