package com.baykanat.insider.funnel.api.dto;

import com.baykanat.insider.funnel.domain.model.StepKey;
import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Bir grubun funnel'ında tek adım: tamamlayan oturum sayısı ve iki dönüşüm oranı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One funnel step within a group")
public class StepData {

    @Schema(description = "Step number", example = "2")
    private int stepNumber;

    @Schema(description = "Step name", example = "State")
    private String stepName;

    @Schema(description = "Composite step identity {number}:{name}", example = "2:State")
    private String stepKey;

    @Schema(description = "Distinct sessions that reached this step", example = "72")
    private long completions;

    @Schema(description = "Distinct sessions that reached this step and the previous step number", example = "70")
    private long sessionsWithPrev;

    @Schema(description = "Step-to-step conversion (%)", example = "75.8")
    private double conversionFromPrev;

    @Schema(description = "Conversion relative to the land base (%)", example = "60.0")
    private double conversionFromInitial;

    @JsonIgnore
    public StepKey toStepKey() {
        return StepKey.of(stepNumber, stepName);
    }
}
