package com.baykanat.insider.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Bir adımda seçilen bir cevabı veren oturum sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionCount {

    private StepKey stepKey;
    private String value;
    private long sessions;
}
