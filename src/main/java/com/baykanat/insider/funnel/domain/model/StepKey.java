package com.baykanat.insider.funnel.domain.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Comparator;

/**
 * Funnel adımının kimliği: aynı numara farklı funnel sürümlerinde farklı isim taşıyabilir,
 * bu yüzden numara tek başına anahtar değildir. Sıralama önce numara, sonra isim.
 */
@Value
public class StepKey implements Comparable<StepKey> {

    private static final Comparator<StepKey> ORDER = Comparator
            .comparingInt(StepKey::getStepNumber)
            .thenComparing(StepKey::getStepName);

    int stepNumber;
    @NonNull
    String stepName;

    public static StepKey of(int stepNumber, String stepName) {
        return new StepKey(stepNumber, stepName == null ? "" : stepName);
    }

    /** "{number}:{name}" biçimi; yalnızca yanıtta gösterim için, geri parse edilmez. */
    public String asKey() {
        return stepNumber + ":" + stepName;
    }

    @Override
    public int compareTo(StepKey other) {
        return ORDER.compare(this, other);
    }
}
