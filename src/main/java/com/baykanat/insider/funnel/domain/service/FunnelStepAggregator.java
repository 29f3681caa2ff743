package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.StepData;
import com.baykanat.insider.funnel.domain.model.GroupCounts;
import com.baykanat.insider.funnel.domain.model.StepKey;
import com.baykanat.insider.funnel.domain.model.StepTally;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * Tek kohort için adım sayılarını StepData listesine çevirir. Yan etkisiz; drilldown satırları,
 * Totals satırı ve tüm kohort funnel'ı aynı kurallarla hesaplanır.
 */
@Component
public class FunnelStepAggregator {

    /** Kohortun kendi land base'i ile; tally'ler sırasız gelebilir. */
    public List<StepData> aggregate(GroupCounts counts, List<StepTally> tallies) {
        long landBase = counts.landBase();
        List<StepTally> ordered = tallies.stream()
                .sorted(Comparator.comparing(StepTally::getStepKey))
                .toList();
        return computeSteps(ordered, key -> landBase);
    }

    /**
     * Sıralı tally'lerden adım verisi. Tamamlanması olan ilk adımın oranı land base'e göredir;
     * sonraki adımlarda önceki sayı yalnızca tamamlanma sıfırdan büyükse ilerler.
     *
     * @param ordered     adım anahtarına göre sıralı tally'ler
     * @param landBaseFor adım başına land base (Totals satırında adımdan adıma değişir)
     */
    public List<StepData> computeSteps(List<StepTally> ordered, ToLongFunction<StepKey> landBaseFor) {
        List<StepData> steps = new ArrayList<>(ordered.size());
        long previous = 0;
        boolean started = false;

        for (StepTally tally : ordered) {
            StepKey key = tally.getStepKey();
            long base = landBaseFor.applyAsLong(key);

            double fromPrev;
            if (!started) {
                // Hizalama için eklenen boş adımlar kohortun ilk adımı sayılmaz
                fromPrev = percentage(tally.getCompletions(), base);
                started = tally.getCompletions() > 0;
            } else {
                fromPrev = percentage(tally.getSessionsWithPrev(), previous);
            }
            if (tally.getCompletions() > 0) {
                previous = tally.getCompletions();
            }

            steps.add(StepData.builder()
                    .stepNumber(key.getStepNumber())
                    .stepName(key.getStepName())
                    .stepKey(key.asKey())
                    .completions(tally.getCompletions())
                    .sessionsWithPrev(tally.getSessionsWithPrev())
                    .conversionFromPrev(fromPrev)
                    .conversionFromInitial(percentage(tally.getCompletions(), base))
                    .build());
        }
        return steps;
    }

    /** Payda sıfırsa 0; sonuç [0, 100] aralığına kırpılır ve tek ondalığa yuvarlanır. */
    static double percentage(long numerator, long denominator) {
        if (denominator <= 0 || numerator <= 0) {
            return 0.0;
        }
        double value = (double) numerator * 100.0 / denominator;
        value = Math.min(100.0, Math.max(0.0, value));
        return Math.round(value * 10.0) / 10.0;
    }
}
