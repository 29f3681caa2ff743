package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.StepData;
import com.baykanat.insider.funnel.domain.model.GroupCounts;
import com.baykanat.insider.funnel.domain.model.StepKey;
import com.baykanat.insider.funnel.domain.model.StepTally;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FunnelStepAggregator.
 *
 * <p>Pure computation, no Spring context. Covers:
 * <ul>
 *   <li>Step-to-step and from-initial conversion rates</li>
 *   <li>Land base fallback when a funnel sends no page_land</li>
 *   <li>The previous count only advancing on nonzero completions</li>
 *   <li>Bounds, rounding and zero denominators</li>
 * </ul>
 */
class FunnelStepAggregatorTest {

    private final FunnelStepAggregator aggregator = new FunnelStepAggregator();

    @Test
    @DisplayName("Rates use the land base for the first step and the previous completions afterwards")
    void computesStepToStepConversion() {
        GroupCounts counts = counts(120, 100);

        List<StepData> steps = aggregator.aggregate(counts, List.of(
                tally(3, "Income", 30, 30),
                tally(1, "Zip", 80, 0),
                tally(2, "State", 60, 58)));

        assertThat(steps).extracting(StepData::getStepKey).containsExactly("1:Zip", "2:State", "3:Income");
        assertThat(steps).extracting(StepData::getConversionFromPrev).containsExactly(80.0, 72.5, 50.0);
        assertThat(steps).extracting(StepData::getConversionFromInitial).containsExactly(80.0, 60.0, 30.0);
    }

    @Test
    @DisplayName("Zero page lands fall back to unique views as the land base")
    void fallsBackToUniqueViewsWithoutPageLands() {
        GroupCounts counts = counts(50, 0);

        List<StepData> steps = aggregator.aggregate(counts, List.of(tally(1, "Zip", 25, 0)));

        assertThat(steps.get(0).getConversionFromPrev()).isEqualTo(50.0);
        assertThat(steps.get(0).getConversionFromInitial()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("A step with zero completions does not become the next step's denominator")
    void previousCountSkipsZeroCompletionSteps() {
        GroupCounts counts = counts(100, 100);

        List<StepData> steps = aggregator.aggregate(counts, List.of(
                tally(1, "Zip", 40, 0),
                tally(2, "State", 0, 0),
                tally(3, "Income", 20, 10)));

        assertThat(steps.get(1).getConversionFromPrev()).isZero();
        assertThat(steps.get(2).getConversionFromPrev()).isEqualTo(25.0);
        assertThat(steps.get(2).getConversionFromInitial()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Same step number with different names yields distinct steps ordered by name")
    void sameNumberDifferentNameStaysDistinct() {
        GroupCounts counts = counts(100, 100);

        List<StepData> steps = aggregator.aggregate(counts, List.of(
                tally(2, "State", 30, 20),
                tally(2, "Age", 10, 5),
                tally(1, "Zip", 50, 0)));

        assertThat(steps).extracting(StepData::getStepKey).containsExactly("1:Zip", "2:Age", "2:State");
        assertThat(steps).extracting(StepData::getCompletions).containsExactly(50L, 10L, 30L);
    }

    @Test
    @DisplayName("Empty cohort produces zero rates, never NaN")
    void zeroDenominatorYieldsZero() {
        GroupCounts counts = counts(0, 0);

        List<StepData> steps = aggregator.aggregate(counts, List.of(tally(1, "Zip", 0, 0)));

        assertThat(steps.get(0).getConversionFromPrev()).isZero();
        assertThat(steps.get(0).getConversionFromInitial()).isZero();
    }

    @Test
    @DisplayName("No step-bearing events returns an empty step list")
    void noTalliesReturnsEmptySteps() {
        assertThat(aggregator.aggregate(counts(10, 10), List.of())).isEmpty();
    }

    @Test
    @DisplayName("Rates are clamped to 100 and rounded to one decimal")
    void clampsAndRounds() {
        assertThat(FunnelStepAggregator.percentage(150, 100)).isEqualTo(100.0);
        assertThat(FunnelStepAggregator.percentage(1, 3)).isEqualTo(33.3);
        assertThat(FunnelStepAggregator.percentage(2, 3)).isEqualTo(66.7);
        assertThat(FunnelStepAggregator.percentage(5, 0)).isZero();
    }

    @Test
    @DisplayName("Leading zero-completion steps do not take the first-step slot")
    void leadingEmptyStepsAreSkippedForFirstStepRule() {
        List<StepData> steps = aggregator.computeSteps(List.of(
                        StepTally.empty(StepKey.of(1, "Beneficiary")),
                        tally(1, "State", 80, 0),
                        tally(2, "Age", 60, 60)),
                key -> 100);

        assertThat(steps).extracting(StepData::getConversionFromPrev).containsExactly(0.0, 80.0, 75.0);
        assertThat(steps).extracting(StepData::getConversionFromInitial).containsExactly(0.0, 80.0, 60.0);
    }

    @Test
    @DisplayName("Per-step land base function is applied to each step")
    void usesPerStepLandBase() {
        List<StepData> steps = aggregator.computeSteps(
                List.of(tally(1, "Zip", 50, 0), tally(2, "State", 20, 20)),
                key -> key.getStepNumber() == 1 ? 100 : 40);

        assertThat(steps.get(0).getConversionFromInitial()).isEqualTo(50.0);
        assertThat(steps.get(1).getConversionFromInitial()).isEqualTo(50.0);
        assertThat(steps.get(1).getConversionFromPrev()).isEqualTo(40.0);
    }

    private static GroupCounts counts(long uniqueViews, long pageLands) {
        return GroupCounts.builder()
                .uniqueViews(uniqueViews)
                .grossViews(uniqueViews * 3)
                .pageLands(pageLands)
                .build();
    }

    private static StepTally tally(int number, String name, long completions, long sessionsWithPrev) {
        return StepTally.builder()
                .stepKey(StepKey.of(number, name))
                .completions(completions)
                .sessionsWithPrev(sessionsWithPrev)
                .build();
    }
}
