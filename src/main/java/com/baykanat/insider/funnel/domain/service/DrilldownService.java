package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.DrilldownResult;
import com.baykanat.insider.funnel.api.dto.DrilldownRow;
import com.baykanat.insider.funnel.domain.exception.InvalidQueryParameterException;
import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.GroupCounts;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import com.baykanat.insider.funnel.domain.model.StepKey;
import com.baykanat.insider.funnel.domain.model.StepTally;
import com.baykanat.insider.funnel.domain.query.EventPredicate;
import com.baykanat.insider.funnel.domain.query.FilterPredicateBuilder;
import com.baykanat.insider.funnel.infrastructure.persistence.FunnelJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Seçilen boyutun her değeri için ayrı funnel satırı üretir. Durumsuz; "satırı aç" aynı metodu
 * parent filtresi genişletilmiş olarak yeniden çağırır. Derinlik sınırı HTTP katmanında.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DrilldownService {

    private static final Comparator<DrilldownRow> BY_VIEWS = Comparator
            .comparingLong(DrilldownRow::getUniqueViews).reversed()
            .thenComparing(DrilldownRow::getGroupValue);

    private static final Comparator<DrilldownRow> BY_GROUP_KEY = Comparator
            .comparing(DrilldownRow::getGroupValue);

    private final FunnelJdbcRepository funnelRepository;
    private final FilterPredicateBuilder predicateBuilder;
    private final FunnelStepAggregator aggregator;
    private final TotalsReconciler totalsReconciler;

    /** Grup sayıları ve adım sayıları aynı snapshot'tan okunur. */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public DrilldownResult drilldown(AnalyticsFilters filters, GroupingDimension groupBy,
                                     Map<GroupingDimension, String> parentFilters) {
        if (groupBy == null) {
            throw new InvalidQueryParameterException("groupBy", "groupBy is required");
        }
        Map<GroupingDimension, String> parents = parentFilters == null ? Map.of() : parentFilters;
        if (parents.containsKey(groupBy)) {
            throw new InvalidQueryParameterException("groupBy",
                    "Dimension '" + groupBy.getParamName() + "' is already used on this drilldown path");
        }

        EventPredicate predicate = predicateBuilder.build(filters, parents);
        log.debug("Drilldown: groupBy={}, parents={}, predicate={}", groupBy, parents, predicate);

        List<GroupCounts> groups = funnelRepository.queryGroupCounts(groupBy, predicate);
        List<StepTally> tallies = funnelRepository.queryStepCounts(groupBy, predicate);

        Map<String, Map<StepKey, StepTally>> talliesByGroup = new HashMap<>();
        SortedSet<StepKey> allKeys = new TreeSet<>();
        for (StepTally tally : tallies) {
            talliesByGroup.computeIfAbsent(tally.getGroupValue(), value -> new HashMap<>())
                    .put(tally.getStepKey(), tally);
            allKeys.add(tally.getStepKey());
        }

        List<DrilldownRow> rows = new ArrayList<>(groups.size());
        for (GroupCounts group : groups) {
            Map<StepKey, StepTally> groupTallies = talliesByGroup.getOrDefault(group.getGroupValue(), Map.of());
            // Tüm satırlar aynı adım anahtarlarını taşır; eksik adım sıfır tamamlanmayla
            List<StepTally> aligned = allKeys.stream()
                    .map(key -> groupTallies.getOrDefault(key, StepTally.empty(key)))
                    .toList();
            long landBase = group.landBase();

            rows.add(DrilldownRow.builder()
                    .groupValue(groupBy.coalesce(group.getGroupValue()))
                    .uniqueViews(group.getUniqueViews())
                    .grossViews(group.getGrossViews())
                    .pageLands(group.getPageLands())
                    .formCompletions(group.getFormCompletions())
                    .steps(aggregator.computeSteps(aligned, key -> landBase))
                    .build());
        }

        rows.sort(groupBy.isOrdinal() ? BY_GROUP_KEY : BY_VIEWS);

        return DrilldownResult.builder()
                .rows(rows)
                .totals(totalsReconciler.reconcile(rows))
                .groupBy(groupBy.getParamName())
                .build();
    }
}
