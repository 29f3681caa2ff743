package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.FilterOptionsResponse;
import com.baykanat.insider.funnel.api.dto.FunnelResponse;
import com.baykanat.insider.funnel.config.AppProperties;
import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.GroupCounts;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import com.baykanat.insider.funnel.domain.model.StepTally;
import com.baykanat.insider.funnel.domain.query.EventPredicate;
import com.baykanat.insider.funnel.domain.query.FilterPredicateBuilder;
import com.baykanat.insider.funnel.infrastructure.persistence.FunnelJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/** Filtrelenmiş tüm oturumların tek kohort funnel'ı ve filtre seçenekleri. */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelService {

    private final FunnelJdbcRepository funnelRepository;
    private final FilterPredicateBuilder predicateBuilder;
    private final FunnelStepAggregator aggregator;
    private final AppProperties appProperties;

    /** Drilldown ile aynı sorgular, grup ifadesi olmadan. */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public FunnelResponse getFunnel(AnalyticsFilters filters) {
        EventPredicate predicate = predicateBuilder.build(filters);
        log.debug("Funnel: predicate={}", predicate);

        GroupCounts counts = funnelRepository.queryGroupCounts(null, predicate).stream()
                .findFirst()
                .orElseGet(GroupCounts::new);
        List<StepTally> tallies = funnelRepository.queryStepCounts(null, predicate);

        return FunnelResponse.builder()
                .uniqueViews(counts.getUniqueViews())
                .grossViews(counts.getGrossViews())
                .pageLands(counts.getPageLands())
                .formCompletions(counts.getFormCompletions())
                .steps(aggregator.aggregate(counts, tallies))
                .build();
    }

    public FilterOptionsResponse getFilterOptions() {
        int limit = appProperties.getAnalytics().getFilterOptionsLimit();
        return FilterOptionsResponse.builder()
                .pages(funnelRepository.findDistinctValues(GroupingDimension.PAGE, limit))
                .domains(funnelRepository.findDistinctValues(GroupingDimension.DOMAIN, limit))
                .funnelIds(funnelRepository.findDistinctValues(GroupingDimension.FUNNEL_ID, limit))
                .deviceTypes(funnelRepository.findDistinctValues(GroupingDimension.DEVICE_TYPE, limit))
                .geoStates(funnelRepository.findDistinctValues(GroupingDimension.GEO_STATE, limit))
                .utmSources(funnelRepository.findDistinctValues(GroupingDimension.UTM_SOURCE, limit))
                .utmCampaigns(funnelRepository.findDistinctValues(GroupingDimension.UTM_CAMPAIGN, limit))
                .utmMediums(funnelRepository.findDistinctValues(GroupingDimension.UTM_MEDIUM, limit))
                .build();
    }
}
