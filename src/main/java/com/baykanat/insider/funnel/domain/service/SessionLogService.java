package com.baykanat.insider.funnel.domain.service;

import com.baykanat.insider.funnel.api.dto.SessionLogResponse;
import com.baykanat.insider.funnel.api.dto.SessionSummary;
import com.baykanat.insider.funnel.config.AppProperties;
import com.baykanat.insider.funnel.domain.exception.InvalidQueryParameterException;
import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.TrackingEvent;
import com.baykanat.insider.funnel.domain.query.EventPredicate;
import com.baykanat.insider.funnel.domain.query.FilterPredicateBuilder;
import com.baykanat.insider.funnel.infrastructure.persistence.SessionLogJdbcRepository;
import com.baykanat.insider.funnel.infrastructure.persistence.TrackingEventJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Session log: filtre + arama ile eşleşen oturumları sayar, sayfadaki oturum id'lerini seçer,
 * sonra bu oturumların tüm event'lerini çekip özetler. Filtre yalnızca oturum seçiminde uygulanır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLogService {

    private final SessionLogJdbcRepository sessionLogRepository;
    private final TrackingEventJdbcRepository trackingEventRepository;
    private final FilterPredicateBuilder predicateBuilder;
    private final SessionReconstructor sessionReconstructor;
    private final AppProperties appProperties;

    /** page 1'den başlar; limit null ise varsayılan, aralık dışıysa [1, max] içine kırpılır. */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public SessionLogResponse getSessions(AnalyticsFilters filters, String search, int page, Integer limit) {
        if (page < 1) {
            throw new InvalidQueryParameterException("page", "page must be >= 1");
        }
        int pageSize = normalizeLimit(limit);

        EventPredicate predicate = predicateBuilder.build(filters).and(predicateBuilder.search(search));
        log.debug("Session log: page={}, limit={}, predicate={}", page, pageSize, predicate);

        long total = sessionLogRepository.countSessions(predicate);
        long totalPages = (total + pageSize - 1) / pageSize;
        long offset = (long) (page - 1) * pageSize;

        List<SessionSummary> sessions = List.of();
        if (offset < total) {
            List<String> sessionIds = sessionLogRepository.findSessionIdsPage(predicate, pageSize, offset);
            List<TrackingEvent> events = trackingEventRepository.findBySessionIds(sessionIds);
            sessions = sessionReconstructor.reconstruct(sessionIds, events);
        }

        return SessionLogResponse.builder()
                .sessions(sessions)
                .total(total)
                .page(page)
                .limit(pageSize)
                .totalPages(totalPages)
                .build();
    }

    int normalizeLimit(Integer limit) {
        AppProperties.AnalyticsProperties analytics = appProperties.getAnalytics();
        if (limit == null) {
            return analytics.getSessionPageDefaultLimit();
        }
        return Math.max(1, Math.min(limit, analytics.getSessionPageMaxLimit()));
    }
}
