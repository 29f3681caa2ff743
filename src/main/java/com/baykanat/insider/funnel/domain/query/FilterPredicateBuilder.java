package com.baykanat.insider.funnel.domain.query;

import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * AnalyticsFilters (+ drilldown parent filtreleri, + session arama metni) → tek EventPredicate.
 * Yan etkisiz; aynı filtre her sorgu yolunda aynı SQL'e çevrilir.
 */
@Component
public class FilterPredicateBuilder {

    /** Serbest metin aramanın bakıldığı sütunlar. */
    static final List<String> SEARCH_COLUMNS = List.of(
            "session_id", "step_name", "selected_value", "utm_campaign", "utm_source",
            "domain", "event_type", "referrer", "first_name", "last_name", "email", "phone");

    /** Global filtreler. */
    public EventPredicate build(AnalyticsFilters filters) {
        if (filters == null) {
            return EventPredicate.always();
        }

        EventPredicate predicate = EventPredicate.always()
                .and(inclusion("page", filters.getPage()))
                .and(inclusion("page_type", filters.getPageType()))
                .and(inclusion("domain", filters.getDomain()))
                .and(inclusion("funnel_id", filters.getFunnelId()))
                .and(inclusion("device_type", filters.getDeviceType()))
                .and(inclusion("os", filters.getOs()))
                .and(inclusion("browser", filters.getBrowser()))
                .and(inclusion("geo_state", filters.getGeoState()))
                .and(inclusion("selected_state", filters.getSelectedState()))
                .and(inclusion("utm_source", filters.getUtmSource()))
                .and(inclusion("utm_campaign", filters.getUtmCampaign()))
                .and(inclusion("utm_medium", filters.getUtmMedium()))
                .and(inclusion("utm_content", filters.getUtmContent()));

        if (filters.isExcludeBots()) {
            predicate = predicate.and(EventPredicate.of("is_bot IS NULL OR is_bot = FALSE"));
        }

        return predicate
                .and(lowerBound(filters.getStartDate(), filters.getStartTime()))
                .and(upperBound(filters.getEndDate(), filters.getEndTime()));
    }

    /** Global filtreler + drilldown yolunda biriken parent filtreleri. Sentinel değer eksik değer (NULL ya da '') demektir. */
    public EventPredicate build(AnalyticsFilters filters, Map<GroupingDimension, String> parentFilters) {
        EventPredicate predicate = build(filters);
        if (parentFilters == null || parentFilters.isEmpty()) {
            return predicate;
        }
        for (Map.Entry<GroupingDimension, String> entry : parentFilters.entrySet()) {
            predicate = predicate.and(parentConstraint(entry.getKey(), entry.getValue()));
        }
        return predicate;
    }

    /** Büyük/küçük harf duyarsız alt dizgi araması; boş arama kısıt getirmez. */
    public EventPredicate search(String term) {
        if (term == null || term.isBlank()) {
            return EventPredicate.always();
        }
        String pattern = "%" + escapeLike(term.trim().toLowerCase(Locale.ROOT)) + "%";
        String sql = String.join(" OR ", SEARCH_COLUMNS.stream()
                .map(column -> "LOWER(" + column + ") LIKE ?")
                .toList());
        return EventPredicate.of(sql, SEARCH_COLUMNS.stream().map(column -> (Object) pattern).toList());
    }

    private EventPredicate parentConstraint(GroupingDimension dimension, String value) {
        Objects.requireNonNull(dimension, "dimension");
        if (value == null || value.isEmpty() || dimension.isSentinel(value)) {
            return EventPredicate.of(dimension.missingValueSql());
        }
        return EventPredicate.of(dimension.getSqlExpression() + " = ?", value);
    }

    private EventPredicate inclusion(String column, List<String> values) {
        if (values == null) {
            return EventPredicate.always();
        }
        List<String> cleaned = values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .distinct()
                .toList();
        if (cleaned.isEmpty()) {
            return EventPredicate.always();
        }
        if (cleaned.size() == 1) {
            return EventPredicate.of(column + " = ?", cleaned.get(0));
        }
        String placeholders = String.join(",", cleaned.stream().map(v -> "?").toList());
        return EventPredicate.of(column + " IN (" + placeholders + ")", cleaned);
    }

    private EventPredicate lowerBound(LocalDate startDate, LocalTime startTime) {
        if (startDate == null) {
            return EventPredicate.always();
        }
        LocalDateTime from = startTime != null
                ? startDate.atTime(startTime.truncatedTo(ChronoUnit.MINUTES))
                : startDate.atStartOfDay();
        return EventPredicate.of("event_timestamp >= ?", toTimestamp(from));
    }

    /** Üst sınır dışlayıcı: endDate'in ertesi günü 00:00 ya da endTime dakikasının sonu. */
    private EventPredicate upperBound(LocalDate endDate, LocalTime endTime) {
        if (endDate == null) {
            return EventPredicate.always();
        }
        LocalDateTime to = endTime != null
                ? endDate.atTime(endTime.truncatedTo(ChronoUnit.MINUTES)).plusMinutes(1)
                : endDate.plusDays(1).atStartOfDay();
        return EventPredicate.of("event_timestamp < ?", toTimestamp(to));
    }

    private Timestamp toTimestamp(LocalDateTime utcDateTime) {
        return Timestamp.from(utcDateTime.toInstant(ZoneOffset.UTC));
    }

    private String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
