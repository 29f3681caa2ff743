package com.baykanat.insider.funnel.api.support;

import com.baykanat.insider.funnel.domain.exception.InvalidQueryParameterException;
import com.baykanat.insider.funnel.domain.model.AnalyticsFilters;
import com.baykanat.insider.funnel.domain.model.GroupingDimension;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sorgu parametrelerini AnalyticsFilters, groupBy ve parent filtrelerine çevirir. Boyut filtreleri
 * tekrar eden parametre ve/veya virgülle ayrılmış liste olarak gelebilir; "audience", "page" ile aynıdır.
 */
@Component
public class AnalyticsFilterParser {

    public static final String PARENT_PREFIX = "parent.";
    public static final GroupingDimension DEFAULT_GROUP_BY = GroupingDimension.DOMAIN;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public AnalyticsFilters parseFilters(MultiValueMap<String, String> params) {
        List<String> pages = new ArrayList<>(values(params, "page"));
        pages.addAll(values(params, "audience"));

        return AnalyticsFilters.builder()
                .page(pages)
                .pageType(values(params, "pageType"))
                .domain(values(params, "domain"))
                .funnelId(values(params, "funnelId"))
                .deviceType(values(params, "deviceType"))
                .os(values(params, "os"))
                .browser(values(params, "browser"))
                .geoState(values(params, "geoState"))
                .selectedState(values(params, "selectedState"))
                .utmSource(values(params, "utmSource"))
                .utmCampaign(values(params, "utmCampaign"))
                .utmMedium(values(params, "utmMedium"))
                .utmContent(values(params, "utmContent"))
                .excludeBots(parseBoolean("excludeBots", params.getFirst("excludeBots")))
                .startDate(parseDate("startDate", params.getFirst("startDate")))
                .endDate(parseDate("endDate", params.getFirst("endDate")))
                .startTime(parseTime("startTime", params.getFirst("startTime")))
                .endTime(parseTime("endTime", params.getFirst("endTime")))
                .build();
    }

    /** Boşsa domain; tanınmayan boyut 400. */
    public GroupingDimension parseGroupBy(String groupBy) {
        if (groupBy == null || groupBy.isBlank()) {
            return DEFAULT_GROUP_BY;
        }
        return GroupingDimension.fromParam(groupBy.trim())
                .orElseThrow(() -> new InvalidQueryParameterException("groupBy",
                        "Unsupported groupBy '" + groupBy + "'. Allowed: " + GroupingDimension.paramNames()));
    }

    /** "parent.{boyut}=değer" parametreleri; boş değer veya sentinel null eşleşmesi demektir. */
    public Map<GroupingDimension, String> parseParentFilters(MultiValueMap<String, String> params) {
        Map<GroupingDimension, String> parents = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : params.entrySet()) {
            String name = entry.getKey();
            if (!name.startsWith(PARENT_PREFIX)) {
                continue;
            }
            String dimensionName = name.substring(PARENT_PREFIX.length());
            GroupingDimension dimension = GroupingDimension.fromParam(dimensionName)
                    .orElseThrow(() -> new InvalidQueryParameterException(name,
                            "Unsupported parent dimension '" + dimensionName + "'. Allowed: "
                                    + GroupingDimension.paramNames()));
            List<String> rawValues = entry.getValue();
            String value = rawValues == null || rawValues.isEmpty() ? "" : rawValues.get(0);
            parents.put(dimension, value == null ? "" : value);
        }
        return parents;
    }

    private List<String> values(MultiValueMap<String, String> params, String name) {
        List<String> raw = params.get(name);
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .filter(Objects::nonNull)
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    private boolean parseBoolean(String field, String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String normalized = value.trim();
        if ("true".equalsIgnoreCase(normalized)) {
            return true;
        }
        if ("false".equalsIgnoreCase(normalized)) {
            return false;
        }
        throw new InvalidQueryParameterException(field, field + " must be true or false");
    }

    private LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidQueryParameterException(field, field + " must be an ISO date (YYYY-MM-DD)", e);
        }
    }

    private LocalTime parseTime(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalTime.parse(value.trim(), TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidQueryParameterException(field, field + " must be HH:MM", e);
        }
    }
}
