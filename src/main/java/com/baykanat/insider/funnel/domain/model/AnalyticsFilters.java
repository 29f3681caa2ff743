package com.baykanat.insider.funnel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Tüm analitik sorgu yollarının (funnel, drilldown, session log, filter options) paylaştığı filtre seti.
 * Boyut filtrelerinde null veya boş liste = kısıt yok, tek değer = eşitlik, çok değer = IN.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsFilters {

    private List<String> page;
    private List<String> pageType;
    private List<String> domain;
    private List<String> funnelId;
    private List<String> deviceType;
    private List<String> os;
    private List<String> browser;
    private List<String> geoState;
    private List<String> selectedState;
    private List<String> utmSource;
    private List<String> utmCampaign;
    private List<String> utmMedium;
    private List<String> utmContent;

    private boolean excludeBots;

    private LocalDate startDate;
    private LocalDate endDate;
    /** Yalnızca startDate ile birlikte anlamlı; alt sınırı dakikaya daraltır. */
    private LocalTime startTime;
    /** Yalnızca endDate ile birlikte anlamlı; verilen dakika dahil. */
    private LocalTime endTime;

    public static AnalyticsFilters none() {
        return new AnalyticsFilters();
    }
}
