package com.baykanat.insider.funnel.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Drilldown gruplama boyutları. Her boyut sorgu parametresi adını, SQL ifadesini ve
 * null değerin yanıttaki karşılığını (sentinel) taşır.
 */
public enum GroupingDimension {

    DOMAIN("domain", "domain", "(unknown)", false),
    DEVICE_TYPE("deviceType", "device_type", "(unknown)", false),
    UTM_SOURCE("utmSource", "utm_source", "(none)", false),
    UTM_CAMPAIGN("utmCampaign", "utm_campaign", "(none)", false),
    UTM_MEDIUM("utmMedium", "utm_medium", "(none)", false),
    PAGE("page", "page", "(unknown)", false),
    GEO_STATE("geoState", "geo_state", "(unknown)", false),
    SELECTED_STATE("selectedState", "selected_state", "(unknown)", false),
    /** UTC saat, "00".."23"; string sıralaması sayısal sırayla aynı. */
    HOUR_OF_DAY("hourOfDay",
            "LPAD(CAST(CAST(EXTRACT(HOUR FROM event_timestamp AT TIME ZONE 'UTC') AS INTEGER) AS TEXT), 2, '0')",
            "(unknown)", true),
    FUNNEL_ID("funnelId", "funnel_id", "(none)", false);

    private final String paramName;
    private final String sqlExpression;
    private final String sentinel;
    private final boolean ordinal;

    GroupingDimension(String paramName, String sqlExpression, String sentinel, boolean ordinal) {
        this.paramName = paramName;
        this.sqlExpression = sqlExpression;
        this.sentinel = sentinel;
        this.ordinal = ordinal;
    }

    public String getParamName() {
        return paramName;
    }

    public String getSqlExpression() {
        return sqlExpression;
    }

    public String getSentinel() {
        return sentinel;
    }

    /** Sıralı boyutlarda satırlar görüntü sayısına göre değil grup anahtarına göre dizilir. */
    public boolean isOrdinal() {
        return ordinal;
    }

    /** Düz sütuna karşılık gelen boyutlar (hourOfDay hariç); distinct değer sorgularında kullanılır. */
    public boolean isPlainColumn() {
        return !ordinal;
    }

    /** GROUP BY ifadesi; düz sütunlarda boş string NULL ile aynı gruba düşer. */
    public String getGroupExpression() {
        return ordinal ? sqlExpression : "NULLIF(" + sqlExpression + ", '')";
    }

    /** Sentinel satırının WHERE karşılığı: NULL ve boş string birlikte. */
    public String missingValueSql() {
        return ordinal
                ? sqlExpression + " IS NULL"
                : sqlExpression + " IS NULL OR " + sqlExpression + " = ''";
    }

    /**
     * Saklamadan önce: boş veya sentinel ile aynı değer null olur, böylece sentinel satırı
     * yalnızca eksik değerleri temsil eder.
     */
    public String normalize(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        String trimmed = rawValue.trim();
        return trimmed.isEmpty() || isSentinel(trimmed) ? null : rawValue;
    }

    /** Ham değer null ise sentinel döner. */
    public String coalesce(String rawValue) {
        return rawValue == null ? sentinel : rawValue;
    }

    /** İstemciden gelen değer bu boyutun sentinel'i mi (null eşleşmesi anlamına gelir). */
    public boolean isSentinel(String value) {
        return sentinel.equals(value);
    }

    public static Optional<GroupingDimension> fromParam(String paramName) {
        if (paramName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(dimension -> dimension.paramName.equals(paramName))
                .findFirst();
    }

    public static List<String> paramNames() {
        return Arrays.stream(values()).map(GroupingDimension::getParamName).toList();
    }
}
