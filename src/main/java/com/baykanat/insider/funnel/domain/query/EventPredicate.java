package com.baykanat.insider.funnel.domain.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * tracking_events üzerinde değişmez WHERE parçası + pozisyonel parametreler.
 * Parça her zaman parantezli kurulur; {@link #and} ile güvenle birleştirilir.
 */
public final class EventPredicate {

    private static final EventPredicate ALWAYS = new EventPredicate("TRUE", List.of());

    private final String sql;
    private final List<Object> params;

    private EventPredicate(String sql, List<Object> params) {
        this.sql = sql;
        this.params = Collections.unmodifiableList(params);
    }

    /** Kısıt yok. */
    public static EventPredicate always() {
        return ALWAYS;
    }

    public static EventPredicate of(String sql, Object... params) {
        Objects.requireNonNull(sql, "sql");
        List<Object> values = new ArrayList<>(params.length);
        Collections.addAll(values, params);
        return new EventPredicate("(" + sql + ")", values);
    }

    public static EventPredicate of(String sql, List<?> params) {
        Objects.requireNonNull(sql, "sql");
        return new EventPredicate("(" + sql + ")", new ArrayList<>(params));
    }

    public EventPredicate and(EventPredicate other) {
        if (other == null || other.isAlways()) {
            return this;
        }
        if (this.isAlways()) {
            return other;
        }
        List<Object> merged = new ArrayList<>(this.params.size() + other.params.size());
        merged.addAll(this.params);
        merged.addAll(other.params);
        return new EventPredicate(this.sql + " AND " + other.sql, merged);
    }

    public boolean isAlways() {
        return this == ALWAYS;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParams() {
        return params;
    }

    public Object[] toArgs() {
        return params.toArray();
    }

    @Override
    public String toString() {
        return sql + " " + params;
    }
}
