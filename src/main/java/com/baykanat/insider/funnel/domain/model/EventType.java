package com.baykanat.insider.funnel.domain.model;

import java.util.Arrays;

/** tracking_events.event_type değerleri; null veya tanınmayan (legacy) değer step_complete sayılır. */
public enum EventType {

    PAGE_LAND("page_land"),
    STEP_COMPLETE("step_complete"),
    FORM_COMPLETE("form_complete");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** page_land dışındaki tüm tipler funnel adımı taşır. */
    public boolean isStepBearing() {
        return this != PAGE_LAND;
    }

    public static EventType fromValue(String value) {
        if (value == null) {
            return STEP_COMPLETE;
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value))
                .findFirst()
                .orElse(STEP_COMPLETE);
    }
}
