package com.oru.governance.domain.model;

/**
 * Compute resources governed by the engine.
 *
 * CPU values are carried in millicores, memory values in bytes.
 * The granularity is the default rounding step for sizing suggestions.
 */
public enum ResourceKind {
    CPU("cpu", "millicores", 1L),
    MEMORY("memory", "bytes", 1L << 20);

    private static final long KIBI = 1L << 10;
    private static final long MEBI = 1L << 20;
    private static final long GIBI = 1L << 30;

    private final String fieldName;
    private final String unit;
    private final long defaultGranularity;

    ResourceKind(String fieldName, String unit, long defaultGranularity) {
        this.fieldName = fieldName;
        this.unit = unit;
        this.defaultGranularity = defaultGranularity;
    }

    /**
     * Key used for this resource in container request/limit maps.
     */
    public String getFieldName() {
        return fieldName;
    }

    public String getUnit() {
        return unit;
    }

    public long getDefaultGranularity() {
        return defaultGranularity;
    }

    /**
     * Renders a canonical value in Kubernetes notation, e.g. {@code 250m} or {@code 512Mi}.
     */
    public String format(long value) {
        if (this == CPU) {
            return value + "m";
        }
        if (value == 0) {
            return "0";
        }
        if (value % GIBI == 0) {
            return (value / GIBI) + "Gi";
        }
        if (value % MEBI == 0) {
            return (value / MEBI) + "Mi";
        }
        if (value % KIBI == 0) {
            return (value / KIBI) + "Ki";
        }
        return Long.toString(value);
    }

    /**
     * Same as {@link #format(long)} but renders an absent value as {@code none}.
     */
    public String formatNullable(Long value) {
        return value == null ? "none" : format(value);
    }

    public String displayName() {
        return this == CPU ? "CPU" : "memory";
    }
}
