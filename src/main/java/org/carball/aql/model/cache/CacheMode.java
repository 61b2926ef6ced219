package org.carball.aql.model.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operation mode of the query results cache.
 */
public enum CacheMode {

    /** The cache is disabled. */
    OFF("off"),

    /** Results of every eligible query are cached unless the query opts out. */
    ON("on"),

    /** Only queries that ask for it are cached. */
    DEMAND("demand");

    private final String value;

    CacheMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CacheMode fromValue(String value) {
        for (CacheMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown cache mode: " + value);
    }
}
