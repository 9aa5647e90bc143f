package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Display format hint attached to a cell.
 * PERCENTAGE and CURRENCY results are kept as exact decimals.
 */
public enum FormatType {
    NUMBER,
    CURRENCY,
    PERCENTAGE,
    DATE,
    TEXT;

    @JsonCreator
    public static FormatType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return FormatType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isExactDecimal() {
        return this == CURRENCY || this == PERCENTAGE;
    }
}
