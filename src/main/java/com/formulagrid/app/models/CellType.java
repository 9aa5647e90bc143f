package com.formulagrid.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The cell_type an upstream cell arrives with.
 */
public enum CellType {
    VALUE,
    FORMULA,
    LINK,
    EMPTY;

    /**
     * Allows case-insensitive JSON input ("formula", "Formula"...).
     * Unknown types are read as plain values.
     */
    @JsonCreator
    public static CellType fromValue(String value) {
        if (value == null) {
            return VALUE;
        }
        for (CellType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return VALUE;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
