package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display type of a cell, derived from its current value:
 * TEXT, NUMBER, BOOLEAN or DATE.
 */
public enum CellType {
    TEXT,
    NUMBER,
    BOOLEAN,
    DATE;

    /**
     * Allows case-insensitive JSON input, e.g. "number" -> NUMBER.
     */
    @JsonCreator
    public static CellType fromName(String value) {
        return CellType.valueOf(value.toUpperCase());
    }

    @JsonValue
    public String toName() {
        return name().toLowerCase();
    }

    /**
     * Null, text and error markers all display as TEXT.
     */
    public static CellType fromValue(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return NUMBER;
            case BOOLEAN:
                return BOOLEAN;
            case DATE:
                return DATE;
            case TEXT:
            case NULL:
            case ARRAY:
            default:
                return TEXT;
        }
    }
}
