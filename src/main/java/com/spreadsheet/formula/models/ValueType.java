package com.spreadsheet.formula.models;

/**
 * Kinds of value a formula can produce or read:
 * NUMBER, TEXT, BOOLEAN, DATE, NULL and ARRAY.
 * ARRAY only ever appears as a function argument.
 */
public enum ValueType {
    NUMBER,
    TEXT,
    BOOLEAN,
    DATE,
    NULL,
    ARRAY
}
