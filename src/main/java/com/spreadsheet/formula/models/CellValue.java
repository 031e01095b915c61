package com.spreadsheet.formula.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable tagged value flowing through the evaluator.
 * The {@link ValueType} decides which accessor is legal; calling
 * the wrong one is a programming error and throws IllegalStateException.
 */
public final class CellValue {

    public static final CellValue NULL = new CellValue(ValueType.NULL, null);
    public static final CellValue TRUE = new CellValue(ValueType.BOOLEAN, Boolean.TRUE);
    public static final CellValue FALSE = new CellValue(ValueType.BOOLEAN, Boolean.FALSE);

    private static final String ERROR_PREFIX = "#ERROR: ";

    private final ValueType type;
    private final Object payload;

    private CellValue(ValueType type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static CellValue number(double value) {
        return new CellValue(ValueType.NUMBER, value);
    }

    public static CellValue text(String value) {
        return value == null ? NULL : new CellValue(ValueType.TEXT, value);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue date(Instant value) {
        return value == null ? NULL : new CellValue(ValueType.DATE, value);
    }

    public static CellValue array(List<CellValue> values) {
        return new CellValue(ValueType.ARRAY, Collections.unmodifiableList(new ArrayList<>(values)));
    }

    /**
     * The text a cell shows when its formula failed, e.g. "#ERROR: Division by zero".
     */
    public static CellValue errorMarker(String message) {
        return text(ERROR_PREFIX + message);
    }

    /**
     * Wraps a plain Java object (as found in JSON or test fixtures).
     * Integers and other numbers become NUMBER.
     */
    public static CellValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof CellValue) {
            return (CellValue) value;
        }
        if (value instanceof Number) {
            return number(((Number) value).doubleValue());
        }
        if (value instanceof Boolean) {
            return bool((Boolean) value);
        }
        if (value instanceof Instant) {
            return date((Instant) value);
        }
        return text(value.toString());
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNull() {
        return type == ValueType.NULL;
    }

    public boolean isArray() {
        return type == ValueType.ARRAY;
    }

    public boolean isErrorMarker() {
        return type == ValueType.TEXT && ((String) payload).startsWith(ERROR_PREFIX);
    }

    public double asNumber() {
        expect(ValueType.NUMBER);
        return (Double) payload;
    }

    public String asText() {
        expect(ValueType.TEXT);
        return (String) payload;
    }

    public boolean asBoolean() {
        expect(ValueType.BOOLEAN);
        return (Boolean) payload;
    }

    public Instant asDate() {
        expect(ValueType.DATE);
        return (Instant) payload;
    }

    @SuppressWarnings("unchecked")
    public List<CellValue> asArray() {
        expect(ValueType.ARRAY);
        return (List<CellValue>) payload;
    }

    /**
     * Plain Java form for JSON responses: Double, String, Boolean,
     * Instant, null, or a List of those.
     */
    public Object toJavaObject() {
        if (type == ValueType.ARRAY) {
            return asArray().stream().map(CellValue::toJavaObject).collect(Collectors.toList());
        }
        return payload;
    }

    private void expect(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " value, got " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return type == other.type && Objects.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        return type + "(" + payload + ")";
    }
}
