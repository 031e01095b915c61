package com.spreadsheet.formula.models;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Conversions between value types shared by the evaluator and the
 * function library. Numeric conversion comes in two flavours:
 * {@link #toNumberOrNull} reports "no number" as null (functions decide
 * what that means), {@link #toNumber} turns it into 0 (operators).
 */
public final class ValueCoercion {

    // Leading decimal only; whatever follows it is ignored
    private static final Pattern DECIMAL_PREFIX = Pattern.compile("^\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private ValueCoercion() {
    }

    /**
     * Number view of a value, or null when there is none:
     * null cells, text that doesn't start with a decimal, and ranges of
     * more than one cell. A one-cell range converts as its element.
     * Text converts by its leading decimal, so "12px" is 12.
     */
    public static Double toNumberOrNull(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.asNumber();
            case BOOLEAN:
                return value.asBoolean() ? 1.0 : 0.0;
            case TEXT:
                return parseDecimal(value.asText());
            case DATE:
                return (double) value.asDate().toEpochMilli();
            case ARRAY: {
                List<CellValue> items = value.asArray();
                return items.size() == 1 ? toNumberOrNull(items.get(0)) : null;
            }
            case NULL:
            default:
                return null;
        }
    }

    /**
     * Number view for arithmetic: anything without a number counts as 0.
     */
    public static double toNumber(CellValue value) {
        Double number = toNumberOrNull(value);
        return number == null ? 0 : number;
    }

    public static boolean toBoolean(CellValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return value.asBoolean();
            case NUMBER:
                return value.asNumber() != 0;
            case TEXT: {
                String text = value.asText();
                if (text.equalsIgnoreCase("true")) {
                    return true;
                }
                if (text.equalsIgnoreCase("false")) {
                    return false;
                }
                return !text.isEmpty();
            }
            case DATE:
                return true;
            case ARRAY: {
                List<CellValue> items = value.asArray();
                return items.size() == 1 ? toBoolean(items.get(0)) : !items.isEmpty();
            }
            case NULL:
            default:
                return false;
        }
    }

    public static String toText(CellValue value) {
        switch (value.getType()) {
            case TEXT:
                return value.asText();
            case NUMBER:
                return formatNumber(value.asNumber());
            case BOOLEAN:
                return value.asBoolean() ? "true" : "false";
            case DATE:
                return value.asDate().toString();
            case ARRAY:
                return value.asArray().stream().map(ValueCoercion::toText).collect(Collectors.joining(","));
            case NULL:
            default:
                return "";
        }
    }

    /**
     * Whole numbers print without a fraction ("30", not "30.0").
     */
    public static String formatNumber(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    private static Double parseDecimal(String text) {
        Matcher matcher = DECIMAL_PREFIX.matcher(text);
        if (!matcher.lookingAt()) {
            return null;
        }
        return Double.parseDouble(matcher.group().trim());
    }
}
