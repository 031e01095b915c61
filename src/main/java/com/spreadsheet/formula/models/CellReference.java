package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single cell coordinate. Column and row are both 0-based here;
 * the surface syntax ("B12") uses letters for the column and a
 * 1-based row number.
 */
public final class CellReference {

    private static final Pattern A1_PATTERN = Pattern.compile("^([A-Za-z]+)([0-9]+)$");

    private final int columnIndex;
    private final int rowIndex;

    public CellReference(int columnIndex, int rowIndex) {
        if (columnIndex < 0 || rowIndex < 0) {
            throw new InvalidCellReferenceException(
                    "Negative cell coordinate: column " + columnIndex + ", row " + rowIndex);
        }
        this.columnIndex = columnIndex;
        this.rowIndex = rowIndex;
    }

    /**
     * Parses "A1"-style text (case-insensitive). Row 0 is rejected,
     * since surface rows start at 1.
     */
    public static CellReference parse(String text) {
        Matcher matcher = A1_PATTERN.matcher(text == null ? "" : text.trim());
        if (!matcher.matches()) {
            throw new InvalidCellReferenceException("Not a cell reference: " + text);
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidCellReferenceException("Row out of range: " + text);
        }
        if (row < 1) {
            throw new InvalidCellReferenceException("Rows start at 1: " + text);
        }
        return new CellReference(columnToIndex(matcher.group(1)), row - 1);
    }

    public static boolean isCellReference(String text) {
        return text != null && A1_PATTERN.matcher(text).matches();
    }

    /**
     * Convert column letters to index (A=0, B=1, Z=25, AA=26).
     */
    public static int columnToIndex(String letters) {
        int index = 0;
        for (char c : letters.toUpperCase().toCharArray()) {
            index = index * 26 + (c - 'A' + 1);
        }
        return index - 1;
    }

    /**
     * Convert index to column letters (0=A, 25=Z, 26=AA).
     */
    public static String indexToColumn(int index) {
        StringBuilder letters = new StringBuilder();
        int num = index + 1;
        while (num > 0) {
            int remainder = (num - 1) % 26;
            letters.insert(0, (char) ('A' + remainder));
            num = (num - 1) / 26;
        }
        return letters.toString();
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    /**
     * Canonical id used as a key everywhere, e.g. "AA10".
     */
    public String toId() {
        return indexToColumn(columnIndex) + (rowIndex + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference other = (CellReference) o;
        return columnIndex == other.columnIndex && rowIndex == other.rowIndex;
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnIndex, rowIndex);
    }

    @Override
    public String toString() {
        return toId();
    }
}
