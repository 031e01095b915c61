package com.spreadsheet.formula.models;

import com.spreadsheet.formula.exceptions.InvalidCellReferenceException;

import java.util.ArrayList;
import java.util.List;

/**
 * Rectangular block of cells such as "A1:C3".
 * Corners are normalised, so "C3:A1" covers the same cells.
 */
public final class CellRange {

    private final CellReference start;
    private final CellReference end;

    public CellRange(CellReference start, CellReference end) {
        this.start = start;
        this.end = end;
    }

    public static CellRange parse(String text) {
        String[] parts = text.split(":", -1);
        if (parts.length != 2) {
            throw new InvalidCellReferenceException("Not a range: " + text);
        }
        return new CellRange(CellReference.parse(parts[0]), CellReference.parse(parts[1]));
    }

    public CellReference getStart() {
        return start;
    }

    public CellReference getEnd() {
        return end;
    }

    /**
     * Number of cells in the block, computed without expanding it.
     */
    public long size() {
        long columns = Math.abs((long) start.getColumnIndex() - end.getColumnIndex()) + 1;
        long rows = Math.abs((long) start.getRowIndex() - end.getRowIndex()) + 1;
        return columns * rows;
    }

    /**
     * Every cell in the block, column-major: all rows of the first
     * column, then all rows of the next one.
     */
    public List<CellReference> cells() {
        int firstCol = Math.min(start.getColumnIndex(), end.getColumnIndex());
        int lastCol = Math.max(start.getColumnIndex(), end.getColumnIndex());
        int firstRow = Math.min(start.getRowIndex(), end.getRowIndex());
        int lastRow = Math.max(start.getRowIndex(), end.getRowIndex());

        List<CellReference> cells = new ArrayList<>();
        for (int col = firstCol; col <= lastCol; col++) {
            for (int row = firstRow; row <= lastRow; row++) {
                cells.add(new CellReference(col, row));
            }
        }
        return cells;
    }

    @Override
    public String toString() {
        return start.toId() + ":" + end.toId();
    }
}
