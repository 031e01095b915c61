package com.spreadsheet.formula.models;

/**
 * JSON view of one cell: where it is, what it shows, and the formula
 * behind it (null for literals).
 */
public class CellView {
    private final String reference;
    private final Object value;
    private final String formula;
    private final CellType type;

    public CellView(String reference, Object value, String formula, CellType type) {
        this.reference = reference;
        this.value = value;
        this.formula = formula;
        this.type = type;
    }

    public static CellView of(Cell cell) {
        return new CellView(cell.getId(), cell.getValue().toJavaObject(), cell.getFormula(), cell.getType());
    }

    public String getReference() {
        return reference;
    }

    public Object getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public CellType getType() {
        return type;
    }
}
