package com.spreadsheet.formula.models;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its coordinate
 * - rawValue (exactly what was entered, literal or "=formula")
 * - formula (the formula text, or null for a literal cell)
 * - value (the literal, or the last computed formula result)
 */
public class Cell {
    private final CellReference reference;
    private String rawValue;
    private String formula;
    private CellValue value = CellValue.NULL;

    public Cell(CellReference reference) {
        this.reference = reference;
    }

    /**
     * Convenience for fixtures: a literal cell holding {@code value}.
     */
    public static Cell literal(CellReference reference, CellValue value) {
        Cell cell = new Cell(reference);
        cell.setValue(value);
        cell.setRawValue(value.isNull() ? "" : String.valueOf(value.toJavaObject()));
        return cell;
    }

    /**
     * Convenience for fixtures: a formula cell that has not been computed yet.
     */
    public static Cell formula(CellReference reference, String formula) {
        Cell cell = new Cell(reference);
        cell.setRawValue(formula);
        cell.setFormula(formula);
        return cell;
    }

    public CellReference getReference() {
        return reference;
    }

    public String getId() {
        return reference.toId();
    }

    public String getRawValue() {
        return rawValue;
    }

    public void setRawValue(String rawValue) {
        this.rawValue = rawValue;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    public CellValue getValue() {
        return value;
    }

    public void setValue(CellValue value) {
        this.value = value == null ? CellValue.NULL : value;
    }

    public CellType getType() {
        return CellType.fromValue(value);
    }
}
