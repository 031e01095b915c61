package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.cache.CacheStats;
import com.spreadsheet.formula.models.Cell;
import com.spreadsheet.formula.models.CellReference;
import com.spreadsheet.formula.models.CellType;
import com.spreadsheet.formula.models.CellValue;
import com.spreadsheet.formula.models.CellView;
import com.spreadsheet.formula.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for sheets, their cells and formula evaluation.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body { "name": "..." }.
     * Creates a new empty Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) Map<String, String> request) {
        String name = request == null ? null : request.get("name");
        long sheetId = sheetService.createSheet(name);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{cellRef}
     * Body: rawValue (literal or "=formula"); an empty body clears the cell.
     * A formula that fails to evaluate is stored as an "#ERROR: ..." value
     * and still answers 200. A malformed cellRef is a 400.
     */
    @PutMapping("/{sheetId}/cell/{cellRef}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String cellRef,
            @RequestBody(required = false) String rawValue
    ) {
        sheetService.setCellValue(sheetId, cellRef, rawValue);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the current value of every cell,
     * in the format: { "A1": 10, "B2": "hello", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long sheetId) {
        Map<String, Object> data = sheetService.getSheetData(sheetId);
        return ResponseEntity.ok(data);
    }

    /**
     * GET /sheet/{sheetId}/cell/{cellRef}
     * Returns { reference, value, formula, type }. A cell that was never
     * set comes back with a null value.
     */
    @GetMapping("/{sheetId}/cell/{cellRef}")
    public ResponseEntity<CellView> getCell(@PathVariable long sheetId, @PathVariable String cellRef) {
        Cell cell = sheetService.getCell(sheetId, cellRef);
        if (cell == null) {
            String id = CellReference.parse(cellRef).toId();
            return ResponseEntity.ok(new CellView(id, null, null, null));
        }
        return ResponseEntity.ok(CellView.of(cell));
    }

    /**
     * POST /sheet/{sheetId}/evaluate
     * Body: a formula (with or without the leading "=").
     * Evaluates it against the sheet without storing it. Formula errors
     * are turned into a 400 by the GlobalExceptionHandler.
     */
    @PostMapping("/{sheetId}/evaluate")
    public ResponseEntity<CellView> evaluate(@PathVariable long sheetId, @RequestBody String formula) {
        CellValue value = sheetService.evaluateFormula(sheetId, formula);
        CellType type = value.isNull() ? null : CellType.fromValue(value);
        return ResponseEntity.ok(new CellView(null, value.toJavaObject(), formula, type));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each formula cell => the set of cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each referenced cell => the set of formula cells that read it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }

    @GetMapping("/{sheetId}/cache/stats")
    public ResponseEntity<CacheStats> getCacheStats(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getCacheStats(sheetId));
    }
}
