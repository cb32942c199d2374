package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.Axis;
import com.spreadsheet.formula.models.EvalResult;
import com.spreadsheet.formula.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Creates a new empty Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet() {
        return ResponseEntity.ok(sheetService.createSheet());
    }

    /**
     * PUT /sheet/{sheetId}/cell/{cellId}
     * Body: raw content, a literal or "=formula". An empty body clears the cell.
     * Returns the cell's new result; formula errors come back in the "error" field.
     */
    @PutMapping("/{sheetId}/cell/{cellId}")
    public ResponseEntity<EvalResult> setCellContent(
            @PathVariable long sheetId,
            @PathVariable String cellId,
            @RequestBody(required = false) String content
    ) {
        return ResponseEntity.ok(sheetService.setCellContent(sheetId, cellId, content));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the evaluated cells of the sheet,
     * in the format: { "A1": {"value": 5, "error": null}, ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, EvalResult>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    @GetMapping("/{sheetId}/cell/{cellId}")
    public ResponseEntity<EvalResult> getCell(@PathVariable long sheetId, @PathVariable String cellId) {
        return ResponseEntity.ok(sheetService.getCellResult(sheetId, cellId));
    }

    /**
     * POST /sheet/{sheetId}/calculate
     * Body: formula text, with or without the leading "=". Nothing is stored.
     */
    @PostMapping("/{sheetId}/calculate")
    public ResponseEntity<EvalResult> calculate(@PathVariable long sheetId,
                                                @RequestBody(required = false) String formula) {
        return ResponseEntity.ok(sheetService.calculate(sheetId, formula));
    }

    /**
     * POST /sheet/{sheetId}/fill?from=A1&to=A5
     * Fills along a row or column; returns the filled cell IDs.
     */
    @PostMapping("/{sheetId}/fill")
    public ResponseEntity<List<String>> fillRange(@PathVariable long sheetId,
                                                  @RequestParam String from,
                                                  @RequestParam String to) {
        return ResponseEntity.ok(sheetService.fillRange(sheetId, from, to));
    }

    @PostMapping("/{sheetId}/copy")
    public ResponseEntity<EvalResult> copyCell(@PathVariable long sheetId,
                                               @RequestParam String from,
                                               @RequestParam String to) {
        return ResponseEntity.ok(sheetService.copyCell(sheetId, from, to));
    }

    /**
     * POST /sheet/{sheetId}/insert/{axis}/{index}
     * axis is "row" or "column"; index is zero-based.
     */
    @PostMapping("/{sheetId}/insert/{axis}/{index}")
    public ResponseEntity<Void> insert(@PathVariable long sheetId,
                                       @PathVariable String axis,
                                       @PathVariable int index) {
        sheetService.insert(sheetId, Axis.fromValue(axis), index);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/delete/{axis}/{index}")
    public ResponseEntity<Void> delete(@PathVariable long sheetId,
                                       @PathVariable String axis,
                                       @PathVariable int index) {
        sheetService.delete(sheetId, Axis.fromValue(axis), index);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * Returns the forward dependency graph of the sheet,
     * i.e., for each cell => the set of cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * Returns the reverse dependency graph of the sheet,
     * i.e., for each cell => the set of cells that reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
