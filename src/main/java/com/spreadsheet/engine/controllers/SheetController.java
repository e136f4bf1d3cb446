package com.spreadsheet.engine.controllers;

import com.spreadsheet.engine.models.BatchRequest;
import com.spreadsheet.engine.models.CellResponse;
import com.spreadsheet.engine.models.FillRequest;
import com.spreadsheet.engine.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * REST endpoints for spreadsheet sessions.
 * "/sheet" is the base path; cells are addressed in A1 notation.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Optional JSON body { "name": "Expenses" }.
     * Creates a new empty Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody(required = false) Map<String, String> request) {
        String name = request == null ? null : request.get("name");
        long sheetId = sheetService.createSheet(name);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * GET /sheet/{sheetId}
     * Returns the computed value of every cell: { "A1": 42, "B1": "hello", "C1": "#DIV/0!" }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw text as typed ("42", "hello", "=SUM(A1:A3)").
     * A formula that does not parse is rejected with 400 and the cell keeps its old content.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellResponse> setCell(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawText
    ) {
        return ResponseEntity.ok(sheetService.setCell(sheetId, address, rawText == null ? "" : rawText));
    }

    @GetMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellResponse> getCell(@PathVariable long sheetId, @PathVariable String address) {
        Optional<CellResponse> cell = sheetService.getCell(sheetId, address);
        return cell.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Void> deleteCell(@PathVariable long sheetId, @PathVariable String address) {
        sheetService.deleteCell(sheetId, address);
        return ResponseEntity.noContent().build();
    }

    // ------------------------
    // Rows and columns (index is 0-based)
    // ------------------------

    @PostMapping("/{sheetId}/rows/insert")
    public ResponseEntity<List<String>> insertRows(@PathVariable long sheetId, @RequestParam int index,
                                                   @RequestParam(defaultValue = "1") int count) {
        return ResponseEntity.ok(sheetService.insertRows(sheetId, index, count));
    }

    @PostMapping("/{sheetId}/rows/delete")
    public ResponseEntity<List<String>> deleteRows(@PathVariable long sheetId, @RequestParam int index,
                                                   @RequestParam(defaultValue = "1") int count) {
        return ResponseEntity.ok(sheetService.deleteRows(sheetId, index, count));
    }

    @PostMapping("/{sheetId}/columns/insert")
    public ResponseEntity<List<String>> insertColumns(@PathVariable long sheetId, @RequestParam int index,
                                                      @RequestParam(defaultValue = "1") int count) {
        return ResponseEntity.ok(sheetService.insertColumns(sheetId, index, count));
    }

    @PostMapping("/{sheetId}/columns/delete")
    public ResponseEntity<List<String>> deleteColumns(@PathVariable long sheetId, @RequestParam int index,
                                                      @RequestParam(defaultValue = "1") int count) {
        return ResponseEntity.ok(sheetService.deleteColumns(sheetId, index, count));
    }

    // ------------------------
    // Fill, batch, undo/redo
    // ------------------------

    @PostMapping("/{sheetId}/fill")
    public ResponseEntity<Map<String, Object>> fill(@PathVariable long sheetId, @RequestBody FillRequest request) {
        return ResponseEntity.ok(sheetService.fill(sheetId, request));
    }

    @PostMapping("/{sheetId}/fill/preview")
    public ResponseEntity<Map<String, Object>> previewFill(@PathVariable long sheetId,
                                                           @RequestBody FillRequest request) {
        return ResponseEntity.ok(sheetService.previewFill(sheetId, request));
    }

    @PostMapping("/{sheetId}/batch")
    public ResponseEntity<List<String>> applyBatch(@PathVariable long sheetId, @RequestBody BatchRequest request) {
        return ResponseEntity.ok(sheetService.applyBatch(sheetId, request));
    }

    /**
     * POST /sheet/{sheetId}/undo
     * Returns the description of the undone step, or 204 when there is nothing to undo.
     */
    @PostMapping("/{sheetId}/undo")
    public ResponseEntity<String> undo(@PathVariable long sheetId) {
        return sheetService.undo(sheetId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{sheetId}/redo")
    public ResponseEntity<String> redo(@PathVariable long sheetId) {
        return sheetService.redo(sheetId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // ------------------------
    // Dependency graphs
    // ------------------------

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each cell, the set of cells its formula references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardDependencies(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each cell, the set of cells whose formulas reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseDependencies(sheetId));
    }
}
