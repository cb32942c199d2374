package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.FunctionInfo;
import com.spreadsheet.formula.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /functions
 * Lists the built-in functions with their descriptions and aliases.
 */
@RestController
public class FunctionController {

    @Autowired
    private SheetService sheetService;

    @GetMapping("/functions")
    public ResponseEntity<List<FunctionInfo>> listFunctions() {
        return ResponseEntity.ok(sheetService.listFunctions());
    }
}
