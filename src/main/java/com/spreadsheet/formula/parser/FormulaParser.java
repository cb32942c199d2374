package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.ast.AstNode;
import com.spreadsheet.formula.ast.AstVisitor;
import com.spreadsheet.formula.ast.BinaryOpNode;
import com.spreadsheet.formula.ast.CellRefNode;
import com.spreadsheet.formula.ast.FunctionCallNode;
import com.spreadsheet.formula.ast.NumberNode;
import com.spreadsheet.formula.ast.RangeNode;
import com.spreadsheet.formula.ast.StringNode;
import com.spreadsheet.formula.ast.UnaryOpNode;
import com.spreadsheet.formula.exceptions.FormulaParseException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point for turning formula text (without the leading "=") into an AST,
 * and for finding which cells a formula reads.
 */
public final class FormulaParser {

    // Range references like A1:B3 or AA10:AB20
    private static final Pattern RANGE_PATTERN = Pattern.compile("\\b[A-Z]+[0-9]+:[A-Z]+[0-9]+\\b");

    // Cell references like A1 or AA10
    private static final Pattern CELL_REF_PATTERN = Pattern.compile("\\b[A-Z]+[0-9]+\\b");

    private FormulaParser() {
    }

    public static AstNode parse(String formula) {
        List<Token> tokens = Tokenizer.tokenize(formula);
        return new AstParser(tokens).parse();
    }

    /**
     * Returns every cell the formula reads, with ranges expanded into their members.
     * Parsable formulas are scanned through their AST, so text inside string
     * literals never counts as a reference. Formulas that don't parse fall back
     * to {@link #scanCellReferences(String)}, so they still get recomputed when
     * the cells they mention change.
     */
    public static Set<String> extractCellReferences(String formula) {
        AstNode ast;
        try {
            ast = parse(formula);
        } catch (FormulaParseException e) {
            return scanCellReferences(formula);
        }
        Set<String> refs = new LinkedHashSet<>();
        ast.accept(new ReferenceCollector(refs));
        return refs;
    }

    /**
     * Pattern-based scan of the raw text, independent of the tokenizer.
     * Anything shaped like a range or a cell reference counts, including
     * text inside quotes and identifiers that look like cell IDs.
     */
    public static Set<String> scanCellReferences(String formula) {
        Set<String> refs = new LinkedHashSet<>();

        // Ranges first, then strip them so their endpoints aren't matched twice
        Matcher ranges = RANGE_PATTERN.matcher(formula);
        while (ranges.find()) {
            addRange(refs, ranges.group());
        }
        String withoutRanges = RANGE_PATTERN.matcher(formula).replaceAll(" ");

        Matcher cells = CELL_REF_PATTERN.matcher(withoutRanges);
        while (cells.find()) {
            refs.add(cells.group());
        }
        return refs;
    }

    private static void addRange(Set<String> refs, String range) {
        List<List<String>> grid;
        try {
            grid = RangeExpander.expand(range);
        } catch (FormulaParseException e) {
            // Reversed range: keep the endpoints so the cell still tracks them
            int colon = range.indexOf(':');
            refs.add(range.substring(0, colon));
            refs.add(range.substring(colon + 1));
            return;
        }
        for (List<String> row : grid) {
            refs.addAll(row);
        }
    }

    private static final class ReferenceCollector implements AstVisitor<Void> {
        private final Set<String> refs;

        ReferenceCollector(Set<String> refs) {
            this.refs = refs;
        }

        @Override
        public Void visitNumber(NumberNode node) {
            return null;
        }

        @Override
        public Void visitString(StringNode node) {
            return null;
        }

        @Override
        public Void visitCellRef(CellRefNode node) {
            if (!node.isInvalidReference()) {
                refs.add(node.getCellId());
            }
            return null;
        }

        @Override
        public Void visitRange(RangeNode node) {
            for (List<String> row : node.getCells()) {
                refs.addAll(row);
            }
            return null;
        }

        @Override
        public Void visitBinaryOp(BinaryOpNode node) {
            node.getLeft().accept(this);
            node.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitUnaryOp(UnaryOpNode node) {
            node.getOperand().accept(this);
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCallNode node) {
            for (AstNode arg : node.getArgs()) {
                arg.accept(this);
            }
            return null;
        }
    }
}
