package com.spreadsheet.formula.evaluator;

import com.spreadsheet.formula.ast.AstNode;
import com.spreadsheet.formula.ast.AstVisitor;
import com.spreadsheet.formula.ast.BinaryOpNode;
import com.spreadsheet.formula.ast.CellRefNode;
import com.spreadsheet.formula.ast.FunctionCallNode;
import com.spreadsheet.formula.ast.NumberNode;
import com.spreadsheet.formula.ast.RangeNode;
import com.spreadsheet.formula.ast.StringNode;
import com.spreadsheet.formula.ast.UnaryOpNode;
import com.spreadsheet.formula.exceptions.CellReferenceException;
import com.spreadsheet.formula.exceptions.DivisionByZeroException;
import com.spreadsheet.formula.exceptions.FormulaException;
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.functions.FunctionRegistry;
import com.spreadsheet.formula.models.EvalResult;
import com.spreadsheet.formula.parser.FormulaParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes a formula by walking its AST.
 * Cell references are resolved from already computed results only, so this
 * never triggers evaluation of other cells; ordering is the engine's job.
 *
 * Node results are Double, String or {@link Grid}. A cell reference yields a
 * 1x1 grid, a range yields a grid with null holes; grids reach functions intact
 * and are collapsed (1x1 only) wherever an operator or the top level needs a scalar.
 */
public class FormulaEvaluator implements AstVisitor<Object> {

    static final String NO_VALUE = "Formula result has no value";

    private final CellLookup cellLookup;
    private final FunctionRegistry functionRegistry;

    public FormulaEvaluator(CellLookup cellLookup, FunctionRegistry functionRegistry) {
        this.cellLookup = cellLookup;
        this.functionRegistry = functionRegistry;
    }

    /**
     * Parses and evaluates formula text (without the leading "=").
     * Every failure comes back as an error result; nothing is thrown.
     */
    public EvalResult calculate(String formula) {
        try {
            AstNode ast = FormulaParser.parse(formula);
            Object value = Values.unwrap(evaluate(ast));
            if (value == null) {
                // A hole reaching the top level, e.g. B1:B1 over an empty cell
                if (ast instanceof RangeNode) {
                    throw new CellReferenceException(((RangeNode) ast).getStart(), "has no value");
                }
                return EvalResult.error(NO_VALUE);
            }
            return EvalResult.of(value);
        } catch (FormulaException e) {
            return EvalResult.error(e.getMessage());
        } catch (ArithmeticException | IllegalArgumentException e) {
            // Overflowing dates or indexes; still a formula error, not a crash
            return EvalResult.error(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    public Object evaluate(AstNode node) {
        return node.accept(this);
    }

    @Override
    public Object visitNumber(NumberNode node) {
        return node.getValue();
    }

    @Override
    public Object visitString(StringNode node) {
        return node.getValue();
    }

    @Override
    public Object visitCellRef(CellRefNode node) {
        if (node.isInvalidReference()) {
            throw new CellReferenceException(node.getCellId(), "is an invalid reference");
        }
        EvalResult result = cellLookup.getCellResult(node.getCellId());
        if (result == null) {
            throw new CellReferenceException(node.getCellId(), "has no value");
        }
        if (result.hasError()) {
            throw new CellReferenceException(node.getCellId(), "has error: " + result.getError());
        }
        if (result.getValue() == null) {
            throw new CellReferenceException(node.getCellId(), "has no value");
        }
        return Grid.single(result.getValue());
    }

    @Override
    public Object visitRange(RangeNode node) {
        List<List<Object>> rows = new ArrayList<>(node.getRows());
        for (List<String> row : node.getCells()) {
            List<Object> values = new ArrayList<>(row.size());
            for (String cellId : row) {
                EvalResult result = cellLookup.getCellResult(cellId);
                // Ranges tolerate holes: missing, erroring and empty cells read as null
                values.add(result == null || result.hasError() ? null : result.getValue());
            }
            rows.add(values);
        }
        return new Grid(rows);
    }

    @Override
    public Object visitBinaryOp(BinaryOpNode node) {
        Object left = Values.unwrap(evaluate(node.getLeft()));
        Object right = Values.unwrap(evaluate(node.getRight()));
        String operator = node.getOperator();

        switch (operator) {
            case "+":
                return Values.toNumber(left) + Values.toNumber(right);
            case "-":
                return Values.toNumber(left) - Values.toNumber(right);
            case "*":
                return Values.toNumber(left) * Values.toNumber(right);
            case "/":
                double dividend = Values.toNumber(left);
                double divisor = Values.toNumber(right);
                if (divisor == 0) {
                    throw new DivisionByZeroException();
                }
                return dividend / divisor;
            case "=":
                return bool(Values.strictEquals(left, right));
            case "<>":
                return bool(!Values.strictEquals(left, right));
            case "<":
                return bool(Values.toNumber(left) < Values.toNumber(right));
            case ">":
                return bool(Values.toNumber(left) > Values.toNumber(right));
            case "<=":
                return bool(Values.toNumber(left) <= Values.toNumber(right));
            case ">=":
                return bool(Values.toNumber(left) >= Values.toNumber(right));
            default:
                throw new FormulaParseException("Unknown operator: " + operator);
        }
    }

    @Override
    public Object visitUnaryOp(UnaryOpNode node) {
        Object operand = Values.unwrap(evaluate(node.getOperand()));
        if ("-".equals(node.getOperator())) {
            return -Values.toNumber(operand);
        }
        throw new FormulaParseException("Unknown unary operator: " + node.getOperator());
    }

    @Override
    public Object visitFunctionCall(FunctionCallNode node) {
        // Unknown names fail before any argument is evaluated
        functionRegistry.lookup(node.getName());
        List<Object> args = new ArrayList<>(node.getArgs().size());
        for (AstNode arg : node.getArgs()) {
            args.add(evaluate(arg));
        }
        return functionRegistry.execute(node.getName(), args);
    }

    // Comparisons yield 1 or 0, like a spreadsheet
    private static Double bool(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
