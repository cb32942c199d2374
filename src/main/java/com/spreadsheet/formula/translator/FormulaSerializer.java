package com.spreadsheet.formula.translator;

import com.spreadsheet.formula.ast.AstNode;
import com.spreadsheet.formula.ast.AstVisitor;
import com.spreadsheet.formula.ast.BinaryOpNode;
import com.spreadsheet.formula.ast.CellRefNode;
import com.spreadsheet.formula.ast.FunctionCallNode;
import com.spreadsheet.formula.ast.NumberNode;
import com.spreadsheet.formula.ast.RangeNode;
import com.spreadsheet.formula.ast.StringNode;
import com.spreadsheet.formula.ast.UnaryOpNode;
import com.spreadsheet.formula.evaluator.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an AST back into formula text (without the leading "=").
 * Parentheses are emitted only where precedence or left associativity needs them,
 * so parsing the output yields an equal tree.
 */
public final class FormulaSerializer implements AstVisitor<String> {

    private static final FormulaSerializer INSTANCE = new FormulaSerializer();

    private static final int COMPARISON = 1;
    private static final int ADDITIVE = 2;
    private static final int MULTIPLICATIVE = 3;
    private static final int UNARY = 4;
    private static final int ATOM = 5;

    private FormulaSerializer() {
    }

    public static String serialize(AstNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public String visitNumber(NumberNode node) {
        return Values.formatNumber(node.getValue());
    }

    @Override
    public String visitString(StringNode node) {
        return "\"" + node.getValue() + "\"";
    }

    @Override
    public String visitCellRef(CellRefNode node) {
        return node.getCellId();
    }

    @Override
    public String visitRange(RangeNode node) {
        return node.getStart() + ":" + node.getEnd();
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node) {
        int precedence = precedenceOf(node.getOperator());
        String left = node.getLeft().accept(this);
        if (precedenceOf(node.getLeft()) < precedence) {
            left = "(" + left + ")";
        }
        // a-(b-c) and a/(b*c) keep their grouping on the right
        String right = node.getRight().accept(this);
        if (precedenceOf(node.getRight()) <= precedence) {
            right = "(" + right + ")";
        }
        return left + node.getOperator() + right;
    }

    @Override
    public String visitUnaryOp(UnaryOpNode node) {
        String operand = node.getOperand().accept(this);
        if (node.getOperand() instanceof BinaryOpNode) {
            operand = "(" + operand + ")";
        }
        return node.getOperator() + operand;
    }

    @Override
    public String visitFunctionCall(FunctionCallNode node) {
        List<String> args = new ArrayList<>(node.getArgs().size());
        for (AstNode arg : node.getArgs()) {
            args.add(arg.accept(this));
        }
        return node.getName() + "(" + String.join(", ", args) + ")";
    }

    private static int precedenceOf(AstNode node) {
        if (node instanceof BinaryOpNode) {
            return precedenceOf(((BinaryOpNode) node).getOperator());
        }
        if (node instanceof UnaryOpNode) {
            return UNARY;
        }
        return ATOM;
    }

    private static int precedenceOf(String operator) {
        switch (operator) {
            case "+":
            case "-":
                return ADDITIVE;
            case "*":
            case "/":
                return MULTIPLICATIVE;
            default:
                return COMPARISON;
        }
    }
}
