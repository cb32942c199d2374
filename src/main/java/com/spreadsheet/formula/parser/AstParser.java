package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.ast.AstNode;
import com.spreadsheet.formula.ast.BinaryOpNode;
import com.spreadsheet.formula.ast.CellRefNode;
import com.spreadsheet.formula.ast.FunctionCallNode;
import com.spreadsheet.formula.ast.NumberNode;
import com.spreadsheet.formula.ast.RangeNode;
import com.spreadsheet.formula.ast.StringNode;
import com.spreadsheet.formula.ast.UnaryOpNode;
import com.spreadsheet.formula.exceptions.FormulaParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser building an AST from a token list.
 * Precedence, lowest first:
 * comparison, additive (+ -), multiplicative (* /), unary minus, primary.
 * A parser instance is single-use.
 */
public class AstParser {

    private final List<Token> tokens;
    private int pos = 0;

    public AstParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses the whole token list; leftover tokens are an error.
     */
    public AstNode parse() {
        AstNode ast = parseComparison();
        if (pos < tokens.size()) {
            throw new FormulaParseException("Unexpected token at position " + pos + ": " + current().getText());
        }
        return ast;
    }

    private Token current() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private boolean at(TokenType type) {
        Token token = current();
        return token != null && token.getType() == type;
    }

    private boolean atOperator(String op1, String op2) {
        Token token = current();
        return token != null && (token.is(TokenType.ARITHMETIC_OP, op1) || token.is(TokenType.ARITHMETIC_OP, op2));
    }

    private Token advance() {
        return tokens.get(pos++);
    }

    private void expect(TokenType type) {
        Token token = current();
        if (token == null || token.getType() != type) {
            throw new FormulaParseException("Expected " + type + ", got "
                    + (token == null ? "end of input" : token.toString()));
        }
        pos++;
    }

    // comparison := additive (COMPARISON_OP additive)*
    private AstNode parseComparison() {
        AstNode left = parseAdditive();
        while (at(TokenType.COMPARISON_OP)) {
            String operator = advance().getText();
            left = new BinaryOpNode(operator, left, parseAdditive());
        }
        return left;
    }

    // additive := multiplicative (('+'|'-') multiplicative)*
    private AstNode parseAdditive() {
        AstNode left = parseMultiplicative();
        while (atOperator("+", "-")) {
            String operator = advance().getText();
            left = new BinaryOpNode(operator, left, parseMultiplicative());
        }
        return left;
    }

    // multiplicative := unary (('*'|'/') unary)*
    private AstNode parseMultiplicative() {
        AstNode left = parseUnary();
        while (atOperator("*", "/")) {
            String operator = advance().getText();
            left = new BinaryOpNode(operator, left, parseUnary());
        }
        return left;
    }

    // unary := '-' unary | primary
    private AstNode parseUnary() {
        Token token = current();
        if (token != null && token.is(TokenType.ARITHMETIC_OP, "-")) {
            advance();
            return new UnaryOpNode("-", parseUnary());
        }
        return parsePrimary();
    }

    private AstNode parsePrimary() {
        Token token = current();
        if (token == null) {
            throw new FormulaParseException("Unexpected end of input");
        }

        switch (token.getType()) {
            case NUMBER:
                advance();
                return new NumberNode(parseNumber(token.getText()));
            case STRING:
                advance();
                return new StringNode(token.getText());
            case CELL_REF:
                advance();
                return new CellRefNode(token.getText());
            case RANGE:
                advance();
                return new RangeNode(RangeExpander.expand(token.getText()));
            case LPAREN:
                advance();
                AstNode inner = parseComparison();
                expect(TokenType.RPAREN);
                return inner;
            case FUNCTION_NAME:
                return parseCall();
            default:
                throw new FormulaParseException("Unexpected token: " + token);
        }
    }

    private AstNode parseCall() {
        String name = advance().getText();
        expect(TokenType.LPAREN);

        List<AstNode> args = new ArrayList<>();
        if (!at(TokenType.RPAREN)) {
            args.add(parseComparison());
            while (at(TokenType.COMMA)) {
                advance();
                args.add(parseComparison());
            }
        }
        expect(TokenType.RPAREN);
        return new FunctionCallNode(name, args);
    }

    private static double parseNumber(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Invalid number: " + text);
        }
    }
}
