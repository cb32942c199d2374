package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.ast.CellRefNode;
import com.spreadsheet.formula.exceptions.FormulaParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexes formula text (without the leading "=") into a flat token list.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public static List<Token> tokenize(String formula) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = formula.length();

        while (i < length) {
            char c = formula.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            // String literal, taken verbatim up to the closing quote
            if (c == '"') {
                int close = formula.indexOf('"', i + 1);
                if (close < 0) {
                    throw new FormulaParseException("Unterminated string literal");
                }
                tokens.add(new Token(TokenType.STRING, formula.substring(i + 1, close)));
                i = close + 1;
                continue;
            }

            // Number: digits with at most one decimal point
            if (isDigit(c)) {
                int start = i;
                boolean seenPoint = false;
                while (i < length && (isDigit(formula.charAt(i)) || (formula.charAt(i) == '.' && !seenPoint))) {
                    if (formula.charAt(i) == '.') {
                        seenPoint = true;
                    }
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, formula.substring(start, i)));
                continue;
            }

            // Function name, cell reference or range
            if (isUpper(c)) {
                int start = i;
                i = readIdentifier(formula, i);
                String ident = formula.substring(start, i);

                if (i < length && formula.charAt(i) == '(') {
                    tokens.add(new Token(TokenType.FUNCTION_NAME, ident));
                } else if (CellReferences.isCellReference(ident)) {
                    if (i < length && formula.charAt(i) == ':') {
                        int endStart = i + 1;
                        i = readIdentifier(formula, endStart);
                        String end = formula.substring(endStart, i);
                        if (!CellReferences.isCellReference(end)) {
                            throw new FormulaParseException("Invalid range end: " + end);
                        }
                        tokens.add(new Token(TokenType.RANGE, ident + ":" + end));
                    } else {
                        tokens.add(new Token(TokenType.CELL_REF, ident));
                    }
                } else {
                    throw new FormulaParseException("Invalid identifier: " + ident);
                }
                continue;
            }

            // Marker left behind by a deleted row or column
            if (formula.startsWith(CellRefNode.INVALID_REFERENCE, i)) {
                tokens.add(new Token(TokenType.CELL_REF, CellRefNode.INVALID_REFERENCE));
                i += CellRefNode.INVALID_REFERENCE.length();
                continue;
            }

            if (c == '>' || c == '<' || c == '=' || c == '!') {
                String op = String.valueOf(c);
                char next = i + 1 < length ? formula.charAt(i + 1) : '\0';
                if (next == '=' || (c == '<' && next == '>')) {
                    op += next;
                    i++;
                }
                i++;
                if (op.equals("==")) {
                    op = "=";
                } else if (op.equals("!=")) {
                    op = "<>";
                } else if (op.equals("!")) {
                    throw new FormulaParseException("Unexpected character: !");
                }
                tokens.add(new Token(TokenType.COMPARISON_OP, op));
                continue;
            }

            switch (c) {
                case '+':
                case '-':
                case '*':
                case '/':
                    tokens.add(new Token(TokenType.ARITHMETIC_OP, String.valueOf(c)));
                    break;
                case '(':
                    tokens.add(new Token(TokenType.LPAREN, "("));
                    break;
                case ')':
                    tokens.add(new Token(TokenType.RPAREN, ")"));
                    break;
                case ',':
                    tokens.add(new Token(TokenType.COMMA, ","));
                    break;
                default:
                    throw new FormulaParseException("Unexpected character: " + c);
            }
            i++;
        }

        return tokens;
    }

    private static int readIdentifier(String formula, int from) {
        int i = from;
        while (i < formula.length() && (isUpper(formula.charAt(i)) || isDigit(formula.charAt(i)))) {
            i++;
        }
        return i;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isUpper(char c) {
        return c >= 'A' && c <= 'Z';
    }
}
