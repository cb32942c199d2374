package com.spreadsheet.formula.parser;

/**
 * Kinds of lexical tokens in formula text.
 */
public enum TokenType {
    NUMBER,
    STRING,
    CELL_REF,
    RANGE,
    FUNCTION_NAME,
    ARITHMETIC_OP,
    COMPARISON_OP,
    LPAREN,
    RPAREN,
    COMMA
}
