package com.spreadsheet.formula.ast;

/**
 * Literal text between double quotes, stored without the quotes.
 */
public final class StringNode implements AstNode {
    private final String value;

    public StringNode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringNode && ((StringNode) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "String(\"" + value + "\")";
    }
}
