package com.spreadsheet.formula.ast;

import java.util.Objects;

/**
 * Prefix operation. The grammar only has unary minus.
 */
public final class UnaryOpNode implements AstNode {
    private final String operator;
    private final AstNode operand;

    public UnaryOpNode(String operator, AstNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public AstNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryOpNode)) {
            return false;
        }
        UnaryOpNode other = (UnaryOpNode) o;
        return operator.equals(other.operator) && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return "UnaryOp(" + operator + operand + ")";
    }
}
