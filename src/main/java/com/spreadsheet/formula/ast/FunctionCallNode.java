package com.spreadsheet.formula.ast;

import java.util.List;
import java.util.Objects;

/**
 * Call such as SUM(A1:A5) or IF(A1 > 0, "yes", "no").
 * Arity isn't checked here; zero-argument calls parse fine.
 */
public final class FunctionCallNode implements AstNode {
    private final String name;
    private final List<AstNode> args;

    public FunctionCallNode(String name, List<AstNode> args) {
        this.name = name;
        this.args = List.copyOf(args);
    }

    public String getName() {
        return name;
    }

    public List<AstNode> getArgs() {
        return args;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCallNode)) {
            return false;
        }
        FunctionCallNode other = (FunctionCallNode) o;
        return name.equals(other.name) && args.equals(other.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }

    @Override
    public String toString() {
        return "Call(" + name + args + ")";
    }
}
