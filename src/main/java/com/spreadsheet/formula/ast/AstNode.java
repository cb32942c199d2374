package com.spreadsheet.formula.ast;

/**
 * A node of a parsed formula. The set of node kinds is closed: every consumer
 * implements {@link AstVisitor}, so adding a consumer that forgets a kind
 * doesn't compile. Nodes are immutable; transformations build new trees.
 */
public interface AstNode {

    <R> R accept(AstVisitor<R> visitor);
}
