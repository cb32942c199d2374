package com.spreadsheet.formula.ast;

/**
 * One method per node kind. Implemented by the evaluator, the serializer,
 * the reference translator and the reference collector.
 */
public interface AstVisitor<R> {

    R visitNumber(NumberNode node);

    R visitString(StringNode node);

    R visitCellRef(CellRefNode node);

    R visitRange(RangeNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);

    R visitFunctionCall(FunctionCallNode node);
}
