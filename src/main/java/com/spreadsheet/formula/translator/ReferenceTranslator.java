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
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.models.Axis;
import com.spreadsheet.formula.models.CellPosition;
import com.spreadsheet.formula.parser.CellReferences;
import com.spreadsheet.formula.parser.FormulaParser;
import com.spreadsheet.formula.parser.RangeExpander;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the cell references inside formula text for copy/paste and for
 * row or column insertion and deletion.
 *
 * Content that isn't a formula, or a formula that doesn't parse, comes back
 * unchanged. Indexes for insert/delete are zero-based (column A and row 1 are 0).
 */
public final class ReferenceTranslator {

    private ReferenceTranslator() {
    }

    /**
     * Shifts every reference by the given offsets. A reference that would move
     * left of column A or above row 1 keeps its original position.
     */
    public static String translate(String content, int rowOffset, int colOffset) {
        if (rowOffset == 0 && colOffset == 0) {
            return content;
        }
        return rewrite(content, new ReferenceRewriter() {
            @Override
            String mapCell(int col, int row) {
                int newCol = col + colOffset;
                int newRow = row + rowOffset;
                if (newCol < 1 || newRow < 1) {
                    return CellReferences.cellId(col, row);
                }
                return CellReferences.cellId(newCol, newRow);
            }
        });
    }

    public static String translateForCopy(String content, CellPosition from, CellPosition to) {
        return translate(content, to.getRow() - from.getRow(), to.getCol() - from.getCol());
    }

    /**
     * References on the axis at or after {@code index} move one step further.
     */
    public static String translateForInsert(String content, Axis axis, int index) {
        return rewrite(content, new ReferenceRewriter() {
            @Override
            String mapCell(int col, int row) {
                if (axis == Axis.COLUMN) {
                    return CellReferences.cellId(col - 1 >= index ? col + 1 : col, row);
                }
                return CellReferences.cellId(col, row - 1 >= index ? row + 1 : row);
            }
        });
    }

    /**
     * References on the axis after {@code index} move one step back; references to
     * the deleted line become {@code #REF!}, as does any range with an endpoint on it.
     */
    public static String translateForDelete(String content, Axis axis, int index) {
        return rewrite(content, new ReferenceRewriter() {
            @Override
            String mapCell(int col, int row) {
                int position = (axis == Axis.COLUMN ? col : row) - 1;
                if (position == index) {
                    return CellRefNode.INVALID_REFERENCE;
                }
                if (position < index) {
                    return CellReferences.cellId(col, row);
                }
                return axis == Axis.COLUMN
                        ? CellReferences.cellId(col - 1, row)
                        : CellReferences.cellId(col, row - 1);
            }
        });
    }

    private static String rewrite(String content, ReferenceRewriter rewriter) {
        if (content == null || !content.startsWith("=")) {
            return content;
        }
        try {
            AstNode ast = FormulaParser.parse(content.substring(1));
            return "=" + FormulaSerializer.serialize(ast.accept(rewriter));
        } catch (FormulaParseException e) {
            return content;
        }
    }

    /**
     * Copies a tree, mapping each cell reference through {@link #mapCell}.
     */
    private abstract static class ReferenceRewriter implements AstVisitor<AstNode> {

        /**
         * Maps 1-based (col, row) to a new cell ID or to {@code #REF!}.
         */
        abstract String mapCell(int col, int row);

        private String map(String cellId) {
            return mapCell(CellReferences.columnOf(cellId), CellReferences.rowOf(cellId));
        }

        @Override
        public AstNode visitNumber(NumberNode node) {
            return node;
        }

        @Override
        public AstNode visitString(StringNode node) {
            return node;
        }

        @Override
        public AstNode visitCellRef(CellRefNode node) {
            if (node.isInvalidReference()) {
                return node;
            }
            return new CellRefNode(map(node.getCellId()));
        }

        @Override
        public AstNode visitRange(RangeNode node) {
            String start = map(node.getStart());
            String end = map(node.getEnd());
            if (CellRefNode.INVALID_REFERENCE.equals(start) || CellRefNode.INVALID_REFERENCE.equals(end)) {
                return new CellRefNode(CellRefNode.INVALID_REFERENCE);
            }
            int startCol = CellReferences.columnOf(start);
            int startRow = CellReferences.rowOf(start);
            int endCol = CellReferences.columnOf(end);
            int endRow = CellReferences.rowOf(end);
            return new RangeNode(RangeExpander.grid(
                    Math.min(startCol, endCol), Math.min(startRow, endRow),
                    Math.max(startCol, endCol), Math.max(startRow, endRow)));
        }

        @Override
        public AstNode visitBinaryOp(BinaryOpNode node) {
            return new BinaryOpNode(node.getOperator(), node.getLeft().accept(this), node.getRight().accept(this));
        }

        @Override
        public AstNode visitUnaryOp(UnaryOpNode node) {
            return new UnaryOpNode(node.getOperator(), node.getOperand().accept(this));
        }

        @Override
        public AstNode visitFunctionCall(FunctionCallNode node) {
            List<AstNode> args = new ArrayList<>(node.getArgs().size());
            for (AstNode arg : node.getArgs()) {
                args.add(arg.accept(this));
            }
            return new FunctionCallNode(node.getName(), args);
        }
    }
}
