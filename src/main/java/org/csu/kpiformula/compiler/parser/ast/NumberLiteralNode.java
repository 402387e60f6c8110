package org.csu.kpiformula.compiler.parser.ast;

/**
 * AST 节点: 表示一个数字字面量 (整数和小数统一按 double 保存)
 */
public record NumberLiteralNode(double value) implements FormulaNode {

    @Override
    public NodeKind kind() {
        return NodeKind.NUMBER_LITERAL;
    }

    @Override
    public String toString() {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
