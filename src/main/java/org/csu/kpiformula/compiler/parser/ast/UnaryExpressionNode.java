package org.csu.kpiformula.compiler.parser.ast;

/**
 * AST 节点: 表示一个一元运算表达式 (e.g., -spent)
 */
public record UnaryExpressionNode(
        UnaryOperator operator,
        FormulaNode operand
) implements FormulaNode {

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    public String toString() {
        return "(" + operator.symbol() + operand + ")";
    }
}
