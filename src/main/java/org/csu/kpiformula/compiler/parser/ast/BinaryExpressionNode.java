package org.csu.kpiformula.compiler.parser.ast;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., spent / leads)
 */
public record BinaryExpressionNode(
        FormulaNode left,
        BinaryOperator operator,
        FormulaNode right
) implements FormulaNode {

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP;
    }

    // 完全加括号的形式，便于在测试和命令行中检查优先级与结合性
    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
