package org.csu.kpiformula.compiler.parser.ast;

/**
 * @author hidyouth
 * @description: 公式AST节点的公共接口
 *
 * 这是一个封闭类型：只有四种节点可以实现它。
 * 语法中不存在的构造 (函数调用、比较、属性访问等) 根本无法被表示成AST。
 */
public sealed interface FormulaNode
        permits NumberLiteralNode, VariableRefNode, UnaryExpressionNode, BinaryExpressionNode {

    NodeKind kind();
}
