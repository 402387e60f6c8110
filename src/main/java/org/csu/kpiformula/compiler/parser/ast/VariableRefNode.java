package org.csu.kpiformula.compiler.parser.ast;

/**
 * AST 节点: 表示对一个变量的引用, e.g., spent
 */
public record VariableRefNode(String name) implements FormulaNode {

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE_REF;
    }

    @Override
    public String toString() {
        return name;
    }
}
