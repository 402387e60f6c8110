package org.csu.kpiformula.compiler.parser.ast;

/**
 * AST节点的种类。安全检查器和求值器都对它做穷尽的 switch，
 * 新增种类时编译器会强制更新这两处。
 */
public enum NodeKind {
    NUMBER_LITERAL,
    VARIABLE_REF,
    UNARY_OP,
    BINARY_OP
}
