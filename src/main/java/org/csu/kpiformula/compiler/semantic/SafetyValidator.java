package org.csu.kpiformula.compiler.semantic;

import org.csu.kpiformula.common.exception.UnsafeConstructException;
import org.csu.kpiformula.compiler.lexer.Lexer;
import org.csu.kpiformula.compiler.parser.ast.*;

import java.util.regex.Pattern;

/**
 * @author hidyouth
 * @description: 安全检查器
 * 按前序遍历检查AST，确认每个节点都属于允许的四种之一。
 *
 * Parser 产生的树在类型层面就是安全的；这里的检查是调用方可以单独执行的预检，
 * 同时也拦截手工构造的、与自身种类不一致或缺少子节点的树。
 */
public class SafetyValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * 检查整棵树，遇到第一个违规节点时抛出异常。
     * @param node AST根节点
     * @throws UnsafeConstructException 如果存在不允许的节点
     */
    public void checkSafe(FormulaNode node) {
        if (node == null) {
            throw new UnsafeConstructException("missing operand");
        }
        if (node.kind() == null) {
            throw new UnsafeConstructException(node.getClass().getSimpleName());
        }
        // 没有 default 分支：每个 NodeKind 都必须在这里出现
        boolean permitted = switch (node.kind()) {
            case NUMBER_LITERAL -> node instanceof NumberLiteralNode;
            case VARIABLE_REF -> node instanceof VariableRefNode;
            case UNARY_OP -> node instanceof UnaryExpressionNode;
            case BINARY_OP -> node instanceof BinaryExpressionNode;
        };
        if (!permitted) {
            throw new UnsafeConstructException(node.getClass().getSimpleName());
        }

        if (node instanceof VariableRefNode variable) {
            checkVariableName(variable.name());
        } else if (node instanceof UnaryExpressionNode unary) {
            checkUnaryOperator(unary.operator());
            checkSafe(unary.operand());
        } else if (node instanceof BinaryExpressionNode binary) {
            checkBinaryOperator(binary.operator());
            checkSafe(binary.left());
            checkSafe(binary.right());
        }
    }

    private void checkVariableName(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches() || Lexer.isReservedWord(name)) {
            throw new UnsafeConstructException("invalid variable name '" + name + "'");
        }
    }

    private void checkUnaryOperator(UnaryOperator operator) {
        if (operator == null) {
            throw new UnsafeConstructException("unknown unary operator");
        }
    }

    private void checkBinaryOperator(BinaryOperator operator) {
        if (operator == null) {
            throw new UnsafeConstructException("unknown binary operator");
        }
    }
}
