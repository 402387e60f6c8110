package org.csu.kpiformula.engine;

import org.csu.kpiformula.common.exception.DivisionByZeroException;
import org.csu.kpiformula.common.exception.ResultTypeException;
import org.csu.kpiformula.common.exception.UndefinedVariableException;
import org.csu.kpiformula.common.exception.UnsafeConstructException;
import org.csu.kpiformula.compiler.parser.ast.*;
import org.csu.kpiformula.compiler.semantic.SafetyValidator;
import org.csu.kpiformula.compiler.semantic.VariableExtractor;

import java.util.Map;

/**
 * 表达式求值器。
 * 直接递归遍历封闭的AST进行计算，不借助任何宿主语言的执行能力。
 */
public class FormulaEvaluator {

    private static final SafetyValidator SAFETY_VALIDATOR = new SafetyValidator();
    private static final VariableExtractor VARIABLE_EXTRACTOR = new VariableExtractor();

    /**
     * 在给定的变量绑定下计算一棵AST。计算前先做安全检查，手工构造的残缺树同样以公式异常报告。
     *
     * @param root     AST根节点
     * @param bindings 变量名到数值的映射，不会被修改
     * @return 计算结果 (IEEE double 语义)
     * @throws UnsafeConstructException   树中存在不允许或残缺的节点
     * @throws UndefinedVariableException 前序遍历中第一个没有绑定的变量
     * @throws DivisionByZeroException    除数恰好为 0
     * @throws ResultTypeException        结果不是数字 (防御性检查)
     */
    public static double evaluate(FormulaNode root, Map<String, Double> bindings) {
        SAFETY_VALIDATOR.checkSafe(root);

        // 1. 先检查变量：提取结果本身就是前序、按首次出现排序的
        for (String name : VARIABLE_EXTRACTOR.extract(root)) {
            if (bindings == null || bindings.get(name) == null) {
                throw new UndefinedVariableException(name);
            }
        }

        // 2. 计算
        Object result = evaluateNode(root, bindings);
        return toDouble(result);
    }

    private static Object evaluateNode(FormulaNode node, Map<String, Double> bindings) {
        return switch (node.kind()) {
            case NUMBER_LITERAL -> ((NumberLiteralNode) node).value();
            case VARIABLE_REF -> bindings.get(((VariableRefNode) node).name());
            case UNARY_OP -> evaluateUnary((UnaryExpressionNode) node, bindings);
            case BINARY_OP -> evaluateBinary((BinaryExpressionNode) node, bindings);
        };
    }

    private static double evaluateUnary(UnaryExpressionNode node, Map<String, Double> bindings) {
        double operand = toDouble(evaluateNode(node.operand(), bindings));
        return switch (node.operator()) {
            case NEG -> -operand;
            case POS -> operand;
        };
    }

    private static double evaluateBinary(BinaryExpressionNode node, Map<String, Double> bindings) {
        double left = toDouble(evaluateNode(node.left(), bindings));
        double right = toDouble(evaluateNode(node.right(), bindings));

        return switch (node.operator()) {
            case ADD -> left + right;
            case SUB -> left - right;
            case MUL -> left * right;
            case DIV -> {
                // 0.0 == -0.0 为 true，两种零都算作除零
                if (right == 0.0) {
                    throw new DivisionByZeroException();
                }
                yield left / right;
            }
        };
    }

    private static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new ResultTypeException(value == null ? "null" : value.getClass().getSimpleName());
    }
}
