package org.csu.kpiformula.compiler.semantic;

import org.csu.kpiformula.compiler.parser.ast.BinaryExpressionNode;
import org.csu.kpiformula.compiler.parser.ast.FormulaNode;
import org.csu.kpiformula.compiler.parser.ast.UnaryExpressionNode;
import org.csu.kpiformula.compiler.parser.ast.VariableRefNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 变量提取器。
 * 前序遍历 (先左后右、深度优先) 收集变量名，保留第一次出现的顺序并去重。
 */
public class VariableExtractor {

    public List<String> extract(FormulaNode root) {
        Set<String> names = new LinkedHashSet<>();
        collect(root, names);
        return new ArrayList<>(names);
    }

    private void collect(FormulaNode node, Set<String> names) {
        if (node instanceof VariableRefNode variable) {
            names.add(variable.name());
        } else if (node instanceof UnaryExpressionNode unary) {
            collect(unary.operand(), names);
        } else if (node instanceof BinaryExpressionNode binary) {
            collect(binary.left(), names);
            collect(binary.right(), names);
        }
    }
}
