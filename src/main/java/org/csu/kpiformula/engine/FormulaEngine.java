package org.csu.kpiformula.engine;

import lombok.Getter;
import org.csu.kpiformula.common.exception.*;
import org.csu.kpiformula.compiler.lexer.Lexer;
import org.csu.kpiformula.compiler.lexer.Token;
import org.csu.kpiformula.compiler.parser.Parser;
import org.csu.kpiformula.compiler.parser.ast.FormulaNode;
import org.csu.kpiformula.compiler.semantic.SafetyValidator;
import org.csu.kpiformula.compiler.semantic.VariableExtractor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 公式引擎，对外的统一入口
 *
 * 执行流程：词法分析 -> 语法分析 -> 安全检查 -> (变量提取 | 求值)。
 * 每个阶段遇到第一个错误即停止；引擎不保存任何中间状态，可被多个线程同时使用。
 */
public class FormulaEngine {

    private static final double DRY_RUN_VALUE = 1.0;

    @Getter
    private final FormulaLimits limits;
    private final SafetyValidator safetyValidator = new SafetyValidator();
    private final VariableExtractor variableExtractor = new VariableExtractor();

    public FormulaEngine() {
        this(FormulaLimits.UNLIMITED);
    }

    public FormulaEngine(FormulaLimits limits) {
        this.limits = limits;
    }

    /**
     * 将公式解析为AST，不做安全检查。
     * @throws ParseException            语法错误
     * @throws UnsafeConstructException  语法分析器识别出的被禁止写法
     * @throws FormulaTooComplexException 超出配置的上限
     */
    public FormulaNode parse(String formula) {
        String source = formula == null ? "" : formula;
        int length = source.strip().length();
        if (limits.getMaxLength() > 0 && length > limits.getMaxLength()) {
            throw new FormulaTooComplexException("Formula length " + length
                    + " exceeds the limit of " + limits.getMaxLength() + " characters");
        }
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(tokens, limits.getMaxDepth()).parse();
    }

    /**
     * 提取公式引用的变量，按首次出现的顺序去重。
     * 公式为空或无法解析时返回空列表而不是抛出异常，便于用户输入过程中的实时预览。
     */
    public List<String> extractVariables(String formula) {
        if (isBlank(formula)) {
            return List.of();
        }
        FormulaNode root;
        try {
            root = parse(formula);
        } catch (ParseException | UnsafeConstructException e) {
            return List.of();
        }
        return variableExtractor.extract(root);
    }

    /**
     * 校验公式的语法与安全性，并用占位数据试算一次。
     * 除零只说明占位数据不合适，不影响公式本身的有效性。
     */
    public ValidationResult validate(String formula) {
        if (isBlank(formula)) {
            return ValidationResult.valid(List.of());
        }

        FormulaNode root;
        try {
            root = parse(formula);
            safetyValidator.checkSafe(root);
        } catch (FormulaException e) {
            return ValidationResult.invalid(e.getMessage(), List.of());
        }

        List<String> variables = variableExtractor.extract(root);
        Map<String, Double> dummy = new LinkedHashMap<>();
        for (String variable : variables) {
            dummy.put(variable, DRY_RUN_VALUE);
        }

        try {
            FormulaEvaluator.evaluate(root, dummy);
        } catch (DivisionByZeroException e) {
            // 公式合法，除零来自占位数据
            return ValidationResult.valid(variables);
        } catch (FormulaException e) {
            return ValidationResult.invalid(e.getMessage(), variables);
        }
        return ValidationResult.valid(variables);
    }

    /**
     * 在给定的变量绑定下计算公式。所有错误都原样抛给调用方，不做重试。
     *
     * @param formula  公式字符串, e.g., "spent / leads"
     * @param bindings 变量名到数值的映射, e.g., {spent=1000.0, leads=50.0}
     * @return 计算结果
     */
    public double evaluate(String formula, Map<String, Double> bindings) {
        if (isBlank(formula)) {
            throw new EmptyFormulaException();
        }
        return FormulaEvaluator.evaluate(parse(formula), bindings);
    }

    private static boolean isBlank(String formula) {
        return formula == null || formula.isBlank();
    }
}
