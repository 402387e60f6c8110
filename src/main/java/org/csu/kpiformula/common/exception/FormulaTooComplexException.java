package org.csu.kpiformula.common.exception;

/**
 * 公式超过了调用方通过 FormulaLimits 配置的长度或嵌套深度上限。
 */
public class FormulaTooComplexException extends FormulaException {

    public FormulaTooComplexException(String message) {
        super(message);
    }
}
