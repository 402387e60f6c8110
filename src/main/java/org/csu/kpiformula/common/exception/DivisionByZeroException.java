package org.csu.kpiformula.common.exception;

/**
 * 除法的右操作数恰好为 0。
 * 这是数据问题而不是公式缺陷，validate() 的试算阶段会忽略它。
 */
public class DivisionByZeroException extends FormulaException {

    public DivisionByZeroException() {
        super("Division by zero");
    }
}
