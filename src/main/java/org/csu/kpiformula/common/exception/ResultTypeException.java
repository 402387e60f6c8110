package org.csu.kpiformula.common.exception;

/**
 * 求值结果不是数字。语法只能产生数字叶子节点，正常情况下不可达。
 */
public class ResultTypeException extends FormulaException {

    public ResultTypeException(String actualType) {
        super("Formula did not produce a number: " + actualType);
    }
}
