package org.csu.kpiformula.common.exception;

/**
 * 公式为 null 或只包含空白字符时抛出。
 */
public class EmptyFormulaException extends FormulaException {

    public EmptyFormulaException() {
        super("Empty formula");
    }
}
