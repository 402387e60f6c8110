package org.csu.kpiformula.common.exception;

/**
 * @author hidyouth
 * @description: 公式处理过程中所有异常的基类
 *
 * 这些异常都是公式编写层面的诊断信息，调用方应将其展示给用户，而不是当作系统故障处理。
 */
public abstract class FormulaException extends RuntimeException {

    protected FormulaException(String message) {
        super(message);
    }
}
