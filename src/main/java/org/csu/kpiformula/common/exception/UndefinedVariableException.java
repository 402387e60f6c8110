package org.csu.kpiformula.common.exception;

import lombok.Getter;

/**
 * 公式引用的变量没有出现在绑定表中。
 */
@Getter
public class UndefinedVariableException extends FormulaException {

    private final String variableName;

    public UndefinedVariableException(String variableName) {
        super("Undefined variable: " + variableName);
        this.variableName = variableName;
    }
}
