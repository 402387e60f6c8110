package org.csu.kpiformula.common.exception;

import lombok.Getter;

/**
 * @author hidyouth
 * @description: 公式中出现了不允许的构造 (函数调用、属性访问、比较运算等)
 *
 * 既可能由语法分析器在识别到被禁止的写法时抛出，也可能由安全检查器在遍历AST时抛出。
 */
@Getter
public class UnsafeConstructException extends FormulaException {

    /** 第一个违规构造的名称, e.g., "function call"。 */
    private final String construct;

    public UnsafeConstructException(String construct) {
        super("Unsafe construct: " + construct);
        this.construct = construct;
    }
}
