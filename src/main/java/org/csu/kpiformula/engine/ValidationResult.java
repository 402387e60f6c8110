package org.csu.kpiformula.engine;

import java.util.List;

/**
 * 封装一次公式校验的结果。
 */
public record ValidationResult(
        boolean valid,           // 公式是否可用
        String error,            // 失败时的诊断信息，成功时为 null
        List<String> variables   // 公式引用的变量，按首次出现排序
) {
    // 静态工厂方法，用于校验通过的返回
    public static ValidationResult valid(List<String> variables) {
        return new ValidationResult(true, null, List.copyOf(variables));
    }

    // 静态工厂方法，用于校验失败的返回
    public static ValidationResult invalid(String error, List<String> variables) {
        return new ValidationResult(false, error, List.copyOf(variables));
    }
}
