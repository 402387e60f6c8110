package org.csu.kpiformula.engine;

import lombok.Getter;

/**
 * 公式的长度与括号嵌套深度上限。
 * 默认不做任何限制；当公式来源不够可信时，由调用方显式开启。
 */
@Getter
public class FormulaLimits {

    public static final FormulaLimits UNLIMITED = new FormulaLimits(0, 0);

    private final int maxLength; // 0 表示不限制
    private final int maxDepth;  // 0 表示不限制

    public FormulaLimits(int maxLength, int maxDepth) {
        if (maxLength < 0 || maxDepth < 0) {
            throw new IllegalArgumentException("Formula limits must not be negative.");
        }
        this.maxLength = maxLength;
        this.maxDepth = maxDepth;
    }

    public boolean isUnlimited() {
        return maxLength == 0 && maxDepth == 0;
    }

    @Override
    public String toString() {
        return "FormulaLimits[maxLength=" + (maxLength == 0 ? "unlimited" : maxLength)
                + ", maxDepth=" + (maxDepth == 0 ? "unlimited" : maxDepth) + "]";
    }
}
