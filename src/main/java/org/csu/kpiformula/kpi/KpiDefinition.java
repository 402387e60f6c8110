package org.csu.kpiformula.kpi;

import org.csu.kpiformula.engine.FormulaEngine;

import java.util.List;

/**
 * KPI 定义: 一个指标的标识、名称，以及可选的计算公式。
 * 没有公式的 KPI 是 "原始" 指标，其值为所有关联来源之和。
 *
 * @param slug    唯一标识, e.g., "cost_per_lead"
 * @param name    显示名称, e.g., "Cost per Lead"
 * @param formula 计算公式, e.g., "spent / leads"，可以为 null
 */
public record KpiDefinition(String slug, String name, String formula) {

    public boolean hasFormula() {
        return formula != null && !formula.isBlank();
    }

    /**
     * 公式引用的变量，用于在指标目录中展示需要关联哪些数据来源。
     */
    public List<String> variables(FormulaEngine engine) {
        return engine.extractVariables(formula);
    }
}
