package org.csu.kpiformula.kpi;

import org.csu.kpiformula.common.exception.DivisionByZeroException;
import org.csu.kpiformula.common.exception.FormulaException;
import org.csu.kpiformula.engine.FormulaEngine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @author hidyouth
 * @description: KPI 计算器
 *
 * 根据关联的预算行和依赖 KPI 汇总出的数值 (按角色，即变量名分组) 重新计算 KPI 的当前值。
 * 同一个角色同时出现在两类来源中时，数值相加。
 * 公式的结果保留4位小数 (按 double 的精确二进制值做银行家舍入)；原始指标保存未舍入的和，
 * 只在判断是否变化时舍入。
 */
public class KpiCalculator {

    private static final int SCALE = 4;

    private final FormulaEngine engine;

    public KpiCalculator(FormulaEngine engine) {
        this.engine = engine;
    }

    /**
     * @param definition             KPI 定义
     * @param oldValue               当前保存的值
     * @param budgetTotalsByRole     预算行按角色汇总的支出
     * @param dependencyTotalsByRole 依赖 KPI 按角色汇总的当前值
     * @return 计算结果
     */
    public KpiSyncResult sync(KpiDefinition definition, double oldValue,
                              Map<String, Double> budgetTotalsByRole,
                              Map<String, Double> dependencyTotalsByRole) {
        Map<String, Double> variables = mergeSources(budgetTotalsByRole, dependencyTotalsByRole);
        if (variables.isEmpty()) {
            return KpiSyncResult.notSynced("No linked sources");
        }

        double newValue;
        if (definition.hasFormula()) {
            try {
                newValue = round(engine.evaluate(definition.formula(), variables));
            } catch (DivisionByZeroException e) {
                System.err.println("[KpiCalculator] KPI '" + definition.slug()
                        + "': division by zero in '" + definition.formula() + "', value set to 0");
                newValue = 0.0;
            } catch (FormulaException e) {
                System.err.println("[KpiCalculator] KPI '" + definition.slug() + "': formula error: " + e.getMessage());
                return KpiSyncResult.notSynced("Formula error: " + e.getMessage());
            }
        } else {
            // 没有公式 = 原始指标，直接求和，不做舍入
            newValue = variables.values().stream().mapToDouble(Double::doubleValue).sum();
        }

        boolean changed = Double.compare(round(oldValue), round(newValue)) != 0;
        return KpiSyncResult.synced(newValue, changed);
    }

    private Map<String, Double> mergeSources(Map<String, Double> budgetTotals, Map<String, Double> dependencyTotals) {
        Map<String, Double> merged = new LinkedHashMap<>();
        if (budgetTotals != null) {
            budgetTotals.forEach((role, total) -> merged.merge(role, valueOf(total), Double::sum));
        }
        if (dependencyTotals != null) {
            dependencyTotals.forEach((role, total) -> merged.merge(role, valueOf(total), Double::sum));
        }
        return merged;
    }

    private static double valueOf(Double total) {
        return total == null ? 0.0 : total;
    }

    static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
