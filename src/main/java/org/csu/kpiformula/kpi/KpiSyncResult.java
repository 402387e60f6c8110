package org.csu.kpiformula.kpi;

/**
 * 封装一次 KPI 重新计算的结果。
 */
public record KpiSyncResult(
        boolean synced,        // 是否产生了新值
        String reason,         // 未同步时的原因
        double newValue,       // 新值 (保留4位小数)
        boolean valueChanged   // 与旧值相比是否发生变化
) {
    public static KpiSyncResult notSynced(String reason) {
        return new KpiSyncResult(false, reason, 0.0, false);
    }

    public static KpiSyncResult synced(double newValue, boolean valueChanged) {
        return new KpiSyncResult(true, null, newValue, valueChanged);
    }
}
