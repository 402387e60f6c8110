package org.csu.kpiformula.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 一个可重用的工具类，用于将变量绑定格式化为带边框的控制台表格。
 */
public class BindingsFormatter {

    private static final List<String> HEADER = List.of("variable", "value");

    /**
     * 将变量绑定格式化为字符串表格。
     *
     * @param bindings 变量名到数值的映射 (按其迭代顺序输出)
     * @return 格式化后的表格字符串
     */
    public static String format(Map<String, Double> bindings) {
        if (bindings.isEmpty()) {
            return "No variables bound.";
        }

        // 1. 计算每列的最大宽度
        List<List<String>> rows = new ArrayList<>();
        List<Integer> columnWidths = new ArrayList<>(List.of(HEADER.get(0).length(), HEADER.get(1).length()));
        for (Map.Entry<String, Double> entry : bindings.entrySet()) {
            List<String> row = List.of(entry.getKey(), formatNumber(entry.getValue()));
            for (int i = 0; i < row.size(); i++) {
                columnWidths.set(i, Math.max(columnWidths.get(i), row.get(i).length()));
            }
            rows.add(row);
        }

        // 2. 打印边框和表头
        StringBuilder sb = new StringBuilder();
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(getRow(HEADER, columnWidths)).append("\n");
        sb.append(getSeparator(columnWidths)).append("\n");

        // 3. 打印数据行
        for (List<String> row : rows) {
            sb.append(getRow(row, columnWidths)).append("\n");
        }

        // 4. 打印底部边框和最终消息
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(rows.size()).append(rows.size() == 1 ? " variable bound." : " variables bound.");
        return sb.toString();
    }

    /**
     * 整数值不带小数部分输出，其余按 double 的默认格式。
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    private static String getRow(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(String.format(" %-" + widths.get(i) + "s |", cells.get(i)));
        }
        return sb.toString();
    }

    private static String getSeparator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
