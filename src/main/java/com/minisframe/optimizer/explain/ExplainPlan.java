package com.minisframe.optimizer.explain;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * EXPLAIN 执行计划
 *
 * 每个不同的计划节点一行，共享子图只出现一次，通过标签引用
 *
 * @author Mini-SFrame
 */
@Data
public class ExplainPlan {

    private final List<Row> rows = new ArrayList<>();

    public void addRow(Row row) {
        rows.add(row);
    }

    /**
     * 一行 EXPLAIN 输出
     */
    @Data
    public static class Row {

        /**
         * 节点标签（N0 为根）
         */
        private String tag;

        /**
         * 算子名称
         */
        private String operator;

        /**
         * 契约的 repr
         */
        private String repr;

        /**
         * 输出列类型
         */
        private List<String> columnTypes = new ArrayList<>();

        /**
         * 推断的行数，未知时为 null
         */
        private Long length;

        /**
         * 输入节点的标签
         */
        private List<String> inputs = new ArrayList<>();

        public String formatRow() {
            return String.format("| %-4s | %-10s | %-32s | %-16s | %12s | %-12s |",
                    tag,
                    operator,
                    repr,
                    String.join(",", columnTypes),
                    length != null ? length.toString() : "?",
                    inputs.isEmpty() ? "" : String.join(",", inputs));
        }
    }

    /**
     * 表格格式输出
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(tableSeparator()).append('\n');
        sb.append(tableHeader()).append('\n');
        sb.append(tableSeparator()).append('\n');
        for (Row row : rows) {
            sb.append(row.formatRow()).append('\n');
        }
        sb.append(tableSeparator()).append('\n');
        return sb.toString();
    }

    public static String tableHeader() {
        return String.format("| %-4s | %-10s | %-32s | %-16s | %12s | %-12s |",
                "tag", "operator", "repr", "type", "rows", "inputs");
    }

    public static String tableSeparator() {
        return "+------+------------+----------------------------------+"
                + "------------------+--------------+--------------+";
    }
}
