package com.minisql.result;

import com.minisql.data.Row;

import java.util.List;

/**
 * PayloadPrinter - 以MySQL客户端风格输出执行结果
 *
 * 输出示例:
 * <pre>
 * +----+-------+
 * | id | name  |
 * +----+-------+
 * | 1  | Alice |
 * | 2  | Bob   |
 * +----+-------+
 * 2 rows in set
 *
 * Query OK, 3 rows affected
 * </pre>
 */
public final class PayloadPrinter {

    private PayloadPrinter() {
    }

    /**
     * 格式化执行结果
     *
     * @param payload 执行结果
     * @return 格式化后的文本(不含末尾换行)
     */
    public static String format(Payload payload) {
        switch (payload.getType()) {
            case CREATE:
            case DROP_TABLE:
                return "Query OK, 0 rows affected";

            case INSERT:
                return "Query OK, 1 row affected";

            case DELETE:
            case UPDATE:
                return "Query OK, " + rowCount(payload.getAffectedRows()) + " affected";

            case SELECT:
                return formatTable(payload.getLabels(), payload.getRows());

            default:
                throw new IllegalArgumentException("Unknown payload type: " + payload.getType());
        }
    }

    private static String formatTable(List<String> labels, List<Row> rows) {
        if (rows.isEmpty()) {
            return "Empty set";
        }

        // 计算每列的最大宽度
        int[] widths = new int[labels.size()];
        for (int i = 0; i < labels.size(); i++) {
            widths[i] = labels.get(i).length();
        }
        for (Row row : rows) {
            for (int i = 0; i < labels.size(); i++) {
                widths[i] = Math.max(widths[i], cell(row, i).length());
            }
        }

        String separator = separator(widths);

        StringBuilder sb = new StringBuilder();
        sb.append(separator).append('\n');
        appendLine(sb, labels, widths);
        sb.append(separator).append('\n');
        for (Row row : rows) {
            sb.append("|");
            for (int i = 0; i < widths.length; i++) {
                sb.append(' ').append(padRight(cell(row, i), widths[i])).append(" |");
            }
            sb.append('\n');
        }
        sb.append(separator).append('\n');
        sb.append(rowCount(rows.size())).append(" in set");

        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> cells, int[] widths) {
        sb.append("|");
        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(padRight(cells.get(i), widths[i])).append(" |");
        }
        sb.append('\n');
    }

    private static String cell(Row row, int index) {
        Object value = row.getValue(index);
        return value != null ? value.toString() : "NULL";
    }

    private static String rowCount(int count) {
        return count + (count == 1 ? " row" : " rows");
    }

    private static String separator(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.toString();
    }

    private static String padRight(String str, int width) {
        if (str.length() >= width) {
            return str;
        }
        return str + " ".repeat(width - str.length());
    }
}
