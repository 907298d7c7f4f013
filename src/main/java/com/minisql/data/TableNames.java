package com.minisql.data;

import com.minisql.parser.ObjectName;

import java.util.List;

/**
 * 表名解析
 *
 * 将可能带限定前缀的对象名(如 db.users)归约为单个表标识符。
 */
public final class TableNames {

    private TableNames() {
    }

    /**
     * 取对象名的最后一段作为表名
     *
     * @param name 对象名
     * @return 表名
     * @throws TableNameException 对象名为空或最后一段为空白
     */
    public static String resolve(ObjectName name) {
        if (name == null) {
            throw new TableNameException("Table name is missing");
        }

        List<String> parts = name.getParts();
        if (parts.isEmpty()) {
            throw new TableNameException("Table name is empty");
        }

        String tableName = parts.get(parts.size() - 1);
        if (tableName == null || tableName.trim().isEmpty()) {
            throw new TableNameException("Malformed table name: " + name);
        }

        return tableName;
    }
}
