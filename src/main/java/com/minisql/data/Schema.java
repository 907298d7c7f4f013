package com.minisql.data;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Schema - 表结构
 *
 * 表名 + 按声明顺序排列的列定义。由CREATE TABLE创建,DROP TABLE删除,
 * 其他语句只读取。
 *
 * 列顺序即Row中值的位置顺序,必须与声明时完全一致。
 */
public class Schema {

    /** 表名 */
    private final String tableName;

    /** 列定义(声明顺序) */
    private final List<Column> columnDefs;

    public Schema(String tableName, List<Column> columnDefs) {
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        if (columnDefs == null) {
            throw new IllegalArgumentException("Column definitions cannot be null");
        }

        this.tableName = tableName;
        this.columnDefs = List.copyOf(columnDefs);
    }

    public String getTableName() {
        return tableName;
    }

    public List<Column> getColumnDefs() {
        return columnDefs;
    }

    /**
     * 获取列名列表(声明顺序)
     */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columnDefs.size());
        for (Column column : columnDefs) {
            names.add(column.getName());
        }
        return names;
    }

    /**
     * 查找列位置(大小写不敏感)
     *
     * @param columnName 列名
     * @return 列索引,不存在返回-1
     */
    public int indexOf(String columnName) {
        return indexOf(columnDefs, columnName);
    }

    /**
     * 在列定义列表中查找列位置
     *
     * @return 列索引,不存在返回-1
     */
    public static int indexOf(List<Column> columns, String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).hasName(columnName)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Schema schema = (Schema) obj;

        return tableName.equals(schema.tableName) && columnDefs.equals(schema.columnDefs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, columnDefs);
    }

    @Override
    public String toString() {
        return "Schema{" +
                "tableName='" + tableName + '\'' +
                ", columnDefs=" + columnDefs +
                '}';
    }
}
