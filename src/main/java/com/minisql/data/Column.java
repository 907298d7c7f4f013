package com.minisql.data;

import java.util.Objects;

/**
 * Column - 列定义
 *
 * CREATE TABLE中声明的单个列: 列名、数据类型、长度约束、是否可空。
 * Schema按声明顺序保存Column,列顺序决定值在Row中的位置。
 *
 * 设计原则:
 * - 不可变对象(创建后不可修改)
 * - VARCHAR必须指定长度,其他类型长度为0
 * - 位置信息由Schema管理,Column自身不存储
 *
 * 使用示例:
 * <pre>
 * Column nameCol = new Column("name", DataType.VARCHAR, 100, true);
 * Column ageCol = new Column("age", DataType.INT, false);
 * </pre>
 */
public class Column {

    /** 列名 */
    private final String name;

    /** 数据类型 */
    private final DataType type;

    /** 类型长度(仅对VARCHAR有效,表示最大字符数) */
    private final int length;

    /** 是否允许NULL */
    private final boolean nullable;

    /**
     * 创建列定义(非VARCHAR类型)
     *
     * @param name 列名
     * @param type 数据类型
     * @param nullable 是否允许NULL
     */
    public Column(String name, DataType type, boolean nullable) {
        this(name, type, 0, nullable);
    }

    /**
     * 创建列定义
     *
     * @param name 列名
     * @param type 数据类型
     * @param length 类型长度(仅VARCHAR有效)
     * @param nullable 是否允许NULL
     */
    public Column(String name, DataType type, int length, boolean nullable) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Column name cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Data type cannot be null");
        }
        if (type.requiresLength() && length <= 0) {
            throw new IllegalArgumentException("VARCHAR type requires positive length");
        }
        if (!type.requiresLength() && length != 0) {
            throw new IllegalArgumentException("Length is only valid for VARCHAR type");
        }

        this.name = name;
        this.type = type;
        this.length = length;
        this.nullable = nullable;
    }

    public String getName() {
        return name;
    }

    public DataType getType() {
        return type;
    }

    /**
     * 获取类型长度
     *
     * @return VARCHAR返回最大长度,其他类型返回0
     */
    public int getLength() {
        return length;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * 列名匹配(大小写不敏感)
     */
    public boolean hasName(String columnName) {
        return name.equalsIgnoreCase(columnName);
    }

    /**
     * 将值转换为符合本列约束的值
     *
     * INSERT和UPDATE写入的每个值都经过这里。
     *
     * @param value 原始值,null表示SQL NULL
     * @return 转换后的值
     * @throws RowException NOT NULL列写入NULL、类型不兼容、VARCHAR超长
     */
    public Object coerce(Object value) {
        if (value == null) {
            if (!nullable) {
                throw new RowException("Column '" + name + "' cannot be null");
            }
            return null;
        }

        Object converted = type.coerce(value);
        if (converted == null) {
            throw new RowException(
                    "Type mismatch for column '" + name + "': expected " + type +
                            ", got " + value.getClass().getSimpleName());
        }

        if (type == DataType.VARCHAR && ((String) converted).length() > length) {
            throw new RowException(
                    "Value too long for column '" + name + "': max length " + length);
        }

        return converted;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Column column = (Column) obj;

        return length == column.length
                && nullable == column.nullable
                && name.equals(column.name)
                && type == column.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, length, nullable);
    }

    @Override
    public String toString() {
        return "Column{" +
                "name='" + name + '\'' +
                ", type=" + type +
                (type.requiresLength() ? "(" + length + ")" : "") +
                ", nullable=" + nullable +
                '}';
    }
}
