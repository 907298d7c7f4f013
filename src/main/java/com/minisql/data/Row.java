package com.minisql.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Row - 行数据
 *
 * 按Schema列顺序排列的一组值,第i个值对应第i列。
 * Row本身没有身份,身份由存储引擎分配的Key提供。
 *
 * 设计原则:
 * - 不可变对象(创建后不可修改)
 * - 值语义: 两个Row值相同即相等
 * - NULL用null表示
 *
 * 值类型: Integer, Long, Double, Boolean, String, 或null。
 */
public class Row {

    /** 列值(null表示NULL) */
    private final List<Object> values;

    public Row(List<Object> values) {
        if (values == null) {
            throw new IllegalArgumentException("Values cannot be null");
        }
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * 便捷构造,常用于测试
     */
    public static Row of(Object... values) {
        return new Row(Arrays.asList(values));
    }

    /**
     * 按列定义构造一行(INSERT使用)
     *
     * 规则:
     * - 未指定目标列: 值的个数必须等于列数,按位置绑定
     * - 指定目标列: 每个列名必须已声明且不重复,值的个数等于目标列数,
     *   未出现的列填NULL
     * - 每个值经Column.coerce()转换,不满足约束直接失败
     *
     * @param columns 表的列定义
     * @param targetColumns INSERT指定的列名(为空表示全部列)
     * @param values 已求值的值
     * @return 新行
     * @throws RowException 列不存在、个数不匹配、值不满足约束
     */
    public static Row create(List<Column> columns, List<String> targetColumns, List<Object> values) {
        Object[] rowValues = new Object[columns.size()];

        if (targetColumns.isEmpty()) {
            if (values.size() != columns.size()) {
                throw new RowException(
                        "Column count mismatch: expected " + columns.size() +
                                " values, got " + values.size());
            }
            for (int i = 0; i < columns.size(); i++) {
                rowValues[i] = columns.get(i).coerce(values.get(i));
            }
            return new Row(Arrays.asList(rowValues));
        }

        if (values.size() != targetColumns.size()) {
            throw new RowException(
                    "Column count mismatch: " + targetColumns.size() +
                            " columns, " + values.size() + " values");
        }

        Set<Integer> assigned = new HashSet<>();
        for (int i = 0; i < targetColumns.size(); i++) {
            String columnName = targetColumns.get(i);
            int index = Schema.indexOf(columns, columnName);
            if (index < 0) {
                throw new RowException("Column not found: " + columnName);
            }
            if (!assigned.add(index)) {
                throw new RowException("Column specified more than once: " + columnName);
            }
            rowValues[index] = columns.get(index).coerce(values.get(i));
        }

        // 未指定的列取NULL,同样要过NOT NULL检查
        for (int i = 0; i < columns.size(); i++) {
            if (!assigned.contains(i)) {
                rowValues[i] = columns.get(i).coerce(null);
            }
        }

        return new Row(Arrays.asList(rowValues));
    }

    public int size() {
        return values.size();
    }

    /**
     * 获取列值(通过位置)
     *
     * @param index 列索引(从0开始)
     * @return 列值,可能为null
     */
    public Object getValue(int index) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException("Column index out of bounds: " + index);
        }
        return values.get(index);
    }

    public List<Object> getValues() {
        return values;
    }

    /**
     * 复制并替换指定位置的值
     *
     * @param index 列索引
     * @param value 新值
     * @return 新行,原行不变
     */
    public Row with(int index, Object value) {
        List<Object> copy = new ArrayList<>(values);
        copy.set(index, value);
        return new Row(copy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return values.equals(((Row) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
