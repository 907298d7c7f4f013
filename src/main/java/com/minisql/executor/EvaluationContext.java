package com.minisql.executor;

import com.minisql.data.Column;
import com.minisql.data.Row;
import com.minisql.data.Schema;
import com.minisql.parser.expressions.ColumnExpression;

import java.util.List;

/**
 * EvaluationContext - 表达式求值时的行作用域
 *
 * 一个作用域 = 表名(或别名) + 列定义 + 当前行,外加可选的外层作用域。
 * 子查询求值时,以外层查询的当前作用域作为outer,从而支持相关子查询:
 *
 * <pre>
 * SELECT * FROM users u WHERE EXISTS (SELECT * FROM orders WHERE orders.user_id = u.id)
 *
 * orders作用域 (row = 当前订单)
 *   └─ outer: u作用域 (row = 当前用户)
 * </pre>
 *
 * 列查找规则:
 * - 不带前缀: 从内向外,第一个声明了该列的作用域
 * - 带前缀 t.c: 从内向外,第一个名字为t的作用域,该作用域必须声明c
 * - 找不到: EvaluationException
 */
public class EvaluationContext {

    /** 作用域名(别名优先,否则表名) */
    private final String name;

    private final List<Column> columns;

    private final Row row;

    /** 外层作用域(顶层查询为null) */
    private final EvaluationContext outer;

    public EvaluationContext(String name, List<Column> columns, Row row, EvaluationContext outer) {
        if (columns == null || row == null) {
            throw new IllegalArgumentException("Columns and row cannot be null");
        }
        this.name = name;
        this.columns = columns;
        this.row = row;
        this.outer = outer;
    }

    public String getName() {
        return name;
    }

    public Row getRow() {
        return row;
    }

    public EvaluationContext getOuter() {
        return outer;
    }

    /**
     * 查找列值
     *
     * @param column 列引用
     * @return 列值,可能为null(SQL NULL)
     * @throws EvaluationException 没有任何作用域声明该列
     */
    public Object lookup(ColumnExpression column) {
        String qualifier = column.getTableName();
        String columnName = column.getColumnName();

        for (EvaluationContext scope = this; scope != null; scope = scope.outer) {
            if (qualifier != null && !qualifier.equalsIgnoreCase(scope.name)) {
                continue;
            }

            int index = Schema.indexOf(scope.columns, columnName);
            if (index >= 0) {
                return scope.row.getValue(index);
            }

            if (qualifier != null) {
                throw new EvaluationException(
                        "Column not found: " + column.getFullName() + " (table " + scope.name + ")");
            }
        }

        throw new EvaluationException("Column not found: " + column.getFullName());
    }
}
