package com.minisql.parser.statements;

import com.minisql.parser.Expression;

/**
 * Assignment - UPDATE SET子句中的一项: 列名 = 表达式
 */
public class Assignment {

    private final String columnName;

    private final Expression value;

    public Assignment(String columnName, Expression value) {
        this.columnName = columnName;
        this.value = value;
    }

    public String getColumnName() {
        return columnName;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String toString() {
        return columnName + " = " + value;
    }
}
