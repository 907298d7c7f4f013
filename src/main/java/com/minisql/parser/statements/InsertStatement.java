package com.minisql.parser.statements;

import com.minisql.parser.Expression;
import com.minisql.parser.ObjectName;
import com.minisql.parser.Statement;

import java.util.List;

/**
 * InsertStatement - INSERT插入语句
 *
 * 语法示例:
 * <pre>
 * INSERT INTO users VALUES (1, 'Alice', 25);
 * INSERT INTO users (id, name) VALUES (1, 'Alice');
 * </pre>
 *
 * 一条INSERT插入一行,未指定列名时按表定义顺序绑定。
 */
public class InsertStatement implements Statement {

    /** 表名 */
    private final ObjectName tableName;

    /** 列名列表(为空表示按表定义顺序插入) */
    private final List<String> columnNames;

    /** 值表达式 */
    private final List<Expression> values;

    public InsertStatement(ObjectName tableName, List<String> columnNames, List<Expression> values) {
        this.tableName = tableName;
        this.columnNames = columnNames != null ? List.copyOf(columnNames) : List.of();
        this.values = List.copyOf(values);
    }

    public ObjectName getTableName() {
        return tableName;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    /**
     * 判断是否指定了列名
     */
    public boolean hasColumnNames() {
        return !columnNames.isEmpty();
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public StatementType getType() {
        return StatementType.INSERT;
    }

    @Override
    public String toString() {
        return "InsertStatement{" +
                "tableName='" + tableName + '\'' +
                ", columnNames=" + columnNames +
                ", values=" + values +
                '}';
    }
}
