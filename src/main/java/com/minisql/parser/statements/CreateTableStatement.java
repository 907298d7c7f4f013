package com.minisql.parser.statements;

import com.minisql.data.Column;
import com.minisql.parser.ObjectName;
import com.minisql.parser.Statement;

import java.util.List;

/**
 * CreateTableStatement - CREATE TABLE语句
 *
 * 表示创建表的SQL语句。
 *
 * 语法示例:
 * <pre>
 * CREATE TABLE users (
 *     id INT NOT NULL,
 *     name VARCHAR(100)
 * );
 * </pre>
 *
 * 列定义直接使用data层的Column,声明顺序原样保留。
 */
public class CreateTableStatement implements Statement {

    /** 表名 */
    private final ObjectName tableName;

    /** 列定义列表(声明顺序) */
    private final List<Column> columns;

    public CreateTableStatement(ObjectName tableName, List<Column> columns) {
        this.tableName = tableName;
        this.columns = List.copyOf(columns);
    }

    public ObjectName getTableName() {
        return tableName;
    }

    public List<Column> getColumns() {
        return columns;
    }

    @Override
    public StatementType getType() {
        return StatementType.CREATE_TABLE;
    }

    @Override
    public String toString() {
        return "CreateTableStatement{" +
                "tableName='" + tableName + '\'' +
                ", columns=" + columns +
                '}';
    }
}
