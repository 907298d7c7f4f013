package com.minisql.parser.statements;

import com.minisql.parser.Expression;
import com.minisql.parser.ObjectName;
import com.minisql.parser.Statement;

import java.util.Optional;

/**
 * DeleteStatement - DELETE删除语句
 *
 * 语法示例:
 * <pre>
 * DELETE FROM users WHERE id = 1;
 * DELETE FROM users WHERE age > 100;
 * </pre>
 *
 * 没有WHERE会删除所有行!
 */
public class DeleteStatement implements Statement {

    /** 表名 */
    private final ObjectName tableName;

    /** WHERE条件(如果没有WHERE子句则为null) */
    private final Expression whereClause;

    public DeleteStatement(ObjectName tableName, Expression whereClause) {
        this.tableName = tableName;
        this.whereClause = whereClause;
    }

    public ObjectName getTableName() {
        return tableName;
    }

    public Optional<Expression> getWhereClause() {
        return Optional.ofNullable(whereClause);
    }

    @Override
    public StatementType getType() {
        return StatementType.DELETE;
    }

    @Override
    public String toString() {
        return "DeleteStatement{" +
                "tableName='" + tableName + '\'' +
                ", whereClause=" + whereClause +
                '}';
    }
}
