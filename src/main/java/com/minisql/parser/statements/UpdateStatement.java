package com.minisql.parser.statements;

import com.minisql.parser.Expression;
import com.minisql.parser.ObjectName;
import com.minisql.parser.Statement;

import java.util.List;
import java.util.Optional;

/**
 * UpdateStatement - UPDATE更新语句
 *
 * 语法示例:
 * <pre>
 * UPDATE users SET age = 26 WHERE id = 1;
 * UPDATE users SET age = age + 1, name = 'Alice' WHERE id = 1;
 * </pre>
 *
 * 设计原则:
 * - 赋值保持书写顺序(List而不是Map)
 * - 支持WHERE条件(可选,但没有WHERE会更新所有行!)
 */
public class UpdateStatement implements Statement {

    /** 表名 */
    private final ObjectName tableName;

    /** SET子句(书写顺序) */
    private final List<Assignment> assignments;

    /** WHERE条件(如果没有WHERE子句则为null) */
    private final Expression whereClause;

    public UpdateStatement(ObjectName tableName,
                           List<Assignment> assignments,
                           Expression whereClause) {
        this.tableName = tableName;
        this.assignments = List.copyOf(assignments);
        this.whereClause = whereClause;
    }

    public ObjectName getTableName() {
        return tableName;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public Optional<Expression> getWhereClause() {
        return Optional.ofNullable(whereClause);
    }

    @Override
    public StatementType getType() {
        return StatementType.UPDATE;
    }

    @Override
    public String toString() {
        return "UpdateStatement{" +
                "tableName='" + tableName + '\'' +
                ", assignments=" + assignments +
                ", whereClause=" + whereClause +
                '}';
    }
}
