package com.minisql.parser.statements;

import com.minisql.parser.Expression;
import com.minisql.parser.ObjectName;
import com.minisql.parser.Statement;

import java.util.List;
import java.util.Optional;

/**
 * SelectStatement - SELECT查询语句
 *
 * 表示查询数据的SQL语句,也用作IN/EXISTS中的子查询。
 *
 * 语法示例:
 * <pre>
 * SELECT * FROM users;
 * SELECT id, name AS n FROM users u WHERE u.age > 18;
 * </pre>
 *
 * 设计原则:
 * - 支持SELECT列表(可以是*或表达式)
 * - 支持表别名,相关子查询靠别名引用外层的列
 * - 不支持JOIN、ORDER BY、GROUP BY等高级特性
 */
public class SelectStatement implements Statement {

    /** SELECT列表(为空表示SELECT *) */
    private final List<SelectItem> selectItems;

    /** 表名 */
    private final ObjectName tableName;

    /** 表别名(没有则为null) */
    private final String alias;

    /** WHERE条件(如果没有WHERE子句则为null) */
    private final Expression whereClause;

    public SelectStatement(List<SelectItem> selectItems,
                           ObjectName tableName,
                           String alias,
                           Expression whereClause) {
        this.selectItems = selectItems != null ? List.copyOf(selectItems) : List.of();
        this.tableName = tableName;
        this.alias = alias;
        this.whereClause = whereClause;
    }

    public SelectStatement(List<SelectItem> selectItems, ObjectName tableName, Expression whereClause) {
        this(selectItems, tableName, null, whereClause);
    }

    /**
     * 判断是否为SELECT *
     */
    public boolean isSelectAll() {
        return selectItems.isEmpty();
    }

    public List<SelectItem> getSelectItems() {
        return selectItems;
    }

    public ObjectName getTableName() {
        return tableName;
    }

    public Optional<String> getAlias() {
        return Optional.ofNullable(alias);
    }

    public Optional<Expression> getWhereClause() {
        return Optional.ofNullable(whereClause);
    }

    @Override
    public StatementType getType() {
        return StatementType.SELECT;
    }

    @Override
    public String toString() {
        return "SelectStatement{" +
                "selectItems=" + (isSelectAll() ? "*" : selectItems) +
                ", tableName='" + tableName + '\'' +
                (alias != null ? ", alias='" + alias + '\'' : "") +
                ", whereClause=" + whereClause +
                '}';
    }
}
