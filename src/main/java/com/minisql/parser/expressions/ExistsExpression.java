package com.minisql.parser.expressions;

import com.minisql.parser.Expression;
import com.minisql.parser.statements.SelectStatement;

/**
 * ExistsExpression - EXISTS (子查询)
 *
 * 子查询至少产生一行时为TRUE,否则为FALSE,不会产生UNKNOWN。
 * NOT EXISTS 解析为 NotExpression(ExistsExpression)。
 */
public class ExistsExpression implements Expression {

    private final SelectStatement subquery;

    public ExistsExpression(SelectStatement subquery) {
        this.subquery = subquery;
    }

    public SelectStatement getSubquery() {
        return subquery;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.EXISTS;
    }

    @Override
    public String toString() {
        return "EXISTS (" + subquery + ")";
    }
}
