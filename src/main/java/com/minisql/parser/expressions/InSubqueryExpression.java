package com.minisql.parser.expressions;

import com.minisql.parser.Expression;
import com.minisql.parser.statements.SelectStatement;

/**
 * InSubqueryExpression - [NOT] IN (子查询)
 *
 * 子查询可以引用外层查询的列(相关子查询):
 * <pre>
 * SELECT * FROM orders o WHERE o.user_id IN (SELECT id FROM users WHERE users.region = o.region)
 * </pre>
 *
 * 只使用子查询结果的第一列。
 */
public class InSubqueryExpression implements Expression {

    private final Expression operand;

    private final SelectStatement subquery;

    /** true表示NOT IN */
    private final boolean negated;

    public InSubqueryExpression(Expression operand, SelectStatement subquery, boolean negated) {
        this.operand = operand;
        this.subquery = subquery;
        this.negated = negated;
    }

    public Expression getOperand() {
        return operand;
    }

    public SelectStatement getSubquery() {
        return subquery;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.IN_SUBQUERY;
    }

    @Override
    public String toString() {
        return "(" + operand + (negated ? " NOT IN (" : " IN (") + subquery + "))";
    }
}
