package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

/**
 * IsNullExpression - IS [NOT] NULL 谓词
 *
 * 唯一一个对NULL返回确定结果(TRUE/FALSE)的谓词,不会产生UNKNOWN。
 */
public class IsNullExpression implements Expression {

    private final Expression operand;

    /** true表示IS NOT NULL */
    private final boolean negated;

    public IsNullExpression(Expression operand, boolean negated) {
        this.operand = operand;
        this.negated = negated;
    }

    public Expression getOperand() {
        return operand;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.IS_NULL;
    }

    @Override
    public String toString() {
        return "(" + operand + (negated ? " IS NOT NULL)" : " IS NULL)");
    }
}
