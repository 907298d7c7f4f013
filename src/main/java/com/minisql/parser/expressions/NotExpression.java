package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

/**
 * NotExpression - NOT运算表达式
 *
 * 如 NOT (age > 18), NOT active。
 */
public class NotExpression implements Expression {

    /** 操作数 */
    private final Expression operand;

    public NotExpression(Expression operand) {
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.NOT;
    }

    @Override
    public String toString() {
        return "(NOT " + operand + ")";
    }
}
