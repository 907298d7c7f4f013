package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

/**
 * NegateExpression - 取负表达式(-amount, -1)
 */
public class NegateExpression implements Expression {

    private final Expression operand;

    public NegateExpression(Expression operand) {
        this.operand = operand;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.NEGATE;
    }

    @Override
    public String toString() {
        return "-" + operand;
    }
}
