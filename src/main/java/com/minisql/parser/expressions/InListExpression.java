package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

import java.util.List;

/**
 * InListExpression - [NOT] IN (值列表)
 *
 * 语法示例:
 * <pre>
 * id IN (1, 2, 3)
 * name NOT IN ('a', 'b')
 * </pre>
 */
public class InListExpression implements Expression {

    /** 被检测的值 */
    private final Expression operand;

    /** 候选值列表 */
    private final List<Expression> list;

    /** true表示NOT IN */
    private final boolean negated;

    public InListExpression(Expression operand, List<Expression> list, boolean negated) {
        this.operand = operand;
        this.list = List.copyOf(list);
        this.negated = negated;
    }

    public Expression getOperand() {
        return operand;
    }

    public List<Expression> getList() {
        return list;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.IN_LIST;
    }

    @Override
    public String toString() {
        return "(" + operand + (negated ? " NOT IN " : " IN ") + list + ")";
    }
}
