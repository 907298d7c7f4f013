package com.minisql.parser.statements;

import com.minisql.parser.Expression;

import java.util.Optional;

/**
 * SelectItem - SELECT列表中的一项: 表达式 + 可选别名
 */
public class SelectItem {

    private final Expression expression;

    /** AS别名(没有则为null) */
    private final String label;

    public SelectItem(Expression expression, String label) {
        this.expression = expression;
        this.label = label;
    }

    public SelectItem(Expression expression) {
        this(expression, null);
    }

    public Expression getExpression() {
        return expression;
    }

    public Optional<String> getLabel() {
        return Optional.ofNullable(label);
    }

    @Override
    public String toString() {
        return label != null ? expression + " AS " + label : expression.toString();
    }
}
