package com.minisql.parser.expressions;

import com.minisql.parser.Expression;

/**
 * LiteralExpression - 字面量表达式
 *
 * 表示SQL中的字面量值,包括:
 * - 整数: 42(Integer), 超出int范围时为Long
 * - 浮点数: 3.14
 * - 字符串: 'hello', 'it''s'
 * - 布尔值: TRUE, FALSE
 * - NULL值: NULL
 */
public class LiteralExpression implements Expression {

    /** 字面量值(Integer, Long, Double, String, Boolean, 或null) */
    private final Object value;

    public LiteralExpression(Object value) {
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.LITERAL;
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        return value.toString();
    }
}
