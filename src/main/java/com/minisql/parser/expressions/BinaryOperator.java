package com.minisql.parser.expressions;

/**
 * BinaryOperator - 二元运算符
 *
 * 定义SQL中支持的二元运算符。
 */
public enum BinaryOperator {

    /** 等于 */
    EQUAL("="),
    /** 不等于 */
    NOT_EQUAL("!="),
    /** 大于 */
    GREATER_THAN(">"),
    /** 小于 */
    LESS_THAN("<"),
    /** 大于等于 */
    GREATER_EQUAL(">="),
    /** 小于等于 */
    LESS_EQUAL("<="),
    /** 加法 */
    ADD("+"),
    /** 减法 */
    SUBTRACT("-"),
    /** 乘法 */
    MULTIPLY("*"),
    /** 除法 */
    DIVIDE("/"),
    /** 取模 */
    MODULO("%"),
    /** 逻辑与 */
    AND("AND"),
    /** 逻辑或 */
    OR("OR");

    /** 运算符字符串表示 */
    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isArithmetic() {
        return ordinal() >= ADD.ordinal() && ordinal() <= MODULO.ordinal();
    }

    /**
     * 根据符号获取运算符
     *
     * "<>" 是 "!=" 的别名。
     *
     * @param symbol 运算符符号(大小写不敏感)
     * @return 运算符枚举,如果未知返回null
     */
    public static BinaryOperator fromSymbol(String symbol) {
        if ("<>".equals(symbol)) {
            return NOT_EQUAL;
        }
        for (BinaryOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(symbol)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
