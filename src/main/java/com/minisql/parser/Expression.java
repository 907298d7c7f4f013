package com.minisql.parser;

/**
 * Expression - SQL表达式接口
 *
 * 表示SQL中的各种表达式,包括:
 * - 列引用: id, name, users.age
 * - 字面量: 42, 'hello', TRUE, NULL
 * - 二元运算: age > 18, price * 2, a AND b
 * - 一元运算: NOT flag, -amount
 * - 谓词: x IS NULL, x IN (1, 2), x IN (SELECT ...), EXISTS (SELECT ...)
 *
 * 设计原则:
 * - "Good taste": 所有表达式都是Expression,求值器按getType()分发
 * - 可组合: 复杂表达式由简单表达式组合而成
 * - 不可变: 表达式树创建后不再修改
 */
public interface Expression {

    /**
     * 获取表达式类型
     *
     * @return 表达式类型枚举
     */
    ExpressionType getType();

    /**
     * SQL表达式类型枚举
     */
    enum ExpressionType {
        /** 列引用 */
        COLUMN,
        /** 字面量 */
        LITERAL,
        /** 二元运算 */
        BINARY,
        /** NOT运算 */
        NOT,
        /** 取负 */
        NEGATE,
        /** IS [NOT] NULL */
        IS_NULL,
        /** [NOT] IN (值列表) */
        IN_LIST,
        /** [NOT] IN (子查询) */
        IN_SUBQUERY,
        /** EXISTS (子查询) */
        EXISTS
    }
}
