package com.minisql.data;

/**
 * DataType - 数据类型枚举
 *
 * 定义Mini SQL支持的列类型,以及每种类型在内存中对应的Java类型。
 *
 * 类型分类:
 * - 整数类型: INT(Integer), BIGINT(Long)
 * - 浮点类型: DOUBLE(Double)
 * - 布尔类型: BOOLEAN(Boolean)
 * - 字符串类型: VARCHAR(n), TEXT(String)
 *
 * 设计原则:
 * - 每种类型只对应一个Java类型,没有特殊情况
 * - NULL由Row中的null表示,与类型无关
 * - 类型转换集中在coerce(),INSERT和UPDATE共用同一套规则
 */
public enum DataType {

    /** 32位整数 */
    INT(Integer.class),

    /** 64位整数 */
    BIGINT(Long.class),

    /** 双精度浮点 */
    DOUBLE(Double.class),

    /** 布尔 */
    BOOLEAN(Boolean.class),

    /** 变长字符串,最大长度由列定义指定 */
    VARCHAR(String.class),

    /** 不限长度的字符串 */
    TEXT(String.class);

    /** 对应的Java类型 */
    private final Class<?> javaType;

    DataType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }

    /**
     * 是否需要长度参数
     */
    public boolean requiresLength() {
        return this == VARCHAR;
    }

    /**
     * 将值转换为本类型的Java表示
     *
     * 规则:
     * - 类型已匹配: 原样返回
     * - Integer → BIGINT/DOUBLE: 拓宽
     * - Long → INT: 仅在范围内
     * - Long → DOUBLE: 拓宽
     * - 其他组合: 不支持
     *
     * @param value 非null的值
     * @return 转换后的值,不支持转换时返回null
     */
    public Object coerce(Object value) {
        if (javaType.isInstance(value)) {
            return value;
        }

        switch (this) {
            case BIGINT:
                if (value instanceof Integer) {
                    return ((Integer) value).longValue();
                }
                return null;

            case INT:
                if (value instanceof Long) {
                    long l = (Long) value;
                    if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                        return (int) l;
                    }
                }
                return null;

            case DOUBLE:
                if (value instanceof Integer || value instanceof Long) {
                    return ((Number) value).doubleValue();
                }
                return null;

            default:
                return null;
        }
    }
}
