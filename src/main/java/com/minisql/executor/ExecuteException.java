package com.minisql.executor;

/**
 * ExecuteException - 执行器自身的错误
 *
 * 只有两种情况:
 * - QUERY_NOT_SUPPORTED: 语句类型没有执行路径
 * - DROP_TYPE_NOT_SUPPORTED: DROP的对象不是TABLE
 *
 * 其他错误都来自协作者(存储、求值、行构造),由执行器原样传播,不包装成ExecuteException。
 */
public class ExecuteException extends RuntimeException {

    private final Kind kind;

    public ExecuteException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        /** 语句类型不支持执行 */
        QUERY_NOT_SUPPORTED,
        /** DROP对象类型不支持 */
        DROP_TYPE_NOT_SUPPORTED
    }
}
