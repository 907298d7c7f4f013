package com.minisql.data;

/**
 * RowException - 行构造异常
 *
 * 值的个数与列不匹配、引用了未声明的列、值不符合列约束时抛出。
 */
public class RowException extends RuntimeException {

    public RowException(String message) {
        super(message);
    }

    public RowException(String message, Throwable cause) {
        super(message, cause);
    }
}
