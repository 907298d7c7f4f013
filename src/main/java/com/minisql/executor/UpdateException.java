package com.minisql.executor;

/**
 * UpdateException - UPDATE赋值列表校验失败
 *
 * 赋值目标列不存在或重复出现。在扫描任何行之前抛出。
 */
public class UpdateException extends RuntimeException {

    public UpdateException(String message) {
        super(message);
    }
}
