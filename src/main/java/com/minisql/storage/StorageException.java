package com.minisql.storage;

/**
 * StorageException - 存储引擎异常
 *
 * 表不存在、表已存在、Key失效、I/O失败等。
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
