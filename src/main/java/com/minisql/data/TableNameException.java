package com.minisql.data;

/**
 * TableNameException - 表名解析异常
 *
 * 当对象名无法归约为单个表标识符时抛出(空名字、空白的最后一段等)。
 */
public class TableNameException extends RuntimeException {

    public TableNameException(String message) {
        super(message);
    }
}
