package com.minisql.storage;

import com.minisql.data.Row;

/**
 * KeyedRow - 行数据 + 它在存储引擎中的Key
 *
 * @param <K> 引擎自定义的行Key类型
 */
public class KeyedRow<K> {

    private final K key;

    private final Row row;

    public KeyedRow(K key, Row row) {
        this.key = key;
        this.row = row;
    }

    public K getKey() {
        return key;
    }

    public Row getRow() {
        return row;
    }

    @Override
    public String toString() {
        return "KeyedRow{" + key + " -> " + row + '}';
    }
}
