package com.minisql.executor;

import com.minisql.data.Schema;
import com.minisql.storage.KeyedRow;
import com.minisql.storage.StorageEngine;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Fetch - 按条件遍历表中的行
 *
 * 在存储引擎的scanData()之上套一层Filter,惰性地返回满足条件的(Key, Row)。
 *
 * 数据流:
 * <pre>
 * storage.scanData() → KeyedRow → filter.matches()?
 *   → true  → 返回
 *   → false → 跳过,继续读取
 * </pre>
 *
 * 求值失败从hasNext()抛出。
 */
public final class Fetch {

    private Fetch() {
    }

    /**
     * 获取表结构
     *
     * @throws com.minisql.storage.StorageException 表不存在
     */
    public static Schema fetchSchema(StorageEngine<?> storage, String tableName) {
        return storage.getSchema(tableName);
    }

    /**
     * 遍历满足条件的行
     *
     * @param storage 存储引擎
     * @param schema 表结构
     * @param filter WHERE条件
     * @return 惰性、不可重启的迭代器
     */
    public static <K> Iterator<KeyedRow<K>> fetch(StorageEngine<K> storage, Schema schema, Filter<K> filter) {
        return new FilteredIterator<>(storage.scanData(schema.getTableName()), schema, filter);
    }

    /**
     * 过滤迭代器
     *
     * hasNext()跳过所有不满足条件的行,直到找到下一行或到达末尾,
     * next()直接返回hasNext()找到的行。
     */
    private static class FilteredIterator<K> implements Iterator<KeyedRow<K>> {

        private final Iterator<KeyedRow<K>> source;

        private final Schema schema;

        private final Filter<K> filter;

        /** hasNext()找到的满足条件的行 */
        private KeyedRow<K> nextRow;

        FilteredIterator(Iterator<KeyedRow<K>> source, Schema schema, Filter<K> filter) {
            this.source = source;
            this.schema = schema;
            this.filter = filter;
        }

        @Override
        public boolean hasNext() {
            if (nextRow != null) {
                return true;
            }

            while (source.hasNext()) {
                KeyedRow<K> candidate = source.next();
                if (filter.matches(schema, candidate.getRow())) {
                    nextRow = candidate;
                    return true;
                }
            }

            return false;
        }

        @Override
        public KeyedRow<K> next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more rows matching WHERE condition");
            }

            KeyedRow<K> result = nextRow;
            nextRow = null;
            return result;
        }
    }
}
