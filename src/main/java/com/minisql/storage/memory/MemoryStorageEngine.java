package com.minisql.storage.memory;

import com.minisql.data.Row;
import com.minisql.data.Schema;
import com.minisql.storage.KeyedRow;
import com.minisql.storage.StorageEngine;
import com.minisql.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.TreeMap;

/**
 * MemoryStorageEngine - 内存存储引擎
 *
 * 所有表结构和行数据都保存在内存中,进程退出即丢失。
 *
 * 数据布局:
 * <pre>
 * tables: 表名(小写) → TableData
 *   TableData.schema  表结构
 *   TableData.rows    序号 → Row (TreeMap,按插入顺序)
 *   TableData.nextId  下一个序号
 * </pre>
 *
 * 行为约定:
 * - 表名大小写不敏感
 * - setSchema()拒绝已存在的表
 * - deleteSchema()同时删除该表所有行,表不存在时失败
 * - Key序号只增不减,删除行后也不复用
 * - 每次建表分配新的代号,删表后重建同名表,旧Key和旧迭代器都会失效
 *
 * 迭代期间修改:
 * scanData()先快照Key列表,每次next()时再按Key读取当前行,
 * 迭代期间被删除的行直接跳过,被改写的行返回改写后的值,且每个Key最多返回一次。
 *
 * 线程安全: 所有公开方法都是synchronized,迭代器每次读取也在锁内完成。
 */
public class MemoryStorageEngine implements StorageEngine<MemoryKey> {

    private static final Logger logger = LoggerFactory.getLogger(MemoryStorageEngine.class);

    /** 表名(小写) → 表数据 */
    private final Map<String, TableData> tables = new LinkedHashMap<>();

    /** 下一个建表代号 */
    private long nextGeneration = 0;

    @Override
    public synchronized void setSchema(Schema schema) {
        String name = normalize(schema.getTableName());
        if (tables.containsKey(name)) {
            throw new StorageException("Table already exists: " + schema.getTableName());
        }

        tables.put(name, new TableData(schema, nextGeneration++));
        logger.info("创建表: {} ({} 列)", schema.getTableName(), schema.getColumnDefs().size());
    }

    @Override
    public synchronized Schema getSchema(String tableName) {
        return requireTable(tableName).schema;
    }

    @Override
    public synchronized void deleteSchema(String tableName) {
        TableData removed = tables.remove(normalize(tableName));
        if (removed == null) {
            throw new StorageException("Table not found: " + tableName);
        }

        logger.info("删除表: {} (丢弃 {} 行)", tableName, removed.rows.size());
    }

    @Override
    public synchronized MemoryKey generateId(String tableName) {
        TableData table = requireTable(tableName);
        return new MemoryKey(normalize(tableName), table.generation, table.nextId++);
    }

    @Override
    public synchronized Row setData(MemoryKey key, Row row) {
        TableData table = requireTable(key);

        int columnCount = table.schema.getColumnDefs().size();
        if (row.size() != columnCount) {
            throw new StorageException(
                    "Row has " + row.size() + " values, table " + table.schema.getTableName() +
                            " has " + columnCount + " columns");
        }
        if (key.getId() >= table.nextId) {
            throw new StorageException("Key was not generated by this table: " + key);
        }

        table.rows.put(key.getId(), row);
        logger.trace("写入 {} -> {}", key, row);
        return row;
    }

    @Override
    public synchronized void deleteData(MemoryKey key) {
        TableData table = requireTable(key);
        table.rows.remove(key.getId());
        logger.trace("删除 {}", key);
    }

    @Override
    public synchronized Optional<Row> getData(MemoryKey key) {
        TableData table = tables.get(key.getTableName());
        if (table == null || table.generation != key.getGeneration()) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.rows.get(key.getId()));
    }

    @Override
    public synchronized Iterator<KeyedRow<MemoryKey>> scanData(String tableName) {
        TableData table = requireTable(tableName);
        return new SnapshotIterator(normalize(tableName), table, new ArrayList<>(table.rows.keySet()));
    }

    /**
     * 获取所有表名(创建顺序)
     */
    public synchronized List<String> getTableNames() {
        List<String> names = new ArrayList<>();
        for (TableData table : tables.values()) {
            names.add(table.schema.getTableName());
        }
        return names;
    }

    /**
     * 表是否存在
     */
    public synchronized boolean tableExists(String tableName) {
        return tables.containsKey(normalize(tableName));
    }

    private TableData requireTable(String tableName) {
        TableData table = tables.get(normalize(tableName));
        if (table == null) {
            throw new StorageException("Table not found: " + tableName);
        }
        return table;
    }

    /**
     * 按Key找到所属的表,表已删除(包括删除后重建)时失败
     */
    private TableData requireTable(MemoryKey key) {
        TableData table = requireTable(key.getTableName());
        if (table.generation != key.getGeneration()) {
            throw new StorageException("Key belongs to a dropped table: " + key);
        }
        return table;
    }

    private static String normalize(String tableName) {
        if (tableName == null) {
            throw new StorageException("Table name cannot be null");
        }
        return tableName.toLowerCase(Locale.ROOT);
    }

    /**
     * 单表数据
     */
    private static class TableData {
        final Schema schema;
        final long generation;
        final TreeMap<Long, Row> rows = new TreeMap<>();
        long nextId = 0;

        TableData(Schema schema, long generation) {
            this.schema = schema;
            this.generation = generation;
        }
    }

    /**
     * 快照迭代器
     *
     * 创建时拷贝Key列表,之后按Key逐个读取当前值,读取时行已不存在则跳过。
     */
    private class SnapshotIterator implements Iterator<KeyedRow<MemoryKey>> {

        private final String tableName;

        /** 创建迭代器时的表,表被删除或重建后不再是tables中的那一个 */
        private final TableData table;

        private final List<Long> ids;

        private int position = 0;

        /** hasNext()找到的下一行 */
        private KeyedRow<MemoryKey> nextRow;

        SnapshotIterator(String tableName, TableData table, List<Long> ids) {
            this.tableName = tableName;
            this.table = table;
            this.ids = ids;
        }

        @Override
        public boolean hasNext() {
            if (nextRow != null) {
                return true;
            }
            if (position >= ids.size()) {
                return false;
            }

            synchronized (MemoryStorageEngine.this) {
                if (tables.get(tableName) != table) {
                    throw new StorageException("Table dropped during scan: " + tableName);
                }

                while (position < ids.size()) {
                    long id = ids.get(position++);
                    Row row = table.rows.get(id);
                    if (row != null) {
                        nextRow = new KeyedRow<>(new MemoryKey(tableName, table.generation, id), row);
                        return true;
                    }
                }
            }

            return false;
        }

        @Override
        public KeyedRow<MemoryKey> next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more rows in table " + tableName);
            }

            KeyedRow<MemoryKey> result = nextRow;
            nextRow = null;
            return result;
        }
    }
}
