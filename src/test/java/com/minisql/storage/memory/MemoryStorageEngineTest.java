package com.minisql.storage.memory;

import com.minisql.data.Column;
import com.minisql.data.DataType;
import com.minisql.data.Row;
import com.minisql.data.Schema;
import com.minisql.storage.KeyedRow;
import com.minisql.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MemoryStorageEngineTest - 内存存储引擎测试
 *
 * 重点覆盖迭代期间修改的契约: 扫描过程中改写、删除行不会跳过或重复返回其他行。
 */
@DisplayName("Memory 存储引擎测试")
class MemoryStorageEngineTest {

    private MemoryStorageEngine engine;

    private Schema users;

    @BeforeEach
    void setUp() {
        engine = new MemoryStorageEngine();
        users = new Schema("users", Arrays.asList(
                new Column("id", DataType.INT, false),
                new Column("name", DataType.TEXT, true)
        ));
        engine.setSchema(users);
    }

    private MemoryKey insert(int id, String name) {
        MemoryKey key = engine.generateId("users");
        engine.setData(key, Row.of(id, name));
        return key;
    }

    private List<KeyedRow<MemoryKey>> drain(Iterator<KeyedRow<MemoryKey>> iterator) {
        List<KeyedRow<MemoryKey>> result = new ArrayList<>();
        while (iterator.hasNext()) {
            result.add(iterator.next());
        }
        return result;
    }

    @Test
    @DisplayName("表结构读写")
    void testSchema() {
        assertEquals(users, engine.getSchema("users"));
        assertEquals(users, engine.getSchema("USERS"));
        assertTrue(engine.tableExists("Users"));
        assertEquals(List.of("users"), engine.getTableNames());
    }

    @Test
    @DisplayName("重复建表、访问不存在的表都失败")
    void testUnknownAndDuplicateTables() {
        assertThrows(StorageException.class, () -> engine.setSchema(users));
        assertThrows(StorageException.class, () -> engine.getSchema("orders"));
        assertThrows(StorageException.class, () -> engine.deleteSchema("orders"));
        assertThrows(StorageException.class, () -> engine.generateId("orders"));
        assertThrows(StorageException.class, () -> engine.scanData("orders"));
    }

    @Test
    @DisplayName("同一张表生成的Key互不相同,删除后也不复用")
    void testKeysAreUnique() {
        MemoryKey first = insert(1, "a");
        engine.deleteData(first);
        MemoryKey second = engine.generateId("users");
        MemoryKey third = engine.generateId("users");

        assertNotEquals(first, second);
        assertNotEquals(second, third);
        assertNotEquals(first, third);
    }

    @Test
    @DisplayName("按Key读写和删除")
    void testDataByKey() {
        MemoryKey key = insert(1, "a");

        assertEquals(Row.of(1, "a"), engine.getData(key).orElseThrow());

        engine.setData(key, Row.of(1, "b"));
        assertEquals(Row.of(1, "b"), engine.getData(key).orElseThrow());

        engine.deleteData(key);
        assertTrue(engine.getData(key).isEmpty());
    }

    @Test
    @DisplayName("写入列数不匹配的行失败")
    void testSetDataArityMismatch() {
        MemoryKey key = engine.generateId("users");

        assertThrows(StorageException.class, () -> engine.setData(key, Row.of(1)));
    }

    @Test
    @DisplayName("删除表同时删除所有行")
    void testDeleteSchemaDropsRows() {
        MemoryKey key = insert(1, "a");

        engine.deleteSchema("users");

        assertFalse(engine.tableExists("users"));
        assertTrue(engine.getData(key).isEmpty());
        assertThrows(StorageException.class, () -> engine.getSchema("users"));
    }

    @Test
    @DisplayName("扫描按插入顺序返回所有行")
    void testScanOrder() {
        insert(1, "a");
        insert(2, "b");
        insert(3, "c");

        List<KeyedRow<MemoryKey>> rows = drain(engine.scanData("users"));

        assertEquals(3, rows.size());
        assertEquals(Row.of(1, "a"), rows.get(0).getRow());
        assertEquals(Row.of(2, "b"), rows.get(1).getRow());
        assertEquals(Row.of(3, "c"), rows.get(2).getRow());
    }

    @Test
    @DisplayName("扫描期间改写当前行,每行只返回一次")
    void testRewriteDuringScan() {
        insert(1, "a");
        insert(2, "b");
        insert(3, "c");

        Iterator<KeyedRow<MemoryKey>> iterator = engine.scanData("users");
        int seen = 0;
        while (iterator.hasNext()) {
            KeyedRow<MemoryKey> item = iterator.next();
            engine.setData(item.getKey(), item.getRow().with(1, "x"));
            seen++;
        }

        assertEquals(3, seen);
        for (KeyedRow<MemoryKey> item : drain(engine.scanData("users"))) {
            assertEquals("x", item.getRow().getValue(1));
        }
    }

    @Test
    @DisplayName("扫描期间删除当前行和后面的行")
    void testDeleteDuringScan() {
        insert(1, "a");
        MemoryKey second = insert(2, "b");
        insert(3, "c");

        Iterator<KeyedRow<MemoryKey>> iterator = engine.scanData("users");
        KeyedRow<MemoryKey> first = iterator.next();
        engine.deleteData(first.getKey());
        engine.deleteData(second);

        List<KeyedRow<MemoryKey>> rest = drain(iterator);

        assertEquals(1, rest.size());
        assertEquals(Row.of(3, "c"), rest.get(0).getRow());
    }

    @Test
    @DisplayName("扫描开始后插入的行不会被返回")
    void testInsertDuringScanNotVisible() {
        insert(1, "a");

        Iterator<KeyedRow<MemoryKey>> iterator = engine.scanData("users");
        iterator.next();
        insert(2, "b");

        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    @DisplayName("扫描期间删除表")
    void testDropDuringScan() {
        insert(1, "a");
        insert(2, "b");

        Iterator<KeyedRow<MemoryKey>> iterator = engine.scanData("users");
        iterator.next();
        engine.deleteSchema("users");

        assertThrows(StorageException.class, iterator::hasNext);
    }

    @Test
    @DisplayName("删除后重建同名表,旧Key不能读写新表")
    void testStaleKeyAfterRecreate() {
        MemoryKey stale = insert(1, "a");

        engine.deleteSchema("users");
        engine.setSchema(users);
        MemoryKey fresh = insert(2, "b");

        assertEquals(stale.getId(), fresh.getId());
        assertNotEquals(stale, fresh);

        assertTrue(engine.getData(stale).isEmpty());
        assertThrows(StorageException.class, () -> engine.setData(stale, Row.of(9, "x")));
        assertThrows(StorageException.class, () -> engine.deleteData(stale));
        assertEquals(Row.of(2, "b"), engine.getData(fresh).orElseThrow());
    }

    @Test
    @DisplayName("扫描期间删除并重建同名表,旧迭代器失效")
    void testRecreateDuringScan() {
        insert(1, "a");
        insert(2, "b");

        Iterator<KeyedRow<MemoryKey>> iterator = engine.scanData("users");
        iterator.next();
        engine.deleteSchema("users");
        engine.setSchema(users);
        insert(3, "c");
        insert(4, "d");

        assertThrows(StorageException.class, iterator::hasNext);
    }
}
