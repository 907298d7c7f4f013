package com.minisql.executor;

import com.minisql.data.Column;
import com.minisql.data.DataType;
import com.minisql.data.Row;
import com.minisql.data.RowException;
import com.minisql.data.Schema;
import com.minisql.data.TableNameException;
import com.minisql.parser.ObjectName;
import com.minisql.parser.SQLParser;
import com.minisql.parser.statements.DropStatement;
import com.minisql.result.Payload;
import com.minisql.storage.KeyedRow;
import com.minisql.storage.RecordingStorageEngine;
import com.minisql.storage.StorageException;
import com.minisql.storage.memory.MemoryKey;
import com.minisql.storage.memory.MemoryStorageEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutorTest - 语句执行器测试
 *
 * 使用内存引擎 + 调用记录装饰器,既验证结果,也验证执行器对存储引擎的调用。
 */
@DisplayName("语句执行器测试")
class ExecutorTest {

    private final SQLParser parser = new SQLParser();

    private MemoryStorageEngine memory;

    private RecordingStorageEngine<MemoryKey> storage;

    private Executor<MemoryKey> executor;

    @BeforeEach
    void setUp() {
        memory = new MemoryStorageEngine();
        storage = new RecordingStorageEngine<>(memory);
        executor = new Executor<>(storage);
    }

    private Payload execute(String sql) {
        return executor.execute(parser.parse(sql));
    }

    /**
     * 表中所有行(Key → Row,插入顺序)
     */
    private Map<MemoryKey, Row> snapshot(String tableName) {
        Map<MemoryKey, Row> rows = new LinkedHashMap<>();
        Iterator<KeyedRow<MemoryKey>> iterator = memory.scanData(tableName);
        while (iterator.hasNext()) {
            KeyedRow<MemoryKey> item = iterator.next();
            rows.put(item.getKey(), item.getRow());
        }
        return rows;
    }

    /**
     * users(id INT, name TEXT, age INT): (1, Alice, 25), (2, Bob, 30), (3, Carol, NULL), (4, Dave, 17)
     */
    private void createUsers() {
        execute("CREATE TABLE users (id INT NOT NULL, name TEXT, age INT)");
        execute("INSERT INTO users VALUES (1, 'Alice', 25)");
        execute("INSERT INTO users VALUES (2, 'Bob', 30)");
        execute("INSERT INTO users (id, name) VALUES (3, 'Carol')");
        execute("INSERT INTO users VALUES (4, 'Dave', 17)");
        storage.clearCalls();
    }

    // ==================== CREATE TABLE ====================

    @Test
    @DisplayName("CREATE TABLE保存的列定义与声明完全一致")
    void testCreateTable() {
        Payload payload = execute("CREATE TABLE t (id INT, name TEXT, score BIGINT NOT NULL, tag VARCHAR(8))");

        assertEquals(Payload.create(), payload);
        assertEquals(List.of("setSchema(t)"), storage.getCalls());

        Schema schema = memory.getSchema("t");
        assertEquals("t", schema.getTableName());
        assertEquals(List.of(
                new Column("id", DataType.INT, true),
                new Column("name", DataType.TEXT, true),
                new Column("score", DataType.BIGINT, false),
                new Column("tag", DataType.VARCHAR, 8, true)
        ), schema.getColumnDefs());
    }

    @Test
    @DisplayName("带库名前缀的表名取最后一段")
    void testCreateTableQualifiedName() {
        execute("CREATE TABLE mydb.t (id INT)");

        assertTrue(memory.tableExists("t"));
    }

    @Test
    @DisplayName("重复建表的失败由存储引擎决定,原样传播")
    void testCreateDuplicateTable() {
        execute("CREATE TABLE t (id INT)");

        assertThrows(StorageException.class, () -> execute("CREATE TABLE t (id INT)"));
    }

    // ==================== INSERT ====================

    @Test
    @DisplayName("INSERT返回实际保存的行")
    void testInsert() {
        execute("CREATE TABLE t (id BIGINT, name TEXT, rate DOUBLE)");
        storage.clearCalls();

        Payload payload = execute("INSERT INTO t VALUES (1, 'a', 2)");

        assertEquals(Payload.Type.INSERT, payload.getType());
        // 值已按列类型转换
        assertEquals(Row.of(1L, "a", 2.0), payload.getInsertedRow());
        assertEquals(List.of("getSchema(t)", "generateId(t)", "setData(t#0)"), storage.getCalls());
    }

    @Test
    @DisplayName("两次INSERT得到不同的Key,每行都能按Key取回")
    void testInsertKeysAreDistinct() {
        execute("CREATE TABLE t (id INT, name TEXT)");
        execute("INSERT INTO t VALUES (1, 'a')");
        execute("INSERT INTO t VALUES (1, 'a')");

        Map<MemoryKey, Row> rows = snapshot("t");
        assertEquals(2, rows.size());

        List<MemoryKey> keys = new ArrayList<>(rows.keySet());
        assertNotEquals(keys.get(0), keys.get(1));
        for (MemoryKey key : keys) {
            assertEquals(Row.of(1, "a"), memory.getData(key).orElseThrow());
        }
    }

    @Test
    @DisplayName("INSERT引用不存在的列")
    void testInsertUnknownColumn() {
        execute("CREATE TABLE t (id INT, name TEXT)");

        assertThrows(RowException.class, () -> execute("INSERT INTO t (id, email) VALUES (1, 'x')"));
        assertThrows(RowException.class, () -> execute("INSERT INTO t VALUES (1)"));
        assertTrue(snapshot("t").isEmpty());
    }

    @Test
    @DisplayName("INSERT到不存在的表")
    void testInsertUnknownTable() {
        assertThrows(StorageException.class, () -> execute("INSERT INTO missing VALUES (1)"));
    }

    @Test
    @DisplayName("VALUES中可以使用常量表达式,不能引用列")
    void testInsertExpressions() {
        execute("CREATE TABLE t (id INT, name TEXT)");

        assertEquals(Row.of(7, "a"), execute("INSERT INTO t VALUES (1 + 2 * 3, 'a')").getInsertedRow());
        assertThrows(EvaluationException.class, () -> execute("INSERT INTO t VALUES (id, 'a')"));
    }

    // ==================== SELECT ====================

    @Test
    @DisplayName("CREATE → INSERT → SELECT WHERE id = 1")
    void testSelectScenario() {
        execute("CREATE TABLE t (id INT, name TEXT)");
        execute("INSERT INTO t VALUES (1, 'a')");

        Payload payload = execute("SELECT * FROM t WHERE id = 1");

        assertEquals(Payload.Type.SELECT, payload.getType());
        assertEquals(List.of(Row.of(1, "a")), payload.getRows());
        assertEquals(List.of("id", "name"), payload.getLabels());
    }

    @Test
    @DisplayName("SELECT结果保持扫描顺序")
    void testSelectOrder() {
        createUsers();

        Payload payload = execute("SELECT id FROM users WHERE age IS NULL OR age > 18");

        assertEquals(List.of(Row.of(1), Row.of(2), Row.of(3)), payload.getRows());
    }

    @Test
    @DisplayName("SELECT投影表达式和标签")
    void testSelectProjection() {
        createUsers();

        Payload payload = execute("SELECT name, age + 1 AS next_age, id * 2 FROM users WHERE id = 2");

        assertEquals(List.of("name", "next_age", "(id * 2)"), payload.getLabels());
        assertEquals(List.of(Row.of("Bob", 31, 4)), payload.getRows());
    }

    @Test
    @DisplayName("SELECT使用IN子查询和相关EXISTS子查询")
    void testSelectSubqueries() {
        createUsers();
        execute("CREATE TABLE orders (id INT, user_id INT)");
        execute("INSERT INTO orders VALUES (100, 2)");
        execute("INSERT INTO orders VALUES (101, 4)");

        Payload in = execute("SELECT name FROM users WHERE id IN (SELECT user_id FROM orders)");
        assertEquals(List.of(Row.of("Bob"), Row.of("Dave")), in.getRows());

        Payload notExists = execute(
                "SELECT name FROM users u WHERE NOT EXISTS (SELECT * FROM orders o WHERE o.user_id = u.id)");
        assertEquals(List.of(Row.of("Alice"), Row.of("Carol")), notExists.getRows());
    }

    @Test
    @DisplayName("SELECT谓词求值失败不会被当作空结果")
    void testSelectPredicateError() {
        createUsers();

        assertThrows(EvaluationException.class, () -> execute("SELECT * FROM users WHERE email = 'x'"));
        assertThrows(StorageException.class, () -> execute("SELECT * FROM missing"));
    }

    // ==================== UPDATE ====================

    @Test
    @DisplayName("UPDATE t SET name = 'b' WHERE id = 1")
    void testUpdateScenario() {
        execute("CREATE TABLE t (id INT, name TEXT)");
        execute("INSERT INTO t VALUES (1, 'a')");

        Payload payload = execute("UPDATE t SET name = 'b' WHERE id = 1");

        assertEquals(Payload.update(1), payload);
        assertEquals(List.of(Row.of(1, "b")), execute("SELECT * FROM t WHERE id = 1").getRows());
    }

    @Test
    @DisplayName("UPDATE只改写匹配行,Key不变,FALSE/UNKNOWN的行原样保留")
    void testUpdateMatchingRowsOnly() {
        createUsers();
        Map<MemoryKey, Row> before = snapshot("users");

        Payload payload = execute("UPDATE users SET age = age + 1 WHERE age > 18");

        assertEquals(2, payload.getAffectedRows());

        Map<MemoryKey, Row> after = snapshot("users");
        assertEquals(before.keySet(), after.keySet());

        List<MemoryKey> keys = new ArrayList<>(before.keySet());
        assertEquals(Row.of(1, "Alice", 26), after.get(keys.get(0)));
        assertEquals(Row.of(2, "Bob", 31), after.get(keys.get(1)));
        // age为NULL(UNKNOWN)和age = 17(FALSE)的行不变
        assertEquals(before.get(keys.get(2)), after.get(keys.get(2)));
        assertEquals(before.get(keys.get(3)), after.get(keys.get(3)));

        // 每个匹配行恰好写回一次
        assertEquals(2, storage.count("setData"));
        assertEquals(1, storage.count("scanData"));
    }

    @Test
    @DisplayName("没有WHERE的UPDATE改写所有行")
    void testUpdateAllRows() {
        createUsers();

        assertEquals(Payload.update(4), execute("UPDATE users SET name = 'x'"));
        for (Row row : snapshot("users").values()) {
            assertEquals("x", row.getValue(1));
        }
    }

    @Test
    @DisplayName("UPDATE的赋值都读取原始值")
    void testUpdateSwap() {
        execute("CREATE TABLE t (a INT, b INT)");
        execute("INSERT INTO t VALUES (1, 2)");

        execute("UPDATE t SET a = a + b, b = a * 10");

        assertEquals(List.of(Row.of(3, 10)), execute("SELECT * FROM t").getRows());
    }

    @Test
    @DisplayName("UPDATE目标列不存在时不扫描任何行")
    void testUpdateUnknownColumn() {
        createUsers();

        assertThrows(UpdateException.class, () -> execute("UPDATE users SET email = 'x'"));
        assertEquals(0, storage.count("scanData"));
        assertEquals(0, storage.count("setData"));
    }

    @Test
    @DisplayName("UPDATE中途失败不回滚已写入的行")
    void testUpdatePartialFailureIsNotRolledBack() {
        createUsers();
        storage.failOnSetData(2);

        assertThrows(StorageException.class, () -> execute("UPDATE users SET name = 'x'"));

        List<Row> rows = new ArrayList<>(snapshot("users").values());
        assertEquals("x", rows.get(0).getValue(1));
        assertEquals("Bob", rows.get(1).getValue(1));
        assertEquals("Carol", rows.get(2).getValue(1));
    }

    @Test
    @DisplayName("UPDATE谓词或赋值求值失败原样传播")
    void testUpdateEvaluationError() {
        createUsers();

        assertThrows(EvaluationException.class, () -> execute("UPDATE users SET age = 1 WHERE email = 'x'"));
        assertThrows(EvaluationException.class, () -> execute("UPDATE users SET age = name + 1"));
        assertThrows(RowException.class, () -> execute("UPDATE users SET id = NULL"));
    }

    // ==================== DELETE ====================

    @Test
    @DisplayName("DELETE返回删除行数,删除的Key不再可读,其他行不变")
    void testDelete() {
        createUsers();
        Map<MemoryKey, Row> before = snapshot("users");
        List<MemoryKey> keys = new ArrayList<>(before.keySet());

        Payload payload = execute("DELETE FROM users WHERE age < 26");

        assertEquals(Payload.delete(2), payload);
        assertTrue(memory.getData(keys.get(0)).isEmpty());
        assertTrue(memory.getData(keys.get(3)).isEmpty());
        assertEquals(before.get(keys.get(1)), memory.getData(keys.get(1)).orElseThrow());
        assertEquals(before.get(keys.get(2)), memory.getData(keys.get(2)).orElseThrow());
        assertEquals(2, storage.count("deleteData"));
    }

    @Test
    @DisplayName("没有WHERE的DELETE删除所有行,表仍然存在")
    void testDeleteAll() {
        createUsers();

        assertEquals(Payload.delete(4), execute("DELETE FROM users"));
        assertTrue(snapshot("users").isEmpty());
        assertEquals(Payload.delete(0), execute("DELETE FROM users"));
    }

    @Test
    @DisplayName("DELETE谓词求值失败时不删除任何行")
    void testDeleteEvaluationError() {
        createUsers();

        assertThrows(EvaluationException.class, () -> execute("DELETE FROM users WHERE name > 1"));
        assertEquals(4, snapshot("users").size());
    }

    // ==================== DROP ====================

    @Test
    @DisplayName("DROP TABLE删除多个表")
    void testDropTables() {
        execute("CREATE TABLE a (id INT)");
        execute("CREATE TABLE b (id INT)");
        storage.clearCalls();

        assertEquals(Payload.dropTable(), execute("DROP TABLE a, mydb.b"));
        assertEquals(List.of("deleteSchema(a)", "deleteSchema(b)"), storage.getCalls());
        assertTrue(memory.getTableNames().isEmpty());
    }

    @Test
    @DisplayName("DROP VIEW v1: 不支持的对象类型,不触碰存储引擎")
    void testDropView() {
        execute("CREATE TABLE v1 (id INT)");
        storage.clearCalls();

        ExecuteException e = assertThrows(ExecuteException.class, () -> execute("DROP VIEW v1"));

        assertEquals(ExecuteException.Kind.DROP_TYPE_NOT_SUPPORTED, e.getKind());
        assertTrue(storage.getCalls().isEmpty());
        assertTrue(memory.tableExists("v1"));
    }

    @Test
    @DisplayName("对象类型只检查一次,多个名字的DROP INDEX也不会删除任何表")
    void testDropKindCheckedOnceBeforeAnyName() {
        execute("CREATE TABLE a (id INT)");
        execute("CREATE TABLE b (id INT)");
        storage.clearCalls();

        ExecuteException e = assertThrows(ExecuteException.class, () -> execute("DROP INDEX a, b"));

        assertEquals(ExecuteException.Kind.DROP_TYPE_NOT_SUPPORTED, e.getKind());
        assertTrue(storage.getCalls().isEmpty());
        assertEquals(List.of("a", "b"), memory.getTableNames());
    }

    @Test
    @DisplayName("DROP不存在的表: 之前的表已删除,不回滚")
    void testDropPartialFailure() {
        execute("CREATE TABLE a (id INT)");

        assertThrows(StorageException.class, () -> execute("DROP TABLE a, missing"));
        assertFalse(memory.tableExists("a"));
    }

    @Test
    @DisplayName("表名无法解析时失败且不触碰存储引擎")
    void testMalformedTableName() {
        DropStatement drop = new DropStatement(DropStatement.ObjectType.TABLE, List.of(new ObjectName(List.of())));

        assertThrows(TableNameException.class, () -> executor.execute(drop));
        assertTrue(storage.getCalls().isEmpty());
    }

    // ==================== 不支持的语句 ====================

    @Test
    @DisplayName("事务控制语句不支持执行,不触碰存储引擎")
    void testUnsupportedStatement() {
        for (String sql : List.of("BEGIN", "START TRANSACTION", "COMMIT", "ROLLBACK")) {
            ExecuteException e = assertThrows(ExecuteException.class, () -> execute(sql));
            assertEquals(ExecuteException.Kind.QUERY_NOT_SUPPORTED, e.getKind());
        }

        assertTrue(storage.getCalls().isEmpty());
    }

    @Test
    @DisplayName("协作者的异常原样传播(同一个实例)")
    void testCollaboratorExceptionIsNotWrapped() {
        createUsers();
        storage.failOnSetData(1);

        StorageException e = assertThrows(StorageException.class, () -> execute("INSERT INTO users VALUES (5, 'Eve', 40)"));

        assertEquals("Injected failure on write #1", e.getMessage());
        assertNull(e.getCause());
    }
}
