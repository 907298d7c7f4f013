package com.minisql.executor;

import com.minisql.data.Column;
import com.minisql.data.Row;
import com.minisql.data.Schema;
import com.minisql.data.TableNames;
import com.minisql.parser.Expression;
import com.minisql.parser.ObjectName;
import com.minisql.parser.Statement;
import com.minisql.parser.statements.CreateTableStatement;
import com.minisql.parser.statements.DeleteStatement;
import com.minisql.parser.statements.DropStatement;
import com.minisql.parser.statements.InsertStatement;
import com.minisql.parser.statements.SelectStatement;
import com.minisql.parser.statements.UpdateStatement;
import com.minisql.result.Payload;
import com.minisql.storage.KeyedRow;
import com.minisql.storage.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Executor - 语句执行器
 *
 * 执行一条已解析的语句,返回一个Payload。执行器只面向StorageEngine接口,
 * 不关心存储引擎的实现,也从不构造或解析Key。
 *
 * 执行路径:
 * <pre>
 * CREATE TABLE  → storage.setSchema()                              → CREATE
 * SELECT        → Select管道,结果全部收集                           → SELECT(rows)
 * INSERT        → getSchema() → generateId() → Row.create() → setData() → INSERT(row)
 * UPDATE        → Fetch(Filter) → Update.apply() → setData(原Key)   → UPDATE(n)
 * DELETE        → Fetch(Filter) → deleteData()                      → DELETE(n)
 * DROP TABLE    → 对每个名字 deleteSchema()                          → DROP_TABLE
 * 其他          → ExecuteException(QUERY_NOT_SUPPORTED)
 * </pre>
 *
 * 错误处理:
 * - 执行器自身只抛ExecuteException(语句类型不支持、DROP对象不是TABLE)
 * - 存储、求值、行构造的异常原样传播,不捕获、不包装
 * - 不包裹事务: UPDATE/DELETE/DROP中途失败时,已经完成的写入和删除不会回滚
 *
 * 迭代期间修改:
 * UPDATE/DELETE对每个匹配的行立即写回或删除,此时scanData()的迭代器仍在使用。
 * 迭代稳定性由StorageEngine契约保证,执行器不做快照。
 *
 * 使用示例:
 * <pre>
 * Executor&lt;K&gt; executor = new Executor&lt;&gt;(storage);
 * Payload payload = executor.execute(parser.parse("SELECT * FROM users WHERE id = 1"));
 * </pre>
 *
 * @param <K> 存储引擎的Key类型
 */
public class Executor<K> {

    private static final Logger logger = LoggerFactory.getLogger(Executor.class);

    /** 存储引擎 */
    private final StorageEngine<K> storage;

    public Executor(StorageEngine<K> storage) {
        if (storage == null) {
            throw new IllegalArgumentException("StorageEngine cannot be null");
        }
        this.storage = storage;
    }

    /**
     * 执行一条语句
     *
     * @param statement 已解析的语句
     * @return 执行结果
     * @throws ExecuteException 语句类型不支持,或DROP的对象不是TABLE
     */
    public Payload execute(Statement statement) {
        if (statement == null) {
            throw new IllegalArgumentException("Statement cannot be null");
        }

        logger.debug("执行语句: {}", statement.getType());

        switch (statement.getType()) {
            case CREATE_TABLE:
                return createTable((CreateTableStatement) statement);

            case SELECT:
                return select((SelectStatement) statement);

            case INSERT:
                return insert((InsertStatement) statement);

            case UPDATE:
                return update((UpdateStatement) statement);

            case DELETE:
                return delete((DeleteStatement) statement);

            case DROP:
                return drop((DropStatement) statement);

            default:
                throw new ExecuteException(ExecuteException.Kind.QUERY_NOT_SUPPORTED,
                        "Query not supported: " + statement.getType());
        }
    }

    private Payload createTable(CreateTableStatement statement) {
        String tableName = TableNames.resolve(statement.getTableName());
        storage.setSchema(new Schema(tableName, statement.getColumns()));

        return Payload.create();
    }

    private Payload select(SelectStatement statement) {
        Select<K> select = new Select<>(storage, statement, null);

        List<Row> rows = new ArrayList<>();
        Iterator<Row> iterator = select.rows();
        while (iterator.hasNext()) {
            rows.add(iterator.next());
        }

        logger.debug("SELECT返回 {} 行", rows.size());
        return Payload.select(select.getLabels(), rows);
    }

    private Payload insert(InsertStatement statement) {
        String tableName = TableNames.resolve(statement.getTableName());
        List<Column> columns = storage.getSchema(tableName).getColumnDefs();
        K key = storage.generateId(tableName);

        // VALUES中的表达式不能引用列
        Evaluator<K> evaluator = new Evaluator<>(storage);
        List<Object> values = new ArrayList<>(statement.getValues().size());
        for (Expression value : statement.getValues()) {
            values.add(evaluator.eval(value, null));
        }

        Row row = Row.create(columns, statement.getColumnNames(), values);

        return Payload.insert(storage.setData(key, row));
    }

    private Payload update(UpdateStatement statement) {
        String tableName = TableNames.resolve(statement.getTableName());
        Schema schema = Fetch.fetchSchema(storage, tableName);

        Update<K> update = new Update<>(storage, schema.getTableName(), statement.getAssignments(), schema.getColumnDefs());
        Filter<K> filter = new Filter<>(storage, statement.getWhereClause().orElse(null), null);

        int count = 0;
        Iterator<KeyedRow<K>> rows = Fetch.fetch(storage, schema, filter);
        while (rows.hasNext()) {
            KeyedRow<K> item = rows.next();
            storage.setData(item.getKey(), update.apply(item.getRow()));
            count++;
        }

        logger.debug("UPDATE {}: {} 行", tableName, count);
        return Payload.update(count);
    }

    private Payload delete(DeleteStatement statement) {
        String tableName = TableNames.resolve(statement.getTableName());
        Schema schema = Fetch.fetchSchema(storage, tableName);

        Filter<K> filter = new Filter<>(storage, statement.getWhereClause().orElse(null), null);

        int count = 0;
        Iterator<KeyedRow<K>> rows = Fetch.fetch(storage, schema, filter);
        while (rows.hasNext()) {
            storage.deleteData(rows.next().getKey());
            count++;
        }

        logger.debug("DELETE {}: {} 行", tableName, count);
        return Payload.delete(count);
    }

    private Payload drop(DropStatement statement) {
        // 对象类型一条语句只有一种,在动任何表之前检查一次
        if (statement.getObjectType() != DropStatement.ObjectType.TABLE) {
            throw new ExecuteException(ExecuteException.Kind.DROP_TYPE_NOT_SUPPORTED,
                    "Drop type not supported: " + statement.getObjectType());
        }

        for (ObjectName name : statement.getNames()) {
            storage.deleteSchema(TableNames.resolve(name));
        }

        return Payload.dropTable();
    }
}
