package com.minisql.result;

import com.minisql.data.Row;

import java.util.List;
import java.util.Objects;

/**
 * Payload - 单条语句的执行结果
 *
 * 每次成功执行恰好产生一个Payload,类型由语句决定:
 * <pre>
 * CREATE      CREATE TABLE成功
 * INSERT      插入的行(存储引擎实际保存的值)
 * SELECT      结果列标签 + 全部结果行(按产生顺序)
 * DELETE      删除的行数
 * UPDATE      更新的行数
 * DROP_TABLE  DROP TABLE成功
 * </pre>
 *
 * 设计原则:
 * - 不可变对象,值语义
 * - 只能通过静态工厂创建,保证每种类型只携带自己的数据
 * - 访问不属于当前类型的数据直接抛IllegalStateException
 */
public final class Payload {

    /**
     * 结果类型
     */
    public enum Type {
        CREATE,
        INSERT,
        SELECT,
        DELETE,
        UPDATE,
        DROP_TABLE
    }

    private static final Payload CREATE = new Payload(Type.CREATE, null, List.of(), List.of(), 0);

    private static final Payload DROP_TABLE = new Payload(Type.DROP_TABLE, null, List.of(), List.of(), 0);

    private final Type type;

    /** INSERT: 插入的行 */
    private final Row insertedRow;

    /** SELECT: 结果列标签 */
    private final List<String> labels;

    /** SELECT: 结果行 */
    private final List<Row> rows;

    /** DELETE/UPDATE: 影响行数 */
    private final int affectedRows;

    private Payload(Type type, Row insertedRow, List<String> labels, List<Row> rows, int affectedRows) {
        this.type = type;
        this.insertedRow = insertedRow;
        this.labels = labels;
        this.rows = rows;
        this.affectedRows = affectedRows;
    }

    public static Payload create() {
        return CREATE;
    }

    public static Payload insert(Row row) {
        if (row == null) {
            throw new IllegalArgumentException("Inserted row cannot be null");
        }
        return new Payload(Type.INSERT, row, List.of(), List.of(), 0);
    }

    public static Payload select(List<String> labels, List<Row> rows) {
        if (labels == null || rows == null) {
            throw new IllegalArgumentException("Labels and rows cannot be null");
        }
        return new Payload(Type.SELECT, null, List.copyOf(labels), List.copyOf(rows), 0);
    }

    public static Payload delete(int count) {
        return new Payload(Type.DELETE, null, List.of(), List.of(), count);
    }

    public static Payload update(int count) {
        return new Payload(Type.UPDATE, null, List.of(), List.of(), count);
    }

    public static Payload dropTable() {
        return DROP_TABLE;
    }

    public Type getType() {
        return type;
    }

    /**
     * 获取插入的行
     *
     * @throws IllegalStateException 不是INSERT结果
     */
    public Row getInsertedRow() {
        requireType(Type.INSERT);
        return insertedRow;
    }

    /**
     * 获取SELECT结果行
     *
     * @throws IllegalStateException 不是SELECT结果
     */
    public List<Row> getRows() {
        requireType(Type.SELECT);
        return rows;
    }

    /**
     * 获取SELECT结果列标签
     *
     * @throws IllegalStateException 不是SELECT结果
     */
    public List<String> getLabels() {
        requireType(Type.SELECT);
        return labels;
    }

    /**
     * 获取DELETE/UPDATE影响的行数
     *
     * @throws IllegalStateException 不是DELETE或UPDATE结果
     */
    public int getAffectedRows() {
        if (type != Type.DELETE && type != Type.UPDATE) {
            throw new IllegalStateException("Payload " + type + " has no affected row count");
        }
        return affectedRows;
    }

    private void requireType(Type expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " payload, got " + type);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Payload payload = (Payload) obj;

        return affectedRows == payload.affectedRows
                && type == payload.type
                && Objects.equals(insertedRow, payload.insertedRow)
                && labels.equals(payload.labels)
                && rows.equals(payload.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, insertedRow, labels, rows, affectedRows);
    }

    @Override
    public String toString() {
        switch (type) {
            case INSERT:
                return "Payload{INSERT " + insertedRow + '}';
            case SELECT:
                return "Payload{SELECT " + labels + ", " + rows.size() + " rows}";
            case DELETE:
            case UPDATE:
                return "Payload{" + type + ' ' + affectedRows + '}';
            default:
                return "Payload{" + type + '}';
        }
    }
}
