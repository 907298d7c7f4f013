package com.minisql.parser;

/**
 * Statement - SQL语句接口
 *
 * 所有SQL语句的基类,代表一个完整的、可执行的SQL命令。
 *
 * 设计原则:
 * - "Good taste": Executor按getType()分发,语句种类是一个封闭集合
 * - 类型安全: 每种SQL有专门的子类
 * - 解析得出的语句不一定都能执行,执行器对没有执行路径的类型直接拒绝
 *
 * 使用示例:
 * <pre>
 * Statement stmt = parser.parse("CREATE TABLE users (id INT, name TEXT)");
 * if (stmt.getType() == StatementType.CREATE_TABLE) {
 *     CreateTableStatement create = (CreateTableStatement) stmt;
 *     ...
 * }
 * </pre>
 */
public interface Statement {

    /**
     * 获取语句类型
     *
     * @return 语句类型枚举
     */
    StatementType getType();

    /**
     * SQL语句类型枚举
     */
    enum StatementType {
        /** CREATE TABLE - 创建表 */
        CREATE_TABLE,
        /** DROP - 删除对象(只有TABLE可执行) */
        DROP,
        /** SELECT - 查询 */
        SELECT,
        /** INSERT - 插入 */
        INSERT,
        /** UPDATE - 更新 */
        UPDATE,
        /** DELETE - 删除 */
        DELETE,
        /** BEGIN/COMMIT/ROLLBACK - 事务控制(不支持执行) */
        TRANSACTION
    }
}
