package com.minisql.parser.statements;

import com.minisql.parser.ObjectName;
import com.minisql.parser.Statement;

import java.util.List;

/**
 * DropStatement - DROP语句
 *
 * 语法示例:
 * <pre>
 * DROP TABLE users;
 * DROP TABLE a, b;
 * DROP VIEW v1;
 * </pre>
 *
 * 一条语句只有一种对象类型,可以有多个名字。
 * 解析器接受所有对象类型,执行器只执行TABLE。
 */
public class DropStatement implements Statement {

    /** 对象类型 */
    private final ObjectType objectType;

    /** 要删除的对象名 */
    private final List<ObjectName> names;

    public DropStatement(ObjectType objectType, List<ObjectName> names) {
        this.objectType = objectType;
        this.names = List.copyOf(names);
    }

    public ObjectType getObjectType() {
        return objectType;
    }

    public List<ObjectName> getNames() {
        return names;
    }

    @Override
    public StatementType getType() {
        return StatementType.DROP;
    }

    @Override
    public String toString() {
        return "DropStatement{" +
                "objectType=" + objectType +
                ", names=" + names +
                '}';
    }

    /**
     * DROP的对象类型
     */
    public enum ObjectType {
        TABLE,
        VIEW,
        INDEX,
        SCHEMA
    }
}
