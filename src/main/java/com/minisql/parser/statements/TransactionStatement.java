package com.minisql.parser.statements;

import com.minisql.parser.Statement;

/**
 * TransactionStatement - 事务控制语句(BEGIN / START TRANSACTION / COMMIT / ROLLBACK)
 *
 * 只在语法层面识别,执行器没有对应的执行路径。
 */
public class TransactionStatement implements Statement {

    private final Kind kind;

    public TransactionStatement(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public StatementType getType() {
        return StatementType.TRANSACTION;
    }

    @Override
    public String toString() {
        return "TransactionStatement{" + kind + '}';
    }

    public enum Kind {
        BEGIN,
        COMMIT,
        ROLLBACK
    }
}
