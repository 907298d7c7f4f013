package com.minisql.parser;

import com.minisql.data.Column;
import com.minisql.data.DataType;
import com.minisql.parser.expressions.BinaryExpression;
import com.minisql.parser.expressions.BinaryOperator;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.parser.expressions.ExistsExpression;
import com.minisql.parser.expressions.InListExpression;
import com.minisql.parser.expressions.InSubqueryExpression;
import com.minisql.parser.expressions.IsNullExpression;
import com.minisql.parser.expressions.LiteralExpression;
import com.minisql.parser.expressions.NegateExpression;
import com.minisql.parser.expressions.NotExpression;
import com.minisql.parser.statements.Assignment;
import com.minisql.parser.statements.CreateTableStatement;
import com.minisql.parser.statements.DeleteStatement;
import com.minisql.parser.statements.DropStatement;
import com.minisql.parser.statements.InsertStatement;
import com.minisql.parser.statements.SelectStatement;
import com.minisql.parser.statements.TransactionStatement;
import com.minisql.parser.statements.UpdateStatement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SQLParserTest - SQL解析器单元测试
 *
 * 每个测试用例只测试一种语法结构。
 */
@DisplayName("SQL 解析器测试")
class SQLParserTest {

    private final SQLParser parser = new SQLParser();

    @Test
    @DisplayName("解析 CREATE TABLE 语句,列顺序与声明一致")
    void testCreateTable() {
        Statement stmt = parser.parse("CREATE TABLE users (id INT NOT NULL, name VARCHAR(100), bio TEXT, score BIGINT);");

        assertInstanceOf(CreateTableStatement.class, stmt);
        CreateTableStatement create = (CreateTableStatement) stmt;

        assertEquals(ObjectName.of("users"), create.getTableName());
        List<Column> columns = create.getColumns();
        assertEquals(4, columns.size());
        assertEquals(new Column("id", DataType.INT, false), columns.get(0));
        assertEquals(new Column("name", DataType.VARCHAR, 100, true), columns.get(1));
        assertEquals(new Column("bio", DataType.TEXT, true), columns.get(2));
        assertEquals(new Column("score", DataType.BIGINT, true), columns.get(3));
    }

    @Test
    @DisplayName("关键字大小写不敏感,支持反引号标识符和限定表名")
    void testCaseInsensitiveAndQuoted() {
        Statement stmt = parser.parse("create table mydb.`order` (`select` integer, price double, ok boolean)");

        CreateTableStatement create = (CreateTableStatement) stmt;
        assertEquals(ObjectName.of("mydb", "order"), create.getTableName());
        assertEquals("select", create.getColumns().get(0).getName());
        assertEquals(DataType.INT, create.getColumns().get(0).getType());
        assertEquals(DataType.DOUBLE, create.getColumns().get(1).getType());
        assertEquals(DataType.BOOLEAN, create.getColumns().get(2).getType());
    }

    @Test
    @DisplayName("解析 DROP 语句,保留对象类型和多个名字")
    void testDrop() {
        DropStatement dropTables = (DropStatement) parser.parse("DROP TABLE a, db.b");
        assertEquals(DropStatement.ObjectType.TABLE, dropTables.getObjectType());
        assertEquals(List.of(ObjectName.of("a"), ObjectName.of("db", "b")), dropTables.getNames());

        DropStatement dropView = (DropStatement) parser.parse("DROP VIEW v1");
        assertEquals(DropStatement.ObjectType.VIEW, dropView.getObjectType());
    }

    @Test
    @DisplayName("解析 SELECT *")
    void testSelectAll() {
        SelectStatement select = (SelectStatement) parser.parse("SELECT * FROM users");

        assertTrue(select.isSelectAll());
        assertEquals(ObjectName.of("users"), select.getTableName());
        assertTrue(select.getWhereClause().isEmpty());
        assertTrue(select.getAlias().isEmpty());
    }

    @Test
    @DisplayName("解析带别名、表达式和WHERE的SELECT")
    void testSelectWithItems() {
        SelectStatement select = (SelectStatement) parser.parse(
                "SELECT u.id, age + 1 AS next_age FROM users AS u WHERE u.age >= 18");

        assertFalse(select.isSelectAll());
        assertEquals(2, select.getSelectItems().size());
        assertEquals("u.id", select.getSelectItems().get(0).getExpression().toString());
        assertEquals("next_age", select.getSelectItems().get(1).getLabel().orElseThrow());
        assertEquals("u", select.getAlias().orElseThrow());

        BinaryExpression where = (BinaryExpression) select.getWhereClause().orElseThrow();
        assertEquals(BinaryOperator.GREATER_EQUAL, where.getOperator());
        assertEquals("u", ((ColumnExpression) where.getLeft()).getTableName());
    }

    @Test
    @DisplayName("解析 INSERT 语句")
    void testInsert() {
        InsertStatement insert = (InsertStatement) parser.parse("INSERT INTO users (id, name) VALUES (1, 'it''s')");

        assertEquals(ObjectName.of("users"), insert.getTableName());
        assertEquals(List.of("id", "name"), insert.getColumnNames());
        assertEquals(1, ((LiteralExpression) insert.getValues().get(0)).getValue());
        assertEquals("it's", ((LiteralExpression) insert.getValues().get(1)).getValue());

        InsertStatement positional = (InsertStatement) parser.parse("INSERT INTO users VALUES (1, NULL, -2.5)");
        assertFalse(positional.hasColumnNames());
        assertTrue(((LiteralExpression) positional.getValues().get(1)).isNull());
        assertInstanceOf(NegateExpression.class, positional.getValues().get(2));
    }

    @Test
    @DisplayName("超出INT范围的整数字面量为Long")
    void testBigIntegerLiteral() {
        InsertStatement insert = (InsertStatement) parser.parse("INSERT INTO t VALUES (5000000000)");

        assertEquals(5_000_000_000L, ((LiteralExpression) insert.getValues().get(0)).getValue());
    }

    @Test
    @DisplayName("解析 UPDATE 语句,赋值保持书写顺序")
    void testUpdate() {
        UpdateStatement update = (UpdateStatement) parser.parse("UPDATE users SET b = a, a = b + 1 WHERE id = 1");

        List<Assignment> assignments = update.getAssignments();
        assertEquals(2, assignments.size());
        assertEquals("b", assignments.get(0).getColumnName());
        assertEquals("a", assignments.get(1).getColumnName());
        assertInstanceOf(BinaryExpression.class, assignments.get(1).getValue());
        assertTrue(update.getWhereClause().isPresent());
    }

    @Test
    @DisplayName("解析 DELETE 语句")
    void testDelete() {
        DeleteStatement delete = (DeleteStatement) parser.parse("DELETE FROM users");
        assertTrue(delete.getWhereClause().isEmpty());

        DeleteStatement filtered = (DeleteStatement) parser.parse("DELETE FROM users WHERE name IS NOT NULL");
        IsNullExpression isNull = (IsNullExpression) filtered.getWhereClause().orElseThrow();
        assertTrue(isNull.isNegated());
    }

    @Test
    @DisplayName("解析事务控制语句")
    void testTransaction() {
        assertEquals(TransactionStatement.Kind.BEGIN, ((TransactionStatement) parser.parse("BEGIN")).getKind());
        assertEquals(TransactionStatement.Kind.BEGIN,
                ((TransactionStatement) parser.parse("START TRANSACTION")).getKind());
        assertEquals(TransactionStatement.Kind.COMMIT, ((TransactionStatement) parser.parse("commit;")).getKind());
        assertEquals(Statement.StatementType.TRANSACTION, parser.parse("ROLLBACK").getType());
    }

    @Test
    @DisplayName("运算符优先级: AND高于OR,比较高于AND,乘法高于加法")
    void testPrecedence() {
        SelectStatement select = (SelectStatement) parser.parse(
                "SELECT * FROM t WHERE a = 1 OR b = 2 AND c + 2 * 3 > 4");

        BinaryExpression or = (BinaryExpression) select.getWhereClause().orElseThrow();
        assertEquals(BinaryOperator.OR, or.getOperator());

        BinaryExpression and = (BinaryExpression) or.getRight();
        assertEquals(BinaryOperator.AND, and.getOperator());

        BinaryExpression greater = (BinaryExpression) and.getRight();
        assertEquals(BinaryOperator.GREATER_THAN, greater.getOperator());

        BinaryExpression add = (BinaryExpression) greater.getLeft();
        assertEquals(BinaryOperator.ADD, add.getOperator());
        assertEquals(BinaryOperator.MULTIPLY, ((BinaryExpression) add.getRight()).getOperator());
    }

    @Test
    @DisplayName("解析 IN、NOT IN、EXISTS、NOT 和 <>")
    void testPredicates() {
        SelectStatement select = (SelectStatement) parser.parse(
                "SELECT * FROM t WHERE id IN (1, 2) AND id NOT IN (SELECT id FROM s) "
                        + "AND NOT EXISTS (SELECT * FROM s WHERE s.id = t.id) AND a <> b");

        BinaryExpression top = (BinaryExpression) select.getWhereClause().orElseThrow();
        assertEquals(BinaryOperator.NOT_EQUAL, ((BinaryExpression) top.getRight()).getOperator());

        BinaryExpression second = (BinaryExpression) top.getLeft();
        NotExpression not = (NotExpression) second.getRight();
        assertInstanceOf(ExistsExpression.class, not.getOperand());

        BinaryExpression third = (BinaryExpression) second.getLeft();
        InSubqueryExpression inSubquery = (InSubqueryExpression) third.getRight();
        assertTrue(inSubquery.isNegated());
        assertEquals(ObjectName.of("s"), inSubquery.getSubquery().getTableName());

        InListExpression inList = (InListExpression) third.getLeft();
        assertFalse(inList.isNegated());
        assertEquals(2, inList.getList().size());
    }

    @Test
    @DisplayName("解析多条语句的脚本")
    void testParseAll() {
        List<Statement> statements = parser.parseAll(
                "CREATE TABLE t (id INT);\n-- comment\nINSERT INTO t VALUES (1);; SELECT * FROM t;");

        assertEquals(3, statements.size());
        assertEquals(Statement.StatementType.CREATE_TABLE, statements.get(0).getType());
        assertEquals(Statement.StatementType.INSERT, statements.get(1).getType());
        assertEquals(Statement.StatementType.SELECT, statements.get(2).getType());

        assertTrue(parser.parseAll("  ").isEmpty());
    }

    @Test
    @DisplayName("语法错误抛出ParseException并带位置")
    void testSyntaxError() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("SELECT FROM"));
        assertTrue(e.getMessage().contains("line 1:"));

        assertThrows(ParseException.class, () -> parser.parse(""));
        assertThrows(ParseException.class, () -> parser.parse("CREATE TABLE t (name VARCHAR(0))"));
        assertThrows(ParseException.class, () -> parser.parseAll("SELECT * FROM t; DELETE"));
    }
}
