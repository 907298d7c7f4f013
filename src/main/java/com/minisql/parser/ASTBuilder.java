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
import com.minisql.parser.statements.SelectItem;
import com.minisql.parser.statements.SelectStatement;
import com.minisql.parser.statements.TransactionStatement;
import com.minisql.parser.statements.UpdateStatement;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * ASTBuilder - 将ANTLR语法树转换为Statement对象
 *
 * 使用访问者模式遍历ANTLR生成的语法树,将其转换为强类型的Statement/Expression对象。
 *
 * 设计原则:
 * - "Good taste": 每个visit方法只做一件事
 * - 类型安全: 将ANTLR的弱类型语法树转换为强类型对象
 *
 * 错误处理:
 * - 遇到不支持的语法,抛出ParseException
 */
public class ASTBuilder extends MiniSQLBaseVisitor<Object> {

    @Override
    public Statement visitSqlStatement(MiniSQLParser.SqlStatementContext ctx) {
        return visitStatement(ctx.statement());
    }

    @Override
    public List<Statement> visitSqlScript(MiniSQLParser.SqlScriptContext ctx) {
        List<Statement> statements = new ArrayList<>();
        for (MiniSQLParser.StatementContext stmtCtx : ctx.statement()) {
            statements.add(visitStatement(stmtCtx));
        }
        return statements;
    }

    @Override
    public Statement visitStatement(MiniSQLParser.StatementContext ctx) {
        // statement只有一个子节点,就是具体的语句
        return (Statement) visit(ctx.getChild(0));
    }

    // ==================== CREATE TABLE ====================

    @Override
    public CreateTableStatement visitCreateTableStatement(MiniSQLParser.CreateTableStatementContext ctx) {
        ObjectName tableName = visitQualifiedName(ctx.tableName);

        List<Column> columns = new ArrayList<>();
        for (MiniSQLParser.ColumnDefinitionContext colCtx : ctx.columnDefinition()) {
            columns.add(visitColumnDefinition(colCtx));
        }

        return new CreateTableStatement(tableName, columns);
    }

    @Override
    public Column visitColumnDefinition(MiniSQLParser.ColumnDefinitionContext ctx) {
        String columnName = visitIdentifier(ctx.columnName);
        DataTypeAndLength dataTypeAndLength = visitDataType(ctx.dataType());

        // 没有NOT NULL则允许NULL
        boolean nullable = ctx.nullability() == null || ctx.nullability().NOT() == null;

        try {
            return new Column(columnName, dataTypeAndLength.dataType, dataTypeAndLength.length, nullable);
        } catch (IllegalArgumentException e) {
            throw new ParseException("Invalid column definition '" + columnName + "': " + e.getMessage(), e);
        }
    }

    @Override
    public DataTypeAndLength visitDataType(MiniSQLParser.DataTypeContext ctx) {
        if (ctx.INT() != null || ctx.INTEGER() != null) {
            return new DataTypeAndLength(DataType.INT, 0);
        } else if (ctx.BIGINT() != null) {
            return new DataTypeAndLength(DataType.BIGINT, 0);
        } else if (ctx.DOUBLE() != null || ctx.FLOAT() != null) {
            return new DataTypeAndLength(DataType.DOUBLE, 0);
        } else if (ctx.BOOLEAN() != null) {
            return new DataTypeAndLength(DataType.BOOLEAN, 0);
        } else if (ctx.TEXT() != null) {
            return new DataTypeAndLength(DataType.TEXT, 0);
        } else if (ctx.VARCHAR() != null) {
            return new DataTypeAndLength(DataType.VARCHAR, Integer.parseInt(ctx.length.getText()));
        }
        throw new ParseException("Unsupported data type: " + ctx.getText());
    }

    // ==================== DROP ====================

    @Override
    public DropStatement visitDropStatement(MiniSQLParser.DropStatementContext ctx) {
        DropStatement.ObjectType objectType = visitObjectType(ctx.objectType());

        List<ObjectName> names = new ArrayList<>();
        for (MiniSQLParser.QualifiedNameContext nameCtx : ctx.qualifiedName()) {
            names.add(visitQualifiedName(nameCtx));
        }

        return new DropStatement(objectType, names);
    }

    @Override
    public DropStatement.ObjectType visitObjectType(MiniSQLParser.ObjectTypeContext ctx) {
        if (ctx.TABLE() != null) {
            return DropStatement.ObjectType.TABLE;
        } else if (ctx.VIEW() != null) {
            return DropStatement.ObjectType.VIEW;
        } else if (ctx.INDEX() != null) {
            return DropStatement.ObjectType.INDEX;
        }
        return DropStatement.ObjectType.SCHEMA;
    }

    // ==================== SELECT ====================

    @Override
    public SelectStatement visitSelectStatement(MiniSQLParser.SelectStatementContext ctx) {
        // SELECT *: 空列表表示*
        List<SelectItem> selectItems = new ArrayList<>();
        if (ctx.selectItems().STAR() == null) {
            for (MiniSQLParser.SelectItemContext itemCtx : ctx.selectItems().selectItem()) {
                Expression expression = (Expression) visit(itemCtx.expression());
                String label = itemCtx.label != null ? visitIdentifier(itemCtx.label) : null;
                selectItems.add(new SelectItem(expression, label));
            }
        }

        ObjectName tableName = visitQualifiedName(ctx.tableName);
        String alias = ctx.alias != null ? visitIdentifier(ctx.alias) : null;

        Expression whereClause = null;
        if (ctx.whereExpr != null) {
            whereClause = (Expression) visit(ctx.whereExpr);
        }

        return new SelectStatement(selectItems, tableName, alias, whereClause);
    }

    // ==================== INSERT ====================

    @Override
    public InsertStatement visitInsertStatement(MiniSQLParser.InsertStatementContext ctx) {
        ObjectName tableName = visitQualifiedName(ctx.tableName);

        List<String> columnNames = new ArrayList<>();
        for (MiniSQLParser.IdentifierContext identCtx : ctx.columns) {
            columnNames.add(visitIdentifier(identCtx));
        }

        List<Expression> values = new ArrayList<>();
        for (MiniSQLParser.ExpressionContext exprCtx : ctx.values) {
            values.add((Expression) visit(exprCtx));
        }

        return new InsertStatement(tableName, columnNames, values);
    }

    // ==================== UPDATE ====================

    @Override
    public UpdateStatement visitUpdateStatement(MiniSQLParser.UpdateStatementContext ctx) {
        ObjectName tableName = visitQualifiedName(ctx.tableName);

        // SET子句保持书写顺序
        List<Assignment> assignments = new ArrayList<>();
        for (MiniSQLParser.SetItemContext setItemCtx : ctx.setItem()) {
            String columnName = visitIdentifier(setItemCtx.columnName);
            Expression valueExpr = (Expression) visit(setItemCtx.valueExpr);
            assignments.add(new Assignment(columnName, valueExpr));
        }

        Expression whereClause = null;
        if (ctx.whereExpr != null) {
            whereClause = (Expression) visit(ctx.whereExpr);
        }

        return new UpdateStatement(tableName, assignments, whereClause);
    }

    // ==================== DELETE ====================

    @Override
    public DeleteStatement visitDeleteStatement(MiniSQLParser.DeleteStatementContext ctx) {
        ObjectName tableName = visitQualifiedName(ctx.tableName);

        Expression whereClause = null;
        if (ctx.whereExpr != null) {
            whereClause = (Expression) visit(ctx.whereExpr);
        }

        return new DeleteStatement(tableName, whereClause);
    }

    // ==================== 事务控制 ====================

    @Override
    public TransactionStatement visitTransactionStatement(MiniSQLParser.TransactionStatementContext ctx) {
        if (ctx.COMMIT() != null) {
            return new TransactionStatement(TransactionStatement.Kind.COMMIT);
        } else if (ctx.ROLLBACK() != null) {
            return new TransactionStatement(TransactionStatement.Kind.ROLLBACK);
        }
        return new TransactionStatement(TransactionStatement.Kind.BEGIN);
    }

    // ==================== 表达式 ====================

    @Override
    public Expression visitLiteralExpr(MiniSQLParser.LiteralExprContext ctx) {
        return visitLiteral(ctx.literal());
    }

    @Override
    public Expression visitColumnExpr(MiniSQLParser.ColumnExprContext ctx) {
        // 列名可能包含表名前缀,如users.id
        return new ColumnExpression(visitQualifiedName(ctx.qualifiedName()).getParts());
    }

    @Override
    public Expression visitExistsExpr(MiniSQLParser.ExistsExprContext ctx) {
        return new ExistsExpression(visitSelectStatement(ctx.selectStatement()));
    }

    @Override
    public Expression visitParenthesisExpr(MiniSQLParser.ParenthesisExprContext ctx) {
        return (Expression) visit(ctx.expression());
    }

    @Override
    public Expression visitNegateExpr(MiniSQLParser.NegateExprContext ctx) {
        return new NegateExpression((Expression) visit(ctx.expression()));
    }

    @Override
    public Expression visitMultiplicativeExpr(MiniSQLParser.MultiplicativeExprContext ctx) {
        return binary(ctx.expression(0), ctx.op, ctx.expression(1));
    }

    @Override
    public Expression visitAdditiveExpr(MiniSQLParser.AdditiveExprContext ctx) {
        return binary(ctx.expression(0), ctx.op, ctx.expression(1));
    }

    @Override
    public Expression visitComparisonExpr(MiniSQLParser.ComparisonExprContext ctx) {
        return binary(ctx.expression(0), ctx.op, ctx.expression(1));
    }

    @Override
    public Expression visitIsNullExpr(MiniSQLParser.IsNullExprContext ctx) {
        Expression operand = (Expression) visit(ctx.expression());
        return new IsNullExpression(operand, ctx.NOT() != null);
    }

    @Override
    public Expression visitInSubqueryExpr(MiniSQLParser.InSubqueryExprContext ctx) {
        Expression operand = (Expression) visit(ctx.expression());
        SelectStatement subquery = visitSelectStatement(ctx.selectStatement());
        return new InSubqueryExpression(operand, subquery, ctx.NOT() != null);
    }

    @Override
    public Expression visitInListExpr(MiniSQLParser.InListExprContext ctx) {
        // 第一个表达式是被检测的值,其余是候选列表
        List<MiniSQLParser.ExpressionContext> exprs = ctx.expression();
        Expression operand = (Expression) visit(exprs.get(0));

        List<Expression> list = new ArrayList<>();
        for (int i = 1; i < exprs.size(); i++) {
            list.add((Expression) visit(exprs.get(i)));
        }

        return new InListExpression(operand, list, ctx.NOT() != null);
    }

    @Override
    public Expression visitNotExpr(MiniSQLParser.NotExprContext ctx) {
        return new NotExpression((Expression) visit(ctx.expression()));
    }

    @Override
    public Expression visitAndExpr(MiniSQLParser.AndExprContext ctx) {
        Expression left = (Expression) visit(ctx.expression(0));
        Expression right = (Expression) visit(ctx.expression(1));
        return new BinaryExpression(left, BinaryOperator.AND, right);
    }

    @Override
    public Expression visitOrExpr(MiniSQLParser.OrExprContext ctx) {
        Expression left = (Expression) visit(ctx.expression(0));
        Expression right = (Expression) visit(ctx.expression(1));
        return new BinaryExpression(left, BinaryOperator.OR, right);
    }

    private Expression binary(MiniSQLParser.ExpressionContext leftCtx,
                              Token op,
                              MiniSQLParser.ExpressionContext rightCtx) {
        Expression left = (Expression) visit(leftCtx);
        Expression right = (Expression) visit(rightCtx);
        BinaryOperator operator = BinaryOperator.fromSymbol(op.getText());

        if (operator == null) {
            throw new ParseException("Unknown operator: " + op.getText());
        }

        return new BinaryExpression(left, operator, right);
    }

    // ==================== 字面量 ====================

    @Override
    public Expression visitLiteral(MiniSQLParser.LiteralContext ctx) {
        if (ctx.INTEGER_LITERAL() != null) {
            long value = Long.parseLong(ctx.getText());
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return new LiteralExpression((int) value);
            }
            return new LiteralExpression(value);
        } else if (ctx.DECIMAL_LITERAL() != null) {
            return new LiteralExpression(Double.parseDouble(ctx.getText()));
        } else if (ctx.STRING_LITERAL() != null) {
            // 去除单引号,处理双单引号转义
            String text = ctx.getText();
            text = text.substring(1, text.length() - 1);
            text = text.replace("''", "'");
            return new LiteralExpression(text);
        } else if (ctx.TRUE() != null) {
            return new LiteralExpression(Boolean.TRUE);
        } else if (ctx.FALSE() != null) {
            return new LiteralExpression(Boolean.FALSE);
        } else if (ctx.NULL_() != null) {
            return new LiteralExpression(null);
        }
        throw new ParseException("Unknown literal: " + ctx.getText());
    }

    // ==================== 标识符 ====================

    @Override
    public ObjectName visitQualifiedName(MiniSQLParser.QualifiedNameContext ctx) {
        List<String> parts = new ArrayList<>();
        for (MiniSQLParser.IdentifierContext identCtx : ctx.identifier()) {
            parts.add(visitIdentifier(identCtx));
        }
        return new ObjectName(parts);
    }

    @Override
    public String visitIdentifier(MiniSQLParser.IdentifierContext ctx) {
        String text = ctx.getText();
        if (ctx.QUOTED_IDENTIFIER() != null) {
            // 去除反引号
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    // ==================== 辅助类 ====================

    /**
     * 数据类型和长度的组合
     */
    static class DataTypeAndLength {
        final DataType dataType;
        final int length;

        DataTypeAndLength(DataType dataType, int length) {
            this.dataType = dataType;
            this.length = length;
        }
    }
}
