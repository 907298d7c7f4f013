package com.minisql.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.util.ArrayList;
import java.util.List;

/**
 * SQLParser - SQL解析器对外接口
 *
 * 提供简单易用的API来解析SQL字符串。
 *
 * 设计原则:
 * - 简单的接口: parse(String sql) 解析单条语句, parseAll(String sql) 解析脚本
 * - 清晰的错误信息: 语法错误时提供位置和原因
 *
 * 使用示例:
 * <pre>
 * SQLParser parser = new SQLParser();
 * Statement stmt = parser.parse("CREATE TABLE users (id INT, name TEXT)");
 * List&lt;Statement&gt; script = parser.parseAll("INSERT INTO t VALUES (1); SELECT * FROM t;");
 * </pre>
 *
 * "Good taste": 错误处理直接暴露,而不是被掩盖
 */
public class SQLParser {

    /**
     * 解析单条SQL语句(末尾分号可选)
     *
     * @param sql SQL语句
     * @return 解析后的Statement对象
     * @throws ParseException 如果SQL语法错误
     */
    public Statement parse(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            throw new ParseException("SQL statement cannot be null or empty");
        }

        try {
            MiniSQLErrorCollector errorCollector = new MiniSQLErrorCollector();
            MiniSQLParser parser = createParser(sql, errorCollector);

            // 解析并检查错误,有错误时语法树不完整,不能构建AST
            MiniSQLParser.SqlStatementContext tree = parser.sqlStatement();
            errorCollector.throwIfErrors();

            return new ASTBuilder().visitSqlStatement(tree);

        } catch (ParseException e) {
            throw e;
        } catch (Exception e) {
            throw new ParseException("Failed to parse SQL: " + e.getMessage(), e);
        }
    }

    /**
     * 解析以分号分隔的多条SQL语句
     *
     * @param sql SQL脚本
     * @return 语句列表(空脚本返回空列表)
     * @throws ParseException 如果SQL语法错误
     */
    public List<Statement> parseAll(String sql) {
        if (sql == null) {
            throw new ParseException("SQL script cannot be null");
        }

        try {
            MiniSQLErrorCollector errorCollector = new MiniSQLErrorCollector();
            MiniSQLParser parser = createParser(sql, errorCollector);

            MiniSQLParser.SqlScriptContext tree = parser.sqlScript();
            errorCollector.throwIfErrors();

            return new ASTBuilder().visitSqlScript(tree);

        } catch (ParseException e) {
            throw e;
        } catch (Exception e) {
            throw new ParseException("Failed to parse SQL: " + e.getMessage(), e);
        }
    }

    /**
     * 词法分析 + 语法分析器,错误统一交给收集器
     */
    private MiniSQLParser createParser(String sql, MiniSQLErrorCollector errorCollector) {
        MiniSQLLexer lexer = new MiniSQLLexer(CharStreams.fromString(sql));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorCollector);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        MiniSQLParser parser = new MiniSQLParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorCollector);
        return parser;
    }

    /**
     * ANTLR错误收集器
     *
     * 收集词法和语法错误,提供清晰的错误信息。
     */
    private static class MiniSQLErrorCollector extends BaseErrorListener {
        private final List<String> errors = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer,
                                Object offendingSymbol,
                                int line,
                                int charPositionInLine,
                                String msg,
                                RecognitionException e) {
            String error = String.format("Syntax error at line %d:%d - %s",
                    line, charPositionInLine, msg);
            errors.add(error);
        }

        void throwIfErrors() {
            if (!errors.isEmpty()) {
                throw new ParseException(String.join("\n", errors));
            }
        }
    }
}
