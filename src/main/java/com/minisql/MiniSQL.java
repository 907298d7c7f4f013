package com.minisql;

import com.minisql.executor.Executor;
import com.minisql.parser.SQLParser;
import com.minisql.parser.Statement;
import com.minisql.result.Payload;
import com.minisql.result.PayloadPrinter;
import com.minisql.storage.StorageEngine;
import com.minisql.storage.StorageEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Mini SQL - 嵌入式入口
 *
 * 把SQL文本交给解析器,再交给执行器,所有语句作用于同一个存储引擎。
 *
 * 使用示例:
 * <pre>
 * MiniSQL&lt;?&gt; db = MiniSQL.createDefault();
 * db.execute("CREATE TABLE t (id INT, name TEXT)");
 * db.execute("INSERT INTO t VALUES (1, 'a')");
 * Payload payload = db.execute("SELECT * FROM t WHERE id = 1");
 * </pre>
 *
 * main()提供一个最简单的交互式shell: 从标准输入读取以分号结尾的语句,逐条执行并打印结果。
 *
 * @param <K> 存储引擎的Key类型
 */
public class MiniSQL<K> {

    private static final Logger logger = LoggerFactory.getLogger(MiniSQL.class);

    private final StorageEngine<K> storage;

    private final SQLParser parser = new SQLParser();

    private final Executor<K> executor;

    public MiniSQL(StorageEngine<K> storage) {
        this.storage = storage;
        this.executor = new Executor<>(storage);
    }

    /**
     * 使用指定存储引擎创建实例
     */
    public static <K> MiniSQL<K> of(StorageEngine<K> storage) {
        return new MiniSQL<>(storage);
    }

    /**
     * 使用默认存储引擎(Memory)创建实例
     */
    public static MiniSQL<?> createDefault() {
        return of(StorageEngineFactory.createDefaultEngine());
    }

    public StorageEngine<K> getStorage() {
        return storage;
    }

    /**
     * 解析并执行一条语句
     *
     * @param sql SQL语句
     * @return 执行结果
     * @throws RuntimeException 解析或执行失败,异常原样抛出
     */
    public Payload execute(String sql) {
        try {
            return executor.execute(parser.parse(sql));
        } catch (RuntimeException e) {
            logger.warn("执行失败: {} ({})", sql, e.getMessage());
            throw e;
        }
    }

    /**
     * 解析并依次执行脚本中的所有语句
     *
     * 遇到第一条失败的语句即停止,之前语句的效果保留。
     *
     * @param script 以分号分隔的SQL脚本
     * @return 每条语句的执行结果
     */
    public List<Payload> executeAll(String script) {
        List<Statement> statements = parser.parseAll(script);

        List<Payload> payloads = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            try {
                payloads.add(executor.execute(statement));
            } catch (RuntimeException e) {
                logger.warn("执行失败: {} ({})", statement, e.getMessage());
                throw e;
            }
        }
        return payloads;
    }

    public static void main(String[] args) throws IOException {
        MiniSQL<?> db = createDefault();
        PrintStream out = System.out;

        out.println("Mini SQL - 输入以分号结尾的语句, Ctrl-D退出");

        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        StringBuilder buffer = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
            buffer.append(line).append('\n');
            if (!line.trim().endsWith(";")) {
                continue;
            }

            String sql = buffer.toString();
            buffer.setLength(0);

            try {
                for (Payload payload : db.executeAll(sql)) {
                    out.println(PayloadPrinter.format(payload));
                }
            } catch (RuntimeException e) {
                // 单条语句失败不退出shell
                out.println("ERROR: " + e.getMessage());
            }
        }
    }
}
