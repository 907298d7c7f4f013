package com.minisql.executor;

import com.minisql.data.Row;
import com.minisql.data.Schema;
import com.minisql.parser.Expression;
import com.minisql.storage.StorageEngine;

/**
 * Filter - WHERE条件判定
 *
 * 判断一行是否满足WHERE条件,结果只有"匹配"和"不匹配"两种:
 * - 没有WHERE: 所有行都匹配
 * - 条件为TRUE: 匹配
 * - 条件为FALSE或UNKNOWN(与NULL比较): 不匹配
 * - 求值失败(未声明的列、类型不兼容): 抛EvaluationException,不当作不匹配
 *
 * 外层作用域用于子查询中的相关引用,顶层语句传null。
 *
 * 使用示例:
 * <pre>
 * Filter&lt;K&gt; filter = new Filter&lt;&gt;(storage, whereClause, null);
 * if (filter.matches(schema, row)) {
 *     ...
 * }
 * </pre>
 *
 * @param <K> 存储引擎的Key类型
 */
public class Filter<K> {

    /** 表达式求值器 */
    private final Evaluator<K> evaluator;

    /** WHERE条件(null表示没有WHERE) */
    private final Expression whereClause;

    /** 外层作用域(顶层语句为null) */
    private final EvaluationContext outer;

    /** 当前表的别名(没有别名则用表名) */
    private final String alias;

    public Filter(StorageEngine<K> storage, Expression whereClause, EvaluationContext outer) {
        this(storage, whereClause, outer, null);
    }

    public Filter(StorageEngine<K> storage, Expression whereClause, EvaluationContext outer, String alias) {
        this.evaluator = new Evaluator<>(storage);
        this.whereClause = whereClause;
        this.outer = outer;
        this.alias = alias;
    }

    /**
     * 判断行是否满足条件
     *
     * @param schema 行所属的表结构
     * @param row 行数据
     * @return 条件为TRUE时返回true
     * @throws EvaluationException 条件求值失败或结果不是布尔值
     */
    public boolean matches(Schema schema, Row row) {
        if (whereClause == null) {
            return true;
        }

        String scopeName = alias != null ? alias : schema.getTableName();
        EvaluationContext context = new EvaluationContext(scopeName, schema.getColumnDefs(), row, outer);

        Object result = evaluator.eval(whereClause, context);

        // UNKNOWN视为不匹配
        if (result == null) {
            return false;
        }

        if (!(result instanceof Boolean)) {
            throw new EvaluationException(
                    "WHERE condition must evaluate to BOOLEAN, got: " + result.getClass().getSimpleName());
        }

        return (Boolean) result;
    }

    public boolean hasCondition() {
        return whereClause != null;
    }

    @Override
    public String toString() {
        return "Filter{" +
                "whereClause=" + whereClause +
                (outer != null ? ", correlated" : "") +
                '}';
    }
}
