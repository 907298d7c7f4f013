package com.minisql.executor;

import com.minisql.data.Column;
import com.minisql.data.Row;
import com.minisql.data.Schema;
import com.minisql.data.TableNames;
import com.minisql.parser.statements.SelectItem;
import com.minisql.parser.statements.SelectStatement;
import com.minisql.parser.expressions.ColumnExpression;
import com.minisql.storage.KeyedRow;
import com.minisql.storage.StorageEngine;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Select - SELECT查询管道
 *
 * 单表查询: 扫描 → WHERE过滤 → 列投影。
 *
 * <pre>
 * SQL: SELECT id, name FROM users WHERE age > 18
 *
 * Project(id, name)
 *   └─ Fetch(filter = age > 18)
 *       └─ scanData(users)
 * </pre>
 *
 * 行是惰性产生的,顶层SELECT由Executor一次性收集,子查询(IN/EXISTS)按需读取。
 * 外层作用域不为null时即为相关子查询,WHERE和投影都可以引用外层的列。
 *
 * 不支持JOIN、ORDER BY、GROUP BY。
 *
 * @param <K> 存储引擎的Key类型
 */
public class Select<K> {

    private final StorageEngine<K> storage;

    private final SelectStatement query;

    /** 外层作用域(顶层查询为null) */
    private final EvaluationContext outer;

    private final Schema schema;

    /** 作用域名: 别名优先,否则表名 */
    private final String scopeName;

    /**
     * 创建查询管道
     *
     * @throws com.minisql.data.TableNameException 表名无法解析
     * @throws com.minisql.storage.StorageException 表不存在
     */
    public Select(StorageEngine<K> storage, SelectStatement query, EvaluationContext outer) {
        this.storage = storage;
        this.query = query;
        this.outer = outer;

        String tableName = TableNames.resolve(query.getTableName());
        this.schema = Fetch.fetchSchema(storage, tableName);
        this.scopeName = query.getAlias().orElse(schema.getTableName());
    }

    /**
     * 结果列标签
     *
     * SELECT *返回表的列名;否则依次为别名、列名、表达式文本。
     */
    public List<String> getLabels() {
        if (query.isSelectAll()) {
            return schema.getColumnNames();
        }

        List<String> labels = new ArrayList<>();
        for (SelectItem item : query.getSelectItems()) {
            if (item.getLabel().isPresent()) {
                labels.add(item.getLabel().get());
            } else if (item.getExpression() instanceof ColumnExpression) {
                labels.add(((ColumnExpression) item.getExpression()).getColumnName());
            } else {
                labels.add(item.getExpression().toString());
            }
        }
        return labels;
    }

    /**
     * 执行查询
     *
     * @return 惰性、不可重启的结果行迭代器
     */
    public Iterator<Row> rows() {
        Filter<K> filter = new Filter<>(storage, query.getWhereClause().orElse(null), outer, scopeName);
        Iterator<KeyedRow<K>> source = Fetch.fetch(storage, schema, filter);
        return new ProjectIterator(source);
    }

    private Row project(Row row) {
        if (query.isSelectAll()) {
            return row;
        }

        Evaluator<K> evaluator = new Evaluator<>(storage);
        List<Column> columns = schema.getColumnDefs();
        EvaluationContext context = new EvaluationContext(scopeName, columns, row, outer);

        List<Object> values = new ArrayList<>();
        for (SelectItem item : query.getSelectItems()) {
            values.add(evaluator.eval(item.getExpression(), context));
        }
        return new Row(values);
    }

    /**
     * 投影迭代器
     */
    private class ProjectIterator implements Iterator<Row> {

        private final Iterator<KeyedRow<K>> source;

        ProjectIterator(Iterator<KeyedRow<K>> source) {
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            return source.hasNext();
        }

        @Override
        public Row next() {
            return project(source.next().getRow());
        }
    }
}
