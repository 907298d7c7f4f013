package com.minisql.executor;

import com.minisql.data.Column;
import com.minisql.data.Row;
import com.minisql.data.Schema;
import com.minisql.parser.statements.Assignment;
import com.minisql.storage.StorageEngine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Update - UPDATE赋值计算
 *
 * 根据SET子句计算一行更新后的值,未被赋值的列原样保留。
 *
 * 规则:
 * - 构造时校验: 每个赋值目标列必须存在且不重复,否则抛UpdateException(此时还没有扫描任何行)
 * - 所有赋值表达式都基于更新前的原始行求值,互相看不到对方的结果
 *   例如 SET a = b, b = a 会交换两列的值
 * - 求得的值按列类型转换(Column.coerce),规则与INSERT一致
 *
 * 使用示例:
 * <pre>
 * // UPDATE users SET age = age + 1 WHERE id = 1
 * Update&lt;K&gt; update = new Update&lt;&gt;(storage, "users", assignments, schema.getColumnDefs());
 * Row updated = update.apply(row);
 * </pre>
 *
 * @param <K> 存储引擎的Key类型
 */
public class Update<K> {

    /** 表达式求值器 */
    private final Evaluator<K> evaluator;

    /** 表名(求值作用域名) */
    private final String tableName;

    /** 表的列定义 */
    private final List<Column> columns;

    /** 赋值目标列的位置,与assignments一一对应 */
    private final int[] targetIndexes;

    private final List<Assignment> assignments;

    /**
     * 创建赋值计算器
     *
     * @param storage 存储引擎(赋值表达式中的子查询使用)
     * @param tableName 表名
     * @param assignments SET子句(书写顺序)
     * @param columns 表的列定义
     * @throws UpdateException 目标列不存在或重复
     */
    public Update(StorageEngine<K> storage, String tableName, List<Assignment> assignments, List<Column> columns) {
        this.evaluator = new Evaluator<>(storage);
        this.tableName = tableName;
        this.columns = List.copyOf(columns);
        this.assignments = List.copyOf(assignments);
        this.targetIndexes = new int[assignments.size()];

        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < assignments.size(); i++) {
            String columnName = assignments.get(i).getColumnName();
            int index = Schema.indexOf(columns, columnName);
            if (index < 0) {
                throw new UpdateException("Column not found in table " + tableName + ": " + columnName);
            }
            if (!seen.add(index)) {
                throw new UpdateException("Column assigned more than once: " + columnName);
            }
            targetIndexes[i] = index;
        }
    }

    /**
     * 计算更新后的行
     *
     * @param row 更新前的行
     * @return 新行,原行不变
     * @throws EvaluationException 赋值表达式求值失败
     * @throws com.minisql.data.RowException 值不满足列约束
     */
    public Row apply(Row row) {
        EvaluationContext context = new EvaluationContext(tableName, columns, row, null);

        // 先全部求值,再统一写入,保证每个表达式只看到原始行
        List<Object> newValues = new ArrayList<>(assignments.size());
        for (Assignment assignment : assignments) {
            newValues.add(evaluator.eval(assignment.getValue(), context));
        }

        List<Object> values = new ArrayList<>(row.getValues());
        for (int i = 0; i < targetIndexes.length; i++) {
            int index = targetIndexes[i];
            values.set(index, columns.get(index).coerce(newValues.get(i)));
        }

        return new Row(values);
    }

    @Override
    public String toString() {
        return "Update{" +
                "tableName='" + tableName + '\'' +
                ", assignments=" + assignments +
                '}';
    }
}
