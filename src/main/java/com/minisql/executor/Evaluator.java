package com.minisql.executor;

import com.minisql.data.Row;
import com.minisql.parser.Expression;
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
import com.minisql.storage.StorageEngine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Evaluator - SQL表达式求值器
 *
 * 递归求值SQL表达式树,支持:
 * - 列引用: age → 从EvaluationContext查找(可跨越外层作用域)
 * - 字面量: 42, 'hello', NULL → 直接返回
 * - 二元运算: 比较、算术、AND/OR
 * - 一元运算: NOT, 取负
 * - 谓词: IS [NOT] NULL, [NOT] IN (列表), [NOT] IN (子查询), EXISTS
 *
 * 三值逻辑:
 * - 结果为Boolean.TRUE / Boolean.FALSE / null(UNKNOWN)
 * - 与NULL比较得到UNKNOWN
 * - NOT UNKNOWN = UNKNOWN
 * - AND/OR按Kleene逻辑: FALSE AND UNKNOWN = FALSE, TRUE OR UNKNOWN = TRUE
 *
 * 类型规则:
 * - 数值之间(Integer/Long/Double)可以比较和运算,按需拓宽
 * - 字符串与字符串、布尔与布尔可以比较
 * - 其他组合直接抛EvaluationException,不做隐式转换
 *
 * 子查询通过Select执行,当前作用域作为子查询的外层作用域。
 *
 * @param <K> 存储引擎的Key类型
 */
public class Evaluator<K> {

    /** 存储引擎(子查询使用) */
    private final StorageEngine<K> storage;

    public Evaluator(StorageEngine<K> storage) {
        this.storage = storage;
    }

    /**
     * 求值表达式
     *
     * @param expr 表达式
     * @param context 行作用域(为null时只能求值不引用列的表达式)
     * @return 求值结果(Boolean/Integer/Long/Double/String,或null)
     * @throws EvaluationException 求值失败
     */
    public Object eval(Expression expr, EvaluationContext context) {
        if (expr == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }

        switch (expr.getType()) {
            case COLUMN:
                return evalColumn((ColumnExpression) expr, context);

            case LITERAL:
                return ((LiteralExpression) expr).getValue();

            case BINARY:
                return evalBinary((BinaryExpression) expr, context);

            case NOT:
                return not(toBoolean(eval(((NotExpression) expr).getOperand(), context)));

            case NEGATE:
                return negate(eval(((NegateExpression) expr).getOperand(), context));

            case IS_NULL:
                return evalIsNull((IsNullExpression) expr, context);

            case IN_LIST:
                return evalInList((InListExpression) expr, context);

            case IN_SUBQUERY:
                return evalInSubquery((InSubqueryExpression) expr, context);

            case EXISTS:
                return evalExists((ExistsExpression) expr, context);

            default:
                throw new EvaluationException("Unknown expression type: " + expr.getType());
        }
    }

    private Object evalColumn(ColumnExpression expr, EvaluationContext context) {
        if (context == null) {
            throw new EvaluationException("Column reference not allowed here: " + expr.getFullName());
        }
        return context.lookup(expr);
    }

    private Object evalBinary(BinaryExpression expr, EvaluationContext context) {
        // 两侧都求值,错误不会因为短路而被掩盖
        Object left = eval(expr.getLeft(), context);
        Object right = eval(expr.getRight(), context);
        BinaryOperator op = expr.getOperator();

        if (op == BinaryOperator.AND) {
            return and(toBoolean(left), toBoolean(right));
        }
        if (op == BinaryOperator.OR) {
            return or(toBoolean(left), toBoolean(right));
        }
        if (op.isArithmetic()) {
            return arithmetic(left, right, op);
        }

        Integer cmp = compare(left, right);
        if (cmp == null) {
            return null;
        }

        switch (op) {
            case EQUAL:
                return cmp == 0;
            case NOT_EQUAL:
                return cmp != 0;
            case GREATER_THAN:
                return cmp > 0;
            case LESS_THAN:
                return cmp < 0;
            case GREATER_EQUAL:
                return cmp >= 0;
            case LESS_EQUAL:
                return cmp <= 0;
            default:
                throw new EvaluationException("Unsupported operator: " + op);
        }
    }

    private Object evalIsNull(IsNullExpression expr, EvaluationContext context) {
        boolean isNull = eval(expr.getOperand(), context) == null;
        return expr.isNegated() != isNull;
    }

    private Object evalInList(InListExpression expr, EvaluationContext context) {
        Object value = eval(expr.getOperand(), context);

        List<Object> candidates = new ArrayList<>();
        for (Expression item : expr.getList()) {
            candidates.add(eval(item, context));
        }

        return in(value, candidates, expr.isNegated());
    }

    private Object evalInSubquery(InSubqueryExpression expr, EvaluationContext context) {
        Object value = eval(expr.getOperand(), context);

        // 子查询只取第一列
        List<Object> candidates = new ArrayList<>();
        Iterator<Row> rows = new Select<>(storage, expr.getSubquery(), context).rows();
        while (rows.hasNext()) {
            Row row = rows.next();
            if (row.size() == 0) {
                throw new EvaluationException("Subquery in IN must return at least one column");
            }
            candidates.add(row.getValue(0));
        }

        return in(value, candidates, expr.isNegated());
    }

    private Object evalExists(ExistsExpression expr, EvaluationContext context) {
        return new Select<>(storage, expr.getSubquery(), context).rows().hasNext();
    }

    /**
     * IN的三值语义
     *
     * - 候选为空: FALSE
     * - 被检测值为NULL: UNKNOWN
     * - 有相等的候选: TRUE
     * - 没有相等的候选,但候选中有NULL: UNKNOWN
     * - 否则: FALSE
     *
     * NOT IN 对结果取NOT。
     */
    private Boolean in(Object value, List<Object> candidates, boolean negated) {
        Boolean result;

        if (candidates.isEmpty()) {
            result = Boolean.FALSE;
        } else if (value == null) {
            result = null;
        } else {
            boolean sawNull = false;
            result = Boolean.FALSE;
            for (Object candidate : candidates) {
                Integer cmp = compare(value, candidate);
                if (cmp == null) {
                    sawNull = true;
                } else if (cmp == 0) {
                    result = Boolean.TRUE;
                    break;
                }
            }
            if (Boolean.FALSE.equals(result) && sawNull) {
                result = null;
            }
        }

        return negated ? not(result) : result;
    }

    /**
     * 比较两个值
     *
     * @return 比较结果(>0, 0, <0),任一值为NULL时返回null(UNKNOWN)
     * @throws EvaluationException 类型不可比较
     */
    private Integer compare(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }

        if (left instanceof Number && right instanceof Number) {
            return compareNumbers((Number) left, (Number) right);
        }

        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }

        if (left instanceof Boolean && right instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }

        throw new EvaluationException(
                "Type mismatch in comparison: " +
                        left.getClass().getSimpleName() + " vs " +
                        right.getClass().getSimpleName());
    }

    /**
     * 数值比较
     *
     * 整数与整数按long比较;整数与DOUBLE按精确值比较,不经过double转换丢精度。
     * -0.0与0.0相等;NaN按Double.compare的全序处理(大于所有数,等于自身)。
     */
    private static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }

        double l = left.doubleValue();
        double r = right.doubleValue();
        if (isIntegral(left) || isIntegral(right)) {
            double d = isIntegral(left) ? r : l;
            if (!Double.isNaN(d) && !Double.isInfinite(d)) {
                return toExact(left).compareTo(toExact(right));
            }
        }

        if (l == r) {
            return 0;
        }
        return Double.compare(l, r);
    }

    private static BigDecimal toExact(Number value) {
        return isIntegral(value) ? BigDecimal.valueOf(value.longValue()) : new BigDecimal(value.doubleValue());
    }

    /**
     * 转换为三值布尔
     *
     * @return TRUE/FALSE,NULL返回null
     * @throws EvaluationException 值不是布尔类型
     */
    private Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new EvaluationException("Expected BOOLEAN, got: " + value.getClass().getSimpleName());
    }

    private static Boolean not(Boolean value) {
        return value == null ? null : !value;
    }

    private static Boolean and(Boolean left, Boolean right) {
        if (Boolean.FALSE.equals(left) || Boolean.FALSE.equals(right)) {
            return Boolean.FALSE;
        }
        if (left == null || right == null) {
            return null;
        }
        return Boolean.TRUE;
    }

    private static Boolean or(Boolean left, Boolean right) {
        if (Boolean.TRUE.equals(left) || Boolean.TRUE.equals(right)) {
            return Boolean.TRUE;
        }
        if (left == null || right == null) {
            return null;
        }
        return Boolean.FALSE;
    }

    private Object negate(Object value) {
        if (value == null) {
            return null;
        }

        try {
            if (value instanceof Integer) {
                return Math.negateExact((Integer) value);
            }
            if (value instanceof Long) {
                return Math.negateExact((Long) value);
            }
        } catch (ArithmeticException e) {
            throw new EvaluationException("Numeric overflow in negation: " + value, e);
        }

        if (value instanceof Double) {
            return -(Double) value;
        }

        throw new EvaluationException("Cannot negate: " + value.getClass().getSimpleName());
    }

    /**
     * 算术运算
     *
     * NULL参与运算结果为NULL。结果类型: 有Double则Double,否则有Long则Long,否则Integer。
     */
    private Object arithmetic(Object left, Object right, BinaryOperator op) {
        if (left == null || right == null) {
            return null;
        }

        if (!(left instanceof Number) || !(right instanceof Number)) {
            throw new EvaluationException(
                    "Type mismatch in arithmetic: " +
                            left.getClass().getSimpleName() + " " + op + " " +
                            right.getClass().getSimpleName());
        }

        if (left instanceof Double || right instanceof Double) {
            double l = ((Number) left).doubleValue();
            double r = ((Number) right).doubleValue();

            switch (op) {
                case ADD:
                    return l + r;
                case SUBTRACT:
                    return l - r;
                case MULTIPLY:
                    return l * r;
                case DIVIDE:
                    return l / r;
                case MODULO:
                    return l % r;
                default:
                    throw new EvaluationException("Unsupported operator: " + op);
            }
        }

        try {
            if (left instanceof Long || right instanceof Long) {
                long l = ((Number) left).longValue();
                long r = ((Number) right).longValue();

                switch (op) {
                    case ADD:
                        return Math.addExact(l, r);
                    case SUBTRACT:
                        return Math.subtractExact(l, r);
                    case MULTIPLY:
                        return Math.multiplyExact(l, r);
                    case DIVIDE:
                        checkDivisor(r);
                        if (l == Long.MIN_VALUE && r == -1) {
                            throw new ArithmeticException("long overflow");
                        }
                        return l / r;
                    case MODULO:
                        checkDivisor(r);
                        return l % r;
                    default:
                        throw new EvaluationException("Unsupported operator: " + op);
                }
            }

            int l = (Integer) left;
            int r = (Integer) right;

            switch (op) {
                case ADD:
                    return Math.addExact(l, r);
                case SUBTRACT:
                    return Math.subtractExact(l, r);
                case MULTIPLY:
                    return Math.multiplyExact(l, r);
                case DIVIDE:
                    checkDivisor(r);
                    if (l == Integer.MIN_VALUE && r == -1) {
                        throw new ArithmeticException("integer overflow");
                    }
                    return l / r;
                case MODULO:
                    checkDivisor(r);
                    return l % r;
                default:
                    throw new EvaluationException("Unsupported operator: " + op);
            }
        } catch (ArithmeticException e) {
            throw new EvaluationException("Numeric overflow: " + left + " " + op + " " + right, e);
        }
    }

    private static void checkDivisor(long divisor) {
        if (divisor == 0) {
            throw new EvaluationException("Division by zero");
        }
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long;
    }
}
