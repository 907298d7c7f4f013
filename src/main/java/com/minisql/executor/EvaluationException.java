package com.minisql.executor;

/**
 * EvaluationException - 表达式求值异常
 *
 * 引用未声明的列、类型不兼容的运算、除零等。
 * 谓词求值失败必须作为语句失败抛出,不能当作"不匹配"吞掉。
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
