package com.expensetracker.monitoring;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记需要采集耗时指标的存储操作，由 {@link OperationMetricsAspect} 拦截。
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {

    /**
     * 操作名称，作为 operation 标签；为空时使用方法签名。
     */
    String value() default "";
}
