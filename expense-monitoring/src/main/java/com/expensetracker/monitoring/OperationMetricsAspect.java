package com.expensetracker.monitoring;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 基于 AOP 的存储操作指标采集切面，自动统计 @Monitored 方法的执行耗时与结果。
 */
@Aspect
@Component
public class OperationMetricsAspect {

    public static final String METRIC_NAME = "expense.operation.duration";

    private final MeterRegistry meterRegistry;

    /**
     * @param meterRegistry Micrometer 指标注册表
     */
    public OperationMetricsAspect(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * 拦截所有带 @Monitored 的方法并记录执行耗时，指标名为 expense.operation.duration。
     */
    @Around("@annotation(monitored)")
    public Object measureOperationTime(ProceedingJoinPoint pjp, Monitored monitored) throws Throwable {
        long start = System.nanoTime();
        String outcome = "failure";
        try {
            Object result = pjp.proceed();
            outcome = "success";
            return result;
        } finally {
            long duration = System.nanoTime() - start;
            // 核心逻辑：operation + outcome 作为 tag，区分不同操作及失败调用。
            Timer.builder(METRIC_NAME)
                    .tag("operation", operationName(pjp, monitored))
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .record(duration, TimeUnit.NANOSECONDS);
        }
    }

    private static String operationName(ProceedingJoinPoint pjp, Monitored monitored) {
        return monitored.value().isEmpty() ? pjp.getSignature().toShortString() : monitored.value();
    }
}
