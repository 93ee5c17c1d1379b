package com.expensetracker.monitoring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 类说明 / Class Description:
 * 中文：在未引入 actuator 时提供默认的 SimpleMeterRegistry，并为所有指标附加 application 公共标签。
 * English: Supplies a SimpleMeterRegistry when actuator is absent and stamps every meter with an application tag.
 *
 * 使用场景 / Use Cases:
 * 中文：同一监控平台汇集多个进程的 expense.operation.duration 时，按 application 区分来源。
 * English: Tells processes apart by application when several report expense.operation.duration to one backend.
 */
@Configuration
public class MonitoringAutoConfiguration {

    public static final String APPLICATION_TAG = "application";

    /**
     * @param applicationName 取自 spring.application.name，缺省为 expense-tracker
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry(@Value("${spring.application.name:expense-tracker}") String applicationName) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().meterFilter(applicationTag(applicationName));
        return registry;
    }

    static MeterFilter applicationTag(String applicationName) {
        return MeterFilter.commonTags(Tags.of(APPLICATION_TAG, applicationName));
    }
}
