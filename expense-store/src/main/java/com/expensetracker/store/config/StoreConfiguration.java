package com.expensetracker.store.config;

import com.expensetracker.common.tx.TransactionExecutor;
import com.expensetracker.store.repository.ExpenseRepository;
import com.expensetracker.store.schema.SchemaManager;
import com.expensetracker.store.service.ExpenseStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 类说明 / Class Description:
 * 中文：装配 SchemaManager 与 ExpenseStore；先显式建表，再创建存储服务，保证任何操作可达前表已存在。
 * English: Wires SchemaManager and ExpenseStore; the schema is ensured explicitly before the store bean exists,
 * so no operation is reachable before the table does.
 *
 * 设计目的 / Design Purpose:
 * 中文：建表失败即启动失败，由宿主进程决定是否重试。
 * English: A schema failure aborts startup; the hosting process decides whether to retry.
 */
@Configuration
public class StoreConfiguration {

    @Bean
    public SchemaManager schemaManager(JdbcTemplate jdbcTemplate, TransactionExecutor transactionExecutor) {
        return new SchemaManager(jdbcTemplate, transactionExecutor);
    }

    @Bean
    public ExpenseStore expenseStore(SchemaManager schemaManager,
                                     ExpenseRepository expenseRepository,
                                     TransactionExecutor transactionExecutor) {
        schemaManager.ensureSchema();
        return new ExpenseStore(expenseRepository, transactionExecutor);
    }
}
