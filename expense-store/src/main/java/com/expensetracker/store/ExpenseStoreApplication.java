package com.expensetracker.store;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 类说明 / Class Description:
 * 中文：费用存储模块启动入口，装配数据源、建表、存储服务、分类目录与工具操作面。
 * English: Entry point for the expense store, assembling the data source, schema, store service, category catalog and tool surface.
 *
 * 使用场景 / Use Cases:
 * 中文：由外部传输层（不在本模块范围内）嵌入或启动后调用 ExpenseTools。
 * English: Embedded or started by an external transport layer (outside this module) which then calls ExpenseTools.
 */
@SpringBootApplication(scanBasePackages = "com.expensetracker")
public class ExpenseStoreApplication {

    public static void main(String[] args) {
        // 中文：启动应用，建表失败时启动即失败
        // English: Start the application; a schema failure fails startup
        SpringApplication.run(ExpenseStoreApplication.class, args);
    }
}
