package com.expensetracker.common.config;

import com.expensetracker.common.exception.StorageUnavailableException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 类说明 / Class Description:
 * 中文：集中式数据源配置，读取 expense.store.* 并基于 SQLite 文件构建 HikariCP 连接池。
 * English: Centralized DataSource configuration, reading expense.store.* to build a HikariCP pool over the SQLite file.
 *
 * 使用场景 / Use Cases:
 * 中文：每次存储操作从池中借出连接，调用结束即归还，不存在跨调用的长事务。
 * English: Each store operation borrows a pooled connection and returns it when the call ends; no transaction spans calls.
 *
 * 涉及的核心组件说明 / Core Components:
 * 中文：ExpenseStoreProperties、HikariConfig/HikariDataSource、SQLite busy_timeout 与 journal_mode。
 * English: ExpenseStoreProperties, HikariConfig/HikariDataSource, SQLite busy_timeout and journal_mode.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ExpenseStoreProperties.class)
public class DataSourceConfig {

    static final String SQLITE_DRIVER = "org.sqlite.JDBC";

    /**
     * 方法说明 / Method Description:
     * 中文：绑定 expense.store.hikari.* 到 HikariConfig，用于覆盖连接池的高级参数。
     * English: Bind expense.store.hikari.* to HikariConfig for advanced pool overrides.
     *
     * 返回值 / Return:
     * 中文说明：Hikari 连接池配置对象
     * English description: Hikari connection pool configuration object
     */
    @Bean
    @ConfigurationProperties("expense.store.hikari")
    public HikariConfig hikariConfig() {
        return new HikariConfig();
    }

    /**
     * 方法说明 / Method Description:
     * 中文：根据存储配置构建 HikariDataSource；数据库文件的父目录不存在时先创建。
     * English: Build the HikariDataSource from the store properties, creating the database parent directory first.
     *
     * 参数 / Parameters:
     * @param properties 中文说明：存储配置（路径、busy_timeout、journal_mode、池大小）
     *                   English description: Store properties (path, busy_timeout, journal_mode, pool size)
     * @param hikari     中文说明：连接池参数
     *                   English description: Pool parameters
     *
     * 返回值 / Return:
     * 中文说明：已配置完成并可用的 DataSource
     * English description: A fully configured, ready-to-use DataSource
     *
     * 异常 / Exceptions:
     * 中文/英文：目录无法创建时抛 UncheckedIOException；数据库文件无法打开时抛 StorageUnavailableException，启动随之失败
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @Primary
    public DataSource dataSource(ExpenseStoreProperties properties, HikariConfig hikari) {
        Path database = properties.databasePath();
        createParentDirectories(database);

        hikari.setJdbcUrl(properties.jdbcUrl());
        hikari.setDriverClassName(SQLITE_DRIVER);
        // 中文：expense.store.hikari.maximum-pool-size 显式设置时优先
        // English: An explicit expense.store.hikari.maximum-pool-size wins over expense.store.maximum-pool-size
        if (hikari.getMaximumPoolSize() < 1) {
            hikari.setMaximumPoolSize(properties.getMaximumPoolSize());
        }
        if (hikari.getPoolName() == null) {
            hikari.setPoolName("expense-store");
        }
        // 中文：SQLite 驱动从连接属性读取 pragma
        // English: The SQLite driver reads pragmas from connection properties
        hikari.addDataSourceProperty("busy_timeout", String.valueOf(properties.getBusyTimeout()));
        hikari.addDataSourceProperty("journal_mode", properties.getJournalMode());

        log.info("Opening expense store at {} / 打开费用存储文件 {}", database, database);
        try {
            return new HikariDataSource(hikari);
        } catch (HikariPool.PoolInitializationException ex) {
            log.error("Unable to open expense store at {} / 无法打开费用存储文件 {}", database, database, ex);
            throw new StorageUnavailableException("openDataSource", ex);
        }
    }

    private static void createParentDirectories(Path database) {
        Path parent = database.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to create directory for expense store: " + parent, ex);
        }
    }
}
