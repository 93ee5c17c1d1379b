package com.expensetracker.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * 类说明 / Class Description:
 * 中文：费用存储的显式配置对象，绑定 expense.store.*，描述 SQLite 文件位置与连接参数。
 * English: Explicit expense store configuration bound from expense.store.*, describing the SQLite file and connection parameters.
 *
 * 使用场景 / Use Cases:
 * 中文：由 DataSourceConfig 在启动期读取并构建连接池，替代进程级的数据库路径常量。
 * English: Read by DataSourceConfig at startup to build the pool, replacing process-wide database path constants.
 */
@ConfigurationProperties(prefix = "expense.store")
public class ExpenseStoreProperties {

    /** SQLite 数据库文件路径。 */
    private String path = "./data/expenses.db";

    /** SQLite busy_timeout（毫秒），并发写入时等待写锁的最长时间。 */
    private int busyTimeout = 5000;

    /** SQLite journal_mode。 */
    private String journalMode = "WAL";

    /** 连接池最大连接数。 */
    private int maximumPoolSize = 4;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getBusyTimeout() {
        return busyTimeout;
    }

    public void setBusyTimeout(int busyTimeout) {
        this.busyTimeout = busyTimeout;
    }

    public String getJournalMode() {
        return journalMode;
    }

    public void setJournalMode(String journalMode) {
        this.journalMode = journalMode;
    }

    public int getMaximumPoolSize() {
        return maximumPoolSize;
    }

    public void setMaximumPoolSize(int maximumPoolSize) {
        this.maximumPoolSize = maximumPoolSize;
    }

    /**
     * @return 规范化后的数据库文件绝对路径
     */
    public Path databasePath() {
        return Path.of(path).toAbsolutePath().normalize();
    }

    /**
     * @return 指向数据库文件的 JDBC URL
     */
    public String jdbcUrl() {
        return "jdbc:sqlite:" + databasePath();
    }
}
