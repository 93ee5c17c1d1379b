package com.expensetracker.store.schema;

import com.expensetracker.common.tx.TransactionExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 类说明 / Class Description:
 * 中文：确保 expenses 表存在且列定义与默认值正确；幂等，可重复甚至并发调用，从不删除或修改已有数据。
 * English: Ensures the expenses table exists with the expected columns and defaults; idempotent, safe to call
 * repeatedly or concurrently, never drops or alters existing data.
 *
 * 使用场景 / Use Cases:
 * 中文：宿主进程在任何存储操作可达之前显式调用一次（见 StoreConfiguration）。
 * English: Invoked once, explicitly, by the hosting process before any store operation is reachable (see StoreConfiguration).
 */
@Slf4j
public class SchemaManager {

    public static final String TABLE = "expenses";

    static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS expenses(
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                date TEXT NOT NULL,
                amount REAL NOT NULL,
                category TEXT NOT NULL,
                subcategory TEXT DEFAULT '',
                note TEXT DEFAULT ''
            )
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionExecutor transactionExecutor;

    public SchemaManager(JdbcTemplate jdbcTemplate, TransactionExecutor transactionExecutor) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionExecutor = transactionExecutor;
    }

    /**
     * 方法说明 / Method Description:
     * 中文：以 create-if-not-exists 语义建表。
     * English: Create the table with create-if-not-exists semantics.
     *
     * 异常 / Exceptions:
     * 中文/英文：存储介质无法打开或写入时抛 StorageUnavailableException，启动随之失败，不做重试
     */
    public void ensureSchema() {
        transactionExecutor.executeWithoutResult("ensureSchema", () -> jdbcTemplate.execute(CREATE_TABLE_SQL));
        log.info("Schema ensured for table {} / 数据表 {} 已就绪", TABLE, TABLE);
    }
}
