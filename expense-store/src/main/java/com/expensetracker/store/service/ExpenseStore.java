package com.expensetracker.store.service;

import com.expensetracker.common.tx.TransactionExecutor;
import com.expensetracker.monitoring.Monitored;
import com.expensetracker.store.domain.CategoryTotal;
import com.expensetracker.store.domain.Expense;
import com.expensetracker.store.domain.NewExpense;
import com.expensetracker.store.repository.ExpenseRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * 费用存储的核心服务：新增、按日期区间列出、按分类汇总。
 * <p>
 * 每个操作在独立事务中借用一个连接执行，调用之间没有会话状态；存储失败统一抛出
 * {@link com.expensetracker.common.exception.StorageUnavailableException}，不存在部分成功。
 * 实例由 {@link com.expensetracker.store.config.StoreConfiguration} 在建表完成后创建。
 */
@Slf4j
public class ExpenseStore {

    private final ExpenseRepository expenseRepository;
    private final TransactionExecutor transactionExecutor;

    public ExpenseStore(ExpenseRepository expenseRepository, TransactionExecutor transactionExecutor) {
        this.expenseRepository = expenseRepository;
        this.transactionExecutor = transactionExecutor;
    }

    /**
     * 新增一条费用记录。
     *
     * @param expense 已完成可选字段默认值解析的新增请求
     * @return 存储分配的自增 ID，严格递增且永不复用
     */
    @Monitored("create")
    public long create(NewExpense expense) {
        Objects.requireNonNull(expense, "expense must not be null");
        long id = transactionExecutor.execute("create", () -> expenseRepository.insert(expense));
        log.debug("Created expense {} dated {} in category '{}'", id, expense.date(), expense.category());
        return id;
    }

    @Monitored("create")
    public long create(String date, double amount, String category, String subcategory, String note) {
        return create(new NewExpense(date, amount, category, subcategory, note));
    }

    /**
     * 列出 [startDate, endDate] 闭区间内的记录，按 ID 升序（即插入顺序）而非日期排序。
     * startDate 大于 endDate 时返回空列表。
     */
    @Monitored("listByDateRange")
    public List<Expense> listByDateRange(String startDate, String endDate) {
        requireRange(startDate, endDate);
        return transactionExecutor.execute("listByDateRange",
                () -> expenseRepository.findByDateBetween(startDate, endDate));
    }

    /**
     * 按分类汇总 [startDate, endDate] 闭区间内的金额，结果按分类名升序；没有匹配记录的分类不会出现。
     *
     * @param category 非 null 时只统计该分类（精确匹配，区分大小写）
     */
    @Monitored("summarize")
    public List<CategoryTotal> summarize(String startDate, String endDate, String category) {
        requireRange(startDate, endDate);
        return transactionExecutor.execute("summarize",
                () -> expenseRepository.sumByCategory(startDate, endDate, category));
    }

    @Monitored("summarize")
    public List<CategoryTotal> summarize(String startDate, String endDate) {
        return summarize(startDate, endDate, null);
    }

    private static void requireRange(String startDate, String endDate) {
        Objects.requireNonNull(startDate, "startDate must not be null");
        Objects.requireNonNull(endDate, "endDate must not be null");
    }
}
