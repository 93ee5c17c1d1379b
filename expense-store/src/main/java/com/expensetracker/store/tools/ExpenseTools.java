package com.expensetracker.store.tools;

import com.expensetracker.store.catalog.CategoryCatalog;
import com.expensetracker.store.domain.CategoryTotal;
import com.expensetracker.store.domain.Expense;
import com.expensetracker.store.domain.NewExpense;
import com.expensetracker.store.service.ExpenseStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Objects;

/**
 * 类说明 / Class Description:
 * 中文：与传输层无关的工具操作面（add_expense、list_expenses、summarize 以及 expense://categories 资源），
 * 参数与结果均为可由 Jackson 直接序列化的记录类型。
 * English: Transport-independent tool surface (add_expense, list_expenses, summarize and the expense://categories
 * resource); arguments and results are Jackson-serializable records.
 *
 * 使用场景 / Use Cases:
 * 中文：宿主传输层完成参数反序列化与必填校验后调用；存储异常原样向上抛出。
 * English: Called by the hosting transport after it deserializes arguments and enforces required ones; storage
 * failures propagate unchanged.
 */
@Slf4j
@Component
public class ExpenseTools {

    public static final String ADD_EXPENSE = "add_expense";
    public static final String LIST_EXPENSES = "list_expenses";
    public static final String SUMMARIZE = "summarize";

    private final ExpenseStore expenseStore;
    private final CategoryCatalog categoryCatalog;

    public ExpenseTools(ExpenseStore expenseStore, CategoryCatalog categoryCatalog) {
        this.expenseStore = expenseStore;
        this.categoryCatalog = categoryCatalog;
    }

    /**
     * Add a new expense entry to the database.
     */
    public AddExpenseResult addExpense(AddExpenseArgs args) {
        log.debug("Tool {} invoked with {}", ADD_EXPENSE, args);
        Objects.requireNonNull(args.amount(), "amount must not be null");
        long id = expenseStore.create(new NewExpense(
                args.date(), args.amount(), args.category(), args.subcategory(), args.note()));
        return AddExpenseResult.ok(id);
    }

    /**
     * List expense entries within an inclusive date range.
     */
    public List<Expense> listExpenses(ListExpensesArgs args) {
        log.debug("Tool {} invoked with {}", LIST_EXPENSES, args);
        return expenseStore.listByDateRange(args.startDate(), args.endDate());
    }

    /**
     * Summarize expenses by category within an inclusive date range.
     * An absent or empty category means no filter.
     */
    public List<CategoryTotal> summarize(SummarizeArgs args) {
        log.debug("Tool {} invoked with {}", SUMMARIZE, args);
        String category = StringUtils.hasLength(args.category()) ? args.category() : null;
        return expenseStore.summarize(args.startDate(), args.endDate(), category);
    }

    /**
     * Raw JSON of the {@value CategoryCatalog#URI} resource.
     */
    public String categories() {
        return categoryCatalog.read();
    }
}
