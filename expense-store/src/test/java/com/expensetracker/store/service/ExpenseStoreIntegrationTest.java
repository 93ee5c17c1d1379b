package com.expensetracker.store.service;

import com.expensetracker.store.AbstractExpenseStoreIntegrationTest;
import com.expensetracker.store.domain.CategoryTotal;
import com.expensetracker.store.domain.Expense;
import com.expensetracker.store.domain.NewExpense;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 测试目标：验证新增、区间列出与分类汇总的存储语义。
 * 知识点：闭区间字符串比较、可选字段默认空串、按 ID 排序、按分类分组求和。
 */
class ExpenseStoreIntegrationTest extends AbstractExpenseStoreIntegrationTest {

    @Autowired
    private ExpenseStore expenseStore;

    @Test
    void createdExpenseRoundTripsThroughRangeQuery() {
        long id = expenseStore.create("2024-03-10", 42.5, "food", "groceries", "weekly shop");

        List<Expense> found = expenseStore.listByDateRange("2024-03-10", "2024-03-10");

        assertThat(found).containsExactly(new Expense(id, "2024-03-10", 42.5, "food", "groceries", "weekly shop"));
    }

    @Test
    void omittedOptionalFieldsComeBackAsEmptyStrings() {
        expenseStore.create(NewExpense.of("2024-03-11", 3.0, "transport"));
        expenseStore.create("2024-03-11", 4.0, "transport", null, null);

        assertThat(expenseStore.listByDateRange("2024-03-11", "2024-03-11"))
                .hasSize(2)
                .allSatisfy(expense -> {
                    assertThat(expense.subcategory()).isNotNull().isEmpty();
                    assertThat(expense.note()).isNotNull().isEmpty();
                });
    }

    @Test
    void storedOptionalColumnsAreNeverNull() {
        expenseStore.create(NewExpense.of("2024-03-12", 1.0, "misc"));

        Long nulls = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM expenses WHERE subcategory IS NULL OR note IS NULL", Long.class);

        assertThat(nulls).isZero();
    }

    @Test
    @DisplayName("Range is inclusive on both bounds and ordered by id")
    void rangeIsInclusiveOnBothBounds() {
        long first = expenseStore.create(NewExpense.of("2024-01-01", 1.0, "food"));
        long second = expenseStore.create(NewExpense.of("2024-01-15", 2.0, "food"));
        expenseStore.create(NewExpense.of("2024-02-01", 3.0, "food"));

        List<Expense> found = expenseStore.listByDateRange("2024-01-01", "2024-01-15");

        assertThat(found).extracting(Expense::id).containsExactly(first, second);
    }

    @Test
    void resultsFollowInsertionOrderNotDateOrder() {
        long late = expenseStore.create(NewExpense.of("2024-05-20", 1.0, "food"));
        long early = expenseStore.create(NewExpense.of("2024-05-01", 2.0, "food"));
        long middle = expenseStore.create(NewExpense.of("2024-05-10", 3.0, "food"));

        assertThat(expenseStore.listByDateRange("2024-05-01", "2024-05-31"))
                .extracting(Expense::id)
                .containsExactly(late, early, middle);
    }

    @Test
    void invertedRangeIsEmptyRatherThanAnError() {
        expenseStore.create(NewExpense.of("2024-02-01", 5.0, "food"));

        assertThat(expenseStore.listByDateRange("2024-03-01", "2024-01-01")).isEmpty();
        assertThat(expenseStore.summarize("2024-03-01", "2024-01-01")).isEmpty();
    }

    @Test
    void noMatchesYieldsEmptyList() {
        assertThat(expenseStore.listByDateRange("2030-01-01", "2030-12-31")).isEmpty();
        assertThat(expenseStore.summarize("2030-01-01", "2030-12-31", "food")).isEmpty();
    }

    @Test
    void summarizeGroupsByCategoryInAscendingOrder() {
        seedAggregationRows();

        assertThat(expenseStore.summarize("2024-01-01", "2024-01-03")).containsExactly(
                new CategoryTotal("food", 15.0),
                new CategoryTotal("transport", 20.0));
    }

    @Test
    void summarizeRestrictsToRequestedCategory() {
        seedAggregationRows();

        assertThat(expenseStore.summarize("2024-01-01", "2024-01-03", "food"))
                .containsExactly(new CategoryTotal("food", 15.0));
    }

    @Test
    void categoryFilterIsExactAndCaseSensitive() {
        seedAggregationRows();
        expenseStore.create(NewExpense.of("2024-01-02", 7.0, "Food"));

        assertThat(expenseStore.summarize("2024-01-01", "2024-01-03", "Food"))
                .containsExactly(new CategoryTotal("Food", 7.0));
        assertThat(expenseStore.summarize("2024-01-01", "2024-01-03", "foo")).isEmpty();
        assertThat(expenseStore.summarize("2024-01-01", "2024-01-03"))
                .extracting(CategoryTotal::category)
                .containsExactly("Food", "food", "transport");
    }

    @Test
    void categoriesWithoutRowsInRangeNeverAppear() {
        seedAggregationRows();
        expenseStore.create(NewExpense.of("2024-06-01", 99.0, "travel"));

        assertThat(expenseStore.summarize("2024-01-01", "2024-01-31"))
                .extracting(CategoryTotal::category)
                .doesNotContain("travel");
    }

    @Test
    void summationKeepsFractionalAndNegativeAmounts() {
        expenseStore.create(NewExpense.of("2024-04-01", 0.25, "food"));
        expenseStore.create(NewExpense.of("2024-04-02", 0.5, "food"));
        expenseStore.create(NewExpense.of("2024-04-03", -5.25, "refunds"));

        List<CategoryTotal> totals = expenseStore.summarize("2024-04-01", "2024-04-30");

        assertThat(totals).containsExactly(
                new CategoryTotal("food", 0.75),
                new CategoryTotal("refunds", -5.25));
    }

    @Test
    void emptyCategoryIsPersistedAsGiven() {
        long id = expenseStore.create(NewExpense.of("2024-07-01", 8.0, ""));

        assertThat(expenseStore.listByDateRange("2024-07-01", "2024-07-01"))
                .singleElement()
                .satisfies(expense -> {
                    assertThat(expense.id()).isEqualTo(id);
                    assertThat(expense.category()).isEmpty();
                });
        assertThat(expenseStore.summarize("2024-07-01", "2024-07-01"))
                .containsExactly(new CategoryTotal("", 8.0));
    }

    @Test
    void successiveIdsStrictlyIncreaseAndAreNeverReused() {
        long first = expenseStore.create(NewExpense.of("2024-08-01", 1.0, "food"));
        long second = expenseStore.create(NewExpense.of("2024-08-01", 1.0, "food"));
        jdbcTemplate.update("DELETE FROM expenses WHERE id = ?", second);

        long third = expenseStore.create(NewExpense.of("2024-08-01", 1.0, "food"));

        assertThat(second).isGreaterThan(first);
        assertThat(third).isGreaterThan(second);
    }

    @Test
    void nullRangeBoundsAreRejected() {
        assertThatThrownBy(() -> expenseStore.listByDateRange(null, "2024-01-01"))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("startDate");
        assertThatThrownBy(() -> expenseStore.summarize("2024-01-01", null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("endDate");
    }

    private void seedAggregationRows() {
        expenseStore.create(NewExpense.of("2024-01-01", 10.0, "food"));
        expenseStore.create(NewExpense.of("2024-01-02", 5.0, "food"));
        expenseStore.create(NewExpense.of("2024-01-03", 20.0, "transport"));
    }
}
