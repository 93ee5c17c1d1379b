package com.expensetracker.store.repository;

import com.expensetracker.store.domain.CategoryTotal;
import com.expensetracker.store.domain.Expense;
import com.expensetracker.store.domain.NewExpense;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * JDBC access to the expenses table. Dates are compared as strings, so {@code BETWEEN} is
 * inclusive on both bounds and an inverted range simply matches nothing.
 */
@Repository
public class ExpenseRepository {

    private static final String INSERT_SQL = """
            INSERT INTO expenses(date, amount, category, subcategory, note)
            VALUES (?, ?, ?, ?, ?)
            """;

    private static final String LAST_ID_SQL = "SELECT last_insert_rowid()";

    private static final String LIST_SQL = """
            SELECT id, date, amount, category, subcategory, note
            FROM expenses
            WHERE date BETWEEN ? AND ?
            ORDER BY id ASC
            """;

    private static final String SUMMARY_SQL = """
            SELECT category, SUM(amount) AS total_amount
            FROM expenses
            WHERE date BETWEEN ? AND ?
            """;

    private static final RowMapper<Expense> EXPENSE_ROW_MAPPER = (rs, rowNum) -> new Expense(
            rs.getLong("id"),
            rs.getString("date"),
            rs.getDouble("amount"),
            rs.getString("category"),
            rs.getString("subcategory"),
            rs.getString("note"));

    private static final RowMapper<CategoryTotal> TOTAL_ROW_MAPPER = (rs, rowNum) -> new CategoryTotal(
            rs.getString("category"),
            rs.getDouble("total_amount"));

    private final JdbcTemplate jdbcTemplate;

    public ExpenseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Inserts the row and returns its id. Must run inside a transaction: {@code last_insert_rowid()}
     * is connection scoped, so both statements have to share the bound connection.
     */
    public long insert(NewExpense expense) {
        jdbcTemplate.update(INSERT_SQL,
                expense.date(),
                expense.amount(),
                expense.category(),
                expense.subcategory(),
                expense.note());
        Long id = jdbcTemplate.queryForObject(LAST_ID_SQL, Long.class);
        if (id == null || id == 0L) {
            throw new IllegalStateException("No row id assigned for inserted expense");
        }
        return id;
    }

    public List<Expense> findByDateBetween(String startDate, String endDate) {
        return jdbcTemplate.query(LIST_SQL, EXPENSE_ROW_MAPPER, startDate, endDate);
    }

    /**
     * Totals per category; a non-null {@code category} narrows to exact, case-sensitive matches.
     */
    public List<CategoryTotal> sumByCategory(String startDate, String endDate, String category) {
        StringBuilder sql = new StringBuilder(SUMMARY_SQL);
        List<Object> params = new ArrayList<>(3);
        params.add(startDate);
        params.add(endDate);

        if (category != null) {
            sql.append("AND category = ?\n");
            params.add(category);
        }
        sql.append("GROUP BY category\nORDER BY category ASC");

        return jdbcTemplate.query(sql.toString(), TOTAL_ROW_MAPPER, params.toArray());
    }
}
