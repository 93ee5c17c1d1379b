package com.expensetracker.store.domain;

import java.util.Objects;

/**
 * Insertion request for a single expense.
 * <p>
 * Optional fields are resolved here: a {@code null} subcategory or note becomes {@code ""}, so
 * the storage layer never sees the difference between "missing" and "empty". Required fields may
 * be empty strings; they are persisted as given.
 */
public record NewExpense(String date, double amount, String category, String subcategory, String note) {

    public NewExpense {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(category, "category must not be null");
        subcategory = orEmpty(subcategory);
        note = orEmpty(note);
    }

    public static NewExpense of(String date, double amount, String category) {
        return new NewExpense(date, amount, category, null, null);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
