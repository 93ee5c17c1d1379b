package com.expensetracker.store.domain;

/**
 * One persisted expense row. {@code subcategory} and {@code note} are never null; absent values
 * are stored and returned as empty strings.
 */
public record Expense(long id, String date, double amount, String category, String subcategory, String note) {
}
