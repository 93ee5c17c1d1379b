package com.expensetracker.store.tools;

/**
 * Arguments of the {@code add_expense} tool. {@code subcategory} and {@code note} are optional.
 */
public record AddExpenseArgs(String date, Double amount, String category, String subcategory, String note) {
}
