package com.expensetracker.store.tools;

public record AddExpenseResult(String status, long id) {

    public static AddExpenseResult ok(long id) {
        return new AddExpenseResult("ok", id);
    }
}
