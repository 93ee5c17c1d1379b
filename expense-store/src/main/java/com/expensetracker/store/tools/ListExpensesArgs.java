package com.expensetracker.store.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Arguments of the {@code list_expenses} tool; both bounds are inclusive.
 */
public record ListExpensesArgs(@JsonProperty("start_date") String startDate,
                               @JsonProperty("end_date") String endDate) {
}
