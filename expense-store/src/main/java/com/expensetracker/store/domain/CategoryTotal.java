package com.expensetracker.store.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sum of expense amounts for one category within a date range.
 */
public record CategoryTotal(String category, @JsonProperty("total_amount") double totalAmount) {
}
