package com.expensetracker.store.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Arguments of the {@code summarize} tool; {@code category} is optional.
 */
public record SummarizeArgs(@JsonProperty("start_date") String startDate,
                            @JsonProperty("end_date") String endDate,
                            String category) {
}
