package com.ai.scheduling.dto;

import java.time.LocalDate;

public record SearchWindow(String resourceId, LocalDate from, LocalDate to) {

    public SearchWindow {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId is required");
        }
        if (from == null || to == null || to.isBefore(from)) {
            throw new IllegalArgumentException("Search window must have from <= to");
        }
    }

    public static SearchWindow days(String resourceId, LocalDate from, int daysAhead) {
        return new SearchWindow(resourceId, from, from.plusDays(daysAhead));
    }
}
