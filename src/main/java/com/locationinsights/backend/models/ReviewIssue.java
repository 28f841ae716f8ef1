package com.locationinsights.backend.models;

/**
 * Complaint categories detected from review text.
 */
public enum ReviewIssue {
    FOOD("issue_food"),
    SERVICE("issue_service"),
    CLEANLINESS("issue_cleanliness"),
    PRICE("issue_price");

    private final String columnName;

    ReviewIssue(String columnName) {
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
