package com.changesentinel.core.model;

import java.time.LocalDate;

public record Classification(boolean relevant, LocalDate startDate, LocalDate endDate, String contact) {
    public Classification(boolean relevant, LocalDate startDate, LocalDate endDate) {
        this(relevant, startDate, endDate, null);
    }

    public Classification withStartDate(LocalDate value) {
        return new Classification(relevant, value, endDate, contact);
    }

    public Classification withContact(String value) {
        return new Classification(relevant, startDate, endDate, value);
    }

    public String dateRangeIssue() {
        if (startDate == null || endDate == null) {
            return null;
        }
        if (endDate.isEqual(startDate)) {
            return "end date equals start date";
        }
        return endDate.isBefore(startDate) ? "end date before start date" : null;
    }
}
