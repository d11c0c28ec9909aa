package com.adaptivelearning.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Business area a piece of chart feedback belongs to, inferred from keywords
 * in the chart title (case-insensitive substring match).
 */
public enum FeedbackDomain {
    SALES(List.of("sales", "revenue", "product comparison", "regional sales")),
    INVENTORY(List.of("stock", "inventory", "reorder", "turnover")),
    FINANCE(List.of("profit", "expense", "cash flow", "margin")),
    CUSTOMER(List.of("customer", "segment", "retention", "lifetime")),
    PRODUCT(List.of("product performance", "quantity", "demand"));

    private final List<String> keywords;

    FeedbackDomain(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() {
        return keywords;
    }

    public boolean matches(String chartTitle) {
        if (chartTitle == null || chartTitle.isBlank()) {
            return false;
        }
        String title = chartTitle.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(title::contains);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
