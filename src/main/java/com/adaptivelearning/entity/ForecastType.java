package com.adaptivelearning.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ForecastType {
    SALES("sales"),
    QUANTITY("quantity"),
    STOCK("stock"),
    CASH_FLOW("cash_flow");

    private final String wireName;

    ForecastType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
