package com.example.konvertor.domain.model;

/**
 * Leg of an accounting line item. The code is the value written to the {@code strana} attribute.
 */
public enum Side {
    DEBIT("M"),
    CREDIT("D");

    private final String code;

    Side(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
