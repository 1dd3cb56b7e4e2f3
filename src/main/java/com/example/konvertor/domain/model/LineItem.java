package com.example.konvertor.domain.model;

/**
 * One leg of a source row inside an accounting document ({@code polozka_ud}).
 */
public record LineItem(
        String amount,
        String account,
        Side side,
        String costCenter,
        String order,
        String itemText
) {
}
