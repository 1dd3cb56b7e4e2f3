package com.example.konvertor.domain.model;

import java.util.List;

/**
 * Assembled accounting document: header attributes plus line items where every debit item
 * precedes every credit item.
 */
public record AccountingDocument(
        DocumentAttributes attributes,
        List<LineItem> items
) {

    public AccountingDocument {
        items = items == null ? List.of() : List.copyOf(items);
        boolean creditSeen = false;
        for (LineItem item : items) {
            if (item.side() == Side.CREDIT) {
                creditSeen = true;
            } else if (creditSeen) {
                throw new IllegalArgumentException("Debit items must precede all credit items.");
            }
        }
    }
}
