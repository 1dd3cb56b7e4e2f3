package com.example.konvertor.application.service;

import com.example.konvertor.domain.exception.MissingRequiredColumnsException;
import com.example.konvertor.domain.model.AccountingDocument;
import com.example.konvertor.domain.model.CanonicalColumn;
import com.example.konvertor.domain.model.Cells;
import com.example.konvertor.domain.model.DocumentAttributes;
import com.example.konvertor.domain.model.LineItem;
import com.example.konvertor.domain.model.NormalizedTable;
import com.example.konvertor.domain.model.Side;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Application-layer service that maps normalized table rows onto accounting line items.
 * Every row yields a debit item and a credit item; all debit items are emitted first, followed by all
 * credit items, each group in row order.
 */
@Service
public class DocumentAssemblyService {

    private static final Logger log = LoggerFactory.getLogger(DocumentAssemblyService.class);

    /**
     * Builds the accounting document.
     *
     * @param table      normalized table
     * @param attributes document header attributes
     * @return assembled document
     * @throws MissingRequiredColumnsException when any of the six accounting columns is absent
     */
    public AccountingDocument assemble(NormalizedTable table, DocumentAttributes attributes) {
        if (table.header().isEmpty() && table.rows().isEmpty()) {
            return new AccountingDocument(attributes, List.of());
        }
        Map<CanonicalColumn, Integer> columns = resolveColumns(table.header());

        List<LineItem> debitItems = new ArrayList<>(table.rows().size());
        List<LineItem> creditItems = new ArrayList<>(table.rows().size());
        for (List<String> row : table.rows()) {
            String itemText = value(row, columns, CanonicalColumn.NAME);
            String costCenter = value(row, columns, CanonicalColumn.COST_CENTER);
            String order = value(row, columns, CanonicalColumn.ORDER);
            String amount = normalizeAmount(value(row, columns, CanonicalColumn.ACTIVITY));

            debitItems.add(new LineItem(amount, value(row, columns, CanonicalColumn.DEBIT_ACCOUNT), Side.DEBIT,
                    costCenter, order, itemText));
            creditItems.add(new LineItem(amount, value(row, columns, CanonicalColumn.CREDIT_ACCOUNT), Side.CREDIT,
                    costCenter, order, itemText));
        }

        List<LineItem> items = new ArrayList<>(debitItems.size() + creditItems.size());
        items.addAll(debitItems);
        items.addAll(creditItems);
        log.debug("Assembled {} line item(s) from {} row(s)", items.size(), table.rows().size());
        return new AccountingDocument(attributes, items);
    }

    /**
     * Converts an amount to a dot-decimal form: spaces are removed and a single decimal comma
     * becomes a period when the value has no period. Other shapes are passed through.
     *
     * @param value raw amount
     * @return normalized amount
     */
    public static String normalizeAmount(String value) {
        String amount = value == null ? "" : value.strip().replace(" ", "");
        long commas = amount.chars().filter(ch -> ch == ',').count();
        if (commas == 1 && amount.indexOf('.') < 0) {
            amount = amount.replace(',', '.');
        }
        return amount;
    }

    private Map<CanonicalColumn, Integer> resolveColumns(List<String> header) {
        Map<CanonicalColumn, Integer> columns = new EnumMap<>(CanonicalColumn.class);
        for (CanonicalColumn column : CanonicalColumn.values()) {
            for (int i = 0; i < header.size(); i++) {
                if (column.matches(header.get(i))) {
                    columns.put(column, i);
                    break;
                }
            }
        }
        if (columns.size() < CanonicalColumn.values().length) {
            List<String> missing = new ArrayList<>();
            for (CanonicalColumn column : CanonicalColumn.values()) {
                if (!columns.containsKey(column)) {
                    missing.add(column.label());
                }
            }
            throw new MissingRequiredColumnsException(missing, header.stream().map(CanonicalColumn::fold).toList());
        }
        return columns;
    }

    private String value(List<String> row, Map<CanonicalColumn, Integer> columns, CanonicalColumn column) {
        return Cells.get(row, columns.get(column)).strip();
    }
}
