package com.example.konvertor.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Header attributes of an accounting document ({@code uctovny_doklad}).
 * Values are stored trimmed; {@code null} inputs become empty strings.
 */
public record DocumentAttributes(
        String documentNumber,
        String documentDate,
        String mandateId,
        String documentKind,
        String documentType,
        String documentText
) {

    public static final String DOCUMENT_NUMBER = "cislo_ud";
    public static final String DOCUMENT_DATE = "datum_ud";
    public static final String MANDATE_ID = "mandant_id";
    public static final String DOCUMENT_KIND = "druh_ud";
    public static final String DOCUMENT_TYPE = "typ_ud";
    public static final String DOCUMENT_TEXT = "text_ud";

    /**
     * Attribute names in serialization order.
     */
    public static final List<String> NAMES = List.of(
            DOCUMENT_NUMBER, DOCUMENT_DATE, MANDATE_ID, DOCUMENT_KIND, DOCUMENT_TYPE, DOCUMENT_TEXT);

    public DocumentAttributes {
        documentNumber = trim(documentNumber);
        documentDate = trim(documentDate);
        mandateId = trim(mandateId);
        documentKind = trim(documentKind);
        documentType = trim(documentType);
        documentText = trim(documentText);
    }

    /**
     * Builds the attributes from a map keyed by the XML attribute names.
     *
     * @param values attribute values, missing keys are treated as empty
     * @return populated attributes
     */
    public static DocumentAttributes fromMap(Map<String, String> values) {
        Map<String, String> source = values == null ? Map.of() : values;
        return new DocumentAttributes(
                source.get(DOCUMENT_NUMBER),
                source.get(DOCUMENT_DATE),
                source.get(MANDATE_ID),
                source.get(DOCUMENT_KIND),
                source.get(DOCUMENT_TYPE),
                source.get(DOCUMENT_TEXT));
    }

    /**
     * @return attribute values keyed by XML attribute name, in serialization order
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(DOCUMENT_NUMBER, documentNumber);
        map.put(DOCUMENT_DATE, documentDate);
        map.put(MANDATE_ID, mandateId);
        map.put(DOCUMENT_KIND, documentKind);
        map.put(DOCUMENT_TYPE, documentType);
        map.put(DOCUMENT_TEXT, documentText);
        return map;
    }

    /**
     * @return names of the attributes whose value is empty
     */
    public List<String> missingNames() {
        List<String> missing = new ArrayList<>();
        asMap().forEach((name, value) -> {
            if (value.isEmpty()) {
                missing.add(name);
            }
        });
        return missing;
    }

    private static String trim(String value) {
        return value == null ? "" : value.strip();
    }
}
