package com.example.konvertor.application.service;

import com.example.konvertor.domain.model.AccountingDocument;
import com.example.konvertor.domain.model.LineItem;

import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes an {@link AccountingDocument} as {@code uctovne_doklady} XML.
 * <p>
 * The output starts with {@code <?xml version="1.0"?>}, indents two spaces per level, has no blank lines
 * and ends with a single newline. Attributes are written in a fixed order; empty values are skipped unless
 * empty attributes are kept explicitly.
 */
@Service
public class DocumentXmlSerializer {

    static final String DECLARATION = "<?xml version=\"1.0\"?>";
    static final String ROOT_ELEMENT = "uctovne_doklady";
    static final String DOCUMENT_ELEMENT = "uctovny_doklad";
    static final String ITEM_ELEMENT = "polozka_ud";
    private static final String INDENT = "  ";

    /**
     * Serializes the document.
     *
     * @param document  assembled document
     * @param keepEmpty whether empty attribute values are written as {@code attr=""}
     * @return XML text
     */
    public String serialize(AccountingDocument document, boolean keepEmpty) {
        StringBuilder builder = new StringBuilder();
        builder.append(DECLARATION).append('\n');
        builder.append('<').append(ROOT_ELEMENT).append(">\n");

        builder.append(INDENT).append('<').append(DOCUMENT_ELEMENT);
        appendAttributes(builder, document.attributes().asMap(), keepEmpty);
        List<LineItem> items = document.items();
        if (items.isEmpty()) {
            builder.append("/>\n");
        } else {
            builder.append(">\n");
            for (LineItem item : items) {
                builder.append(INDENT).append(INDENT).append('<').append(ITEM_ELEMENT);
                appendAttributes(builder, itemAttributes(item), keepEmpty);
                builder.append("/>\n");
            }
            builder.append(INDENT).append("</").append(DOCUMENT_ELEMENT).append(">\n");
        }

        builder.append("</").append(ROOT_ELEMENT).append(">\n");
        return builder.toString();
    }

    private Map<String, String> itemAttributes(LineItem item) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("suma", item.amount());
        attributes.put("ucet", item.account());
        attributes.put("strana", item.side() != null ? item.side().code() : null);
        attributes.put("os", item.costCenter());
        attributes.put("eo", item.order());
        attributes.put("text_pud", item.itemText());
        return attributes;
    }

    private void appendAttributes(StringBuilder builder, Map<String, String> attributes, boolean keepEmpty) {
        attributes.forEach((name, raw) -> {
            String value = raw == null ? "" : raw.strip();
            if (value.isEmpty() && !keepEmpty) {
                return;
            }
            builder.append(' ').append(name).append("=\"").append(escape(value)).append('"');
        });
    }

    /**
     * Escapes an attribute value. Characters XML 1.0 does not allow (control characters other than
     * tab, line feed and carriage return, {@code U+FFFE}, {@code U+FFFF}) are dropped.
     *
     * @param value raw attribute value
     * @return value safe to place between double quotes
     */
    static String escape(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\n' -> escaped.append("&#10;");
                case '\r' -> escaped.append("&#13;");
                case '\t' -> escaped.append("&#9;");
                default -> {
                    if (isAllowedInXml(ch)) {
                        escaped.append(ch);
                    }
                }
            }
        }
        return escaped.toString();
    }

    private static boolean isAllowedInXml(char ch) {
        return ch >= 0x20 && ch != '\uFFFE' && ch != '\uFFFF';
    }
}
