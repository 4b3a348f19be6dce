package com.ecommercedata.scraper;

import java.util.List;

/**
 * Selector chain for one extracted field.
 * <p>
 * Selectors are tried in order against a record's container node; the first one that yields a
 * non-blank value wins. When {@code attribute} is set the value is read from that attribute
 * (resolved against the document base URI) instead of the element text.
 */
public final class FieldRule {
    public final String fieldName;
    public final List<String> selectors;
    public final String attribute;

    public FieldRule(String fieldName, List<String> selectors, String attribute) {
        this.fieldName = fieldName;
        this.selectors = List.copyOf(selectors);
        this.attribute = attribute;
    }

    public static FieldRule text(String fieldName, String... selectors) {
        return new FieldRule(fieldName, List.of(selectors), null);
    }

    public static FieldRule attribute(String fieldName, String attribute, String... selectors) {
        return new FieldRule(fieldName, List.of(selectors), attribute);
    }

    public boolean readsAttribute() {
        return attribute != null && !attribute.isEmpty();
    }

    @Override
    public String toString() {
        return "FieldRule[" + fieldName + " <- " + selectors + (readsAttribute() ? " @" + attribute : "") + "]";
    }
}
