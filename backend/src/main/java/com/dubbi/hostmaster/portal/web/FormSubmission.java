package com.dubbi.hostmaster.portal.web;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Fixed-format form body: {@code name=value} pairs joined by {@code &}, in insertion order.
 * Values are written verbatim. The portal expects raw legacy-encoded text and some
 * pre-escaped button captions ({@code %81%40...}), so no percent-encoding is applied here.
 */
public final class FormSubmission {
    private final List<Map.Entry<String, String>> fields = new ArrayList<>();

    public static FormSubmission create() {
        return new FormSubmission();
    }

    public FormSubmission add(String name, String value) {
        fields.add(Map.entry(name, value == null ? "" : value));
        return this;
    }

    public FormSubmission flag(String name, boolean on) {
        return add(name, on ? "on" : "");
    }

    public List<Map.Entry<String, String>> fields() {
        return Collections.unmodifiableList(fields);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> field : fields) {
            if (sb.length() > 0) sb.append('&');
            sb.append(field.getKey()).append('=').append(field.getValue());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        // values may hold personal data; only names are printed
        return "FormSubmission" + fields.stream().map(Map.Entry::getKey).toList();
    }
}
