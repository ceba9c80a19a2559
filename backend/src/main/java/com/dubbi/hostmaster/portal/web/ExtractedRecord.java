package com.dubbi.hostmaster.portal.web;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record produced by {@link TableExtractor}: field texts, captured links and decoded ratios.
 */
public final class ExtractedRecord {
    private final Map<String, String> texts = new LinkedHashMap<>();
    private final Map<String, String> links = new LinkedHashMap<>();
    private final Map<String, RatioValue> ratios = new LinkedHashMap<>();
    private final Map<String, String> captions = new LinkedHashMap<>();

    void put(String field, String text) {
        texts.put(field, text);
    }

    void putLink(String field, String href) {
        links.put(field, href);
    }

    void putRatio(String field, RatioValue ratio) {
        ratios.put(field, ratio);
    }

    void putCaption(String field, String caption) {
        captions.put(field, caption);
    }

    public String text(String field) {
        return texts.getOrDefault(field, "");
    }

    /**
     * Absolute href captured for a link field, or empty when the cell had no link.
     */
    public String link(String field) {
        return links.getOrDefault(field, "");
    }

    public RatioValue ratio(String field) {
        return ratios.get(field);
    }

    /**
     * Portal caption that filled the field on a title/value page, or null.
     */
    public String caption(String field) {
        return captions.get(field);
    }

    public boolean has(String field) {
        return texts.containsKey(field);
    }

    public Map<String, String> texts() {
        return Collections.unmodifiableMap(texts);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedRecord other)) return false;
        return texts.equals(other.texts) && links.equals(other.links) && ratios.equals(other.ratios)
                && captions.equals(other.captions);
    }

    @Override
    public int hashCode() {
        return texts.hashCode() * 31 + links.hashCode();
    }

    @Override
    public String toString() {
        return "ExtractedRecord" + texts;
    }
}
