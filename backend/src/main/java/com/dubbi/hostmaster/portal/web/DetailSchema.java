package com.dubbi.hostmaster.portal.web;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caption → field table for title/value detail pages.
 * Several captions may map to one field because the portal spells some captions two ways.
 */
public record DetailSchema(String name, int tableDepth, Map<String, RecordSchema.Column> labels) {

    public DetailSchema {
        if (tableDepth < 1) throw new IllegalArgumentException("tableDepth must be >= 1");
        labels = Map.copyOf(labels);
    }

    public static Builder builder(String name, int tableDepth) {
        return new Builder(name, tableDepth);
    }

    /**
     * jsoup selector for cells nested at least {@code tableDepth} tables deep.
     */
    public String cellSelector() {
        return "table ".repeat(tableDepth) + "td";
    }

    public static final class Builder {
        private final String name;
        private final int tableDepth;
        private final Map<String, RecordSchema.Column> labels = new LinkedHashMap<>();

        private Builder(String name, int tableDepth) {
            this.name = name;
            this.tableDepth = tableDepth;
        }

        public Builder text(String field, String... captions) {
            return put(field, FieldRule.TEXT, captions);
        }

        public Builder textWithLink(String field, String... captions) {
            return put(field, FieldRule.TEXT_WITH_LINK, captions);
        }

        private Builder put(String field, FieldRule rule, String... captions) {
            for (String caption : captions) {
                labels.put(caption, new RecordSchema.Column(field, rule));
            }
            return this;
        }

        public DetailSchema build() {
            return new DetailSchema(name, tableDepth, labels);
        }
    }
}
