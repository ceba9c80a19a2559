package com.dubbi.hostmaster.portal.web;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of one listing: ordered columns, optional data-row CSS class,
 * the row layout and whether the first group is a repeated header.
 */
public record RecordSchema(
        String name,
        List<Column> columns,
        String rowClass,
        RowLayout layout,
        boolean dropFirstGroup
) {
    public record Column(String field, FieldRule rule) {}

    public RecordSchema {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("schema " + name + " has no columns");
        }
        columns = List.copyOf(columns);
    }

    public int width() {
        return columns.size();
    }

    public Column column(int index) {
        return columns.get(index);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<Column> columns = new ArrayList<>();
        private String rowClass;
        private RowLayout layout = RowLayout.CELL_STREAM;
        private boolean dropFirstGroup = true;

        private Builder(String name) {
            this.name = name;
        }

        public Builder text(String field) {
            columns.add(new Column(field, FieldRule.TEXT));
            return this;
        }

        public Builder textWithLink(String field) {
            columns.add(new Column(field, FieldRule.TEXT_WITH_LINK));
            return this;
        }

        public Builder ratio(String field) {
            columns.add(new Column(field, FieldRule.RATIO));
            return this;
        }

        public Builder rowClass(String cssClass) {
            this.rowClass = cssClass;
            return this;
        }

        public Builder layout(RowLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder keepFirstGroup() {
            this.dropFirstGroup = false;
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(name, columns, rowClass, layout, dropFirstGroup);
        }
    }
}
