package com.dubbi.hostmaster.portal.web;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * 위치 기반 마크업에서 스키마에 따라 레코드를 추출한다.
 *
 * <ul>
 *   <li>행 모드: 목록 페이지의 데이터 셀을 순서대로 읽어 폭(width) 단위로 레코드를 만든다.
 *       첫 그룹은 반복되는 헤더이므로 버린다.</li>
 *   <li>제목/값 모드: 상세 페이지의 (제목 셀, 값 셀) 쌍을 캡션 표로 필드에 대응시킨다.
 *       모르는 캡션은 무시한다.</li>
 * </ul>
 *
 * 반환되는 시퀀스는 지연 평가되며 반복할 때마다 처음부터 다시 계산된다.
 */
public class TableExtractor {

    public Records rows(Document page, RecordSchema schema) {
        return new Records(page, schema);
    }

    public ExtractedRecord titleValues(Document page, DetailSchema schema) {
        ExtractedRecord record = new ExtractedRecord();
        Elements cells = page.select(schema.cellSelector());
        for (int i = 0; i + 1 < cells.size(); i += 2) {
            String caption = cells.get(i).text().trim();
            RecordSchema.Column column = schema.labels().get(caption);
            if (column == null) continue;
            apply(record, column, cells.get(i + 1));
            record.putCaption(column.field(), caption);
        }
        return record;
    }

    static void apply(ExtractedRecord record, RecordSchema.Column column, Element cell) {
        String text = cell.text().trim();
        record.put(column.field(), text);
        switch (column.rule()) {
            case TEXT_WITH_LINK -> record.putLink(column.field(), firstLink(cell));
            case RATIO -> record.putRatio(column.field(), RatioValue.parse(text));
            case TEXT -> { }
        }
    }

    static String firstLink(Element cell) {
        Element a = cell.selectFirst("a[href]");
        if (a == null) return "";
        String abs = a.absUrl("href");
        return abs.isEmpty() ? a.attr("href") : abs;
    }

    /**
     * Restartable sequence over one listing page.
     */
    public static final class Records implements Iterable<ExtractedRecord> {
        private final Document page;
        private final RecordSchema schema;

        private Records(Document page, RecordSchema schema) {
            this.page = page;
            this.schema = schema;
        }

        @Override
        public Iterator<ExtractedRecord> iterator() {
            Elements cells = page.select("td");
            if (schema.rowClass() != null) {
                cells.removeIf(td -> !schema.rowClass().equals(td.attr("class")));
            }
            return schema.layout() == RowLayout.CELL_POSITION
                    ? new PositionIterator(cells, schema)
                    : new StreamIterator(cells, schema);
        }

        public Stream<ExtractedRecord> stream() {
            return StreamSupport.stream(
                    Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
        }

        public List<ExtractedRecord> toList() {
            return stream().toList();
        }
    }

    private abstract static class GroupIterator implements Iterator<ExtractedRecord> {
        final List<Element> cells;
        final RecordSchema schema;
        int cursor;
        int groups;
        ExtractedRecord next;

        GroupIterator(List<Element> cells, RecordSchema schema) {
            this.cells = cells;
            this.schema = schema;
        }

        /**
         * Advances the cursor until one group completes; returns null when cells run out.
         */
        abstract ExtractedRecord nextGroup();

        @Override
        public boolean hasNext() {
            while (next == null) {
                ExtractedRecord group = nextGroup();
                if (group == null) return false;
                groups++;
                if (groups == 1 && schema.dropFirstGroup()) continue;
                next = group;
            }
            return true;
        }

        @Override
        public ExtractedRecord next() {
            if (!hasNext()) throw new NoSuchElementException();
            ExtractedRecord out = next;
            next = null;
            return out;
        }
    }

    private static final class StreamIterator extends GroupIterator {
        StreamIterator(List<Element> cells, RecordSchema schema) {
            super(cells, schema);
        }

        @Override
        ExtractedRecord nextGroup() {
            int width = schema.width();
            if (cells.size() - cursor < width) return null;
            ExtractedRecord record = new ExtractedRecord();
            for (int i = 0; i < width; i++) {
                apply(record, schema.column(i), cells.get(cursor++));
            }
            return record;
        }
    }

    private static final class PositionIterator extends GroupIterator {
        PositionIterator(List<Element> cells, RecordSchema schema) {
            super(cells, schema);
        }

        @Override
        ExtractedRecord nextGroup() {
            int last = schema.width() - 1;
            ExtractedRecord record = new ExtractedRecord();
            while (cursor < cells.size()) {
                Element cell = cells.get(cursor++);
                int pos = cell.elementSiblingIndex();
                if (pos > last) continue;
                apply(record, schema.column(pos), cell);
                if (pos == last) return record;
            }
            return null;
        }
    }
}
