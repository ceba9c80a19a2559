package com.dubbi.hostmaster.portal.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dubbi.hostmaster.portal.PortalFixtures;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

class TableExtractorTest {
    private final TableExtractor extractor = new TableExtractor();

    private static RecordSchema threeColumns() {
        return RecordSchema.builder("three").rowClass("r").textWithLink("a").text("b").text("c").build();
    }

    private static String cells(int count) {
        StringBuilder sb = new StringBuilder("<table><tr>");
        for (int i = 0; i < count; i++) {
            sb.append("<td class=\"r\">");
            if (i % 3 == 0) sb.append("<a href=\"/d.do?id=").append(i).append("\">v").append(i).append("</a>");
            else sb.append("v").append(i);
            sb.append("</td>");
        }
        return PortalFixtures.page(sb.append("</tr></table>").toString());
    }

    @Test
    void recordCountIsCompleteGroupsMinusHeader() {
        for (int n : new int[] {0, 2, 3, 5, 6, 9, 10}) {
            Document page = Jsoup.parse(cells(n), PortalFixtures.BASE + "/list.do");
            int expected = Math.max(0, n / 3 - 1);
            assertEquals(expected, extractor.rows(page, threeColumns()).toList().size(), "cells=" + n);
        }
    }

    @Test
    void extractionIsRepeatable() {
        Document page = Jsoup.parse(cells(9), PortalFixtures.BASE + "/list.do");
        TableExtractor.Records records = extractor.rows(page, threeColumns());
        assertEquals(records.toList(), records.toList());
    }

    @Test
    void linkColumnsCaptureAbsoluteHref() {
        Document page = Jsoup.parse(cells(6), PortalFixtures.BASE + "/jpnic/list.do");
        ExtractedRecord only = extractor.rows(page, threeColumns()).toList().get(0);
        assertEquals("v3", only.text("a"));
        assertEquals(PortalFixtures.BASE + "/d.do?id=3", only.link("a"));
        assertEquals("", only.link("b"));
    }

    @Test
    void elevenColumnListingYieldsTwoRows() {
        RecordSchema schema = RecordSchema.builder("ipv4").rowClass("dataRow_mnt04")
                .textWithLink("ip").text("size").text("net").text("assign").text("return").text("org")
                .text("short").text("recep").text("deli").text("type").text("kind")
                .build();
        Document page = Jsoup.parse(PortalFixtures.IPV4_LISTING, PortalFixtures.IPV4_LIST_URL);

        List<ExtractedRecord> rows = extractor.rows(page, schema).toList();

        assertEquals(2, rows.size());
        assertEquals("192.0.2.0/24", rows.get(0).text("ip"));
        assertEquals(PortalFixtures.DETAIL_1_URL, rows.get(0).link("ip"));
        assertEquals("S", rows.get(1).text("kind"));
    }

    @Test
    void positionLayoutFollowsSiblingIndex() {
        RecordSchema schema = RecordSchema.builder("requests").layout(RowLayout.CELL_POSITION)
                .text("recep").text("deli").text("kind").text("class").text("who").text("applied")
                .text("completed").text("status")
                .build();
        Document page = Jsoup.parse(PortalFixtures.REQUEST_LISTING, PortalFixtures.REQUEST_LIST_URL);

        List<ExtractedRecord> rows = extractor.rows(page, schema).toList();

        assertEquals(2, rows.size());
        assertEquals("20240001", rows.get(0).text("recep"));
        assertEquals("", rows.get(0).text("completed"));
        assertEquals("完了", rows.get(1).text("status"));
    }

    @Test
    void titleValueModeAcceptsEitherSpellingAndIgnoresUnknownCaptions() {
        DetailSchema schema = DetailSchema.builder("handle", 3)
                .text("email", "電子メール", "電子メイル")
                .text("fax", "Fax番号", "FAX番号")
                .build();

        ExtractedRecord person = extractor.titleValues(
                Jsoup.parse(PortalFixtures.ADMIN_HANDLE, PortalFixtures.ADMIN_HANDLE_URL), schema);
        ExtractedRecord group = extractor.titleValues(
                Jsoup.parse(PortalFixtures.TECH_HANDLE, PortalFixtures.TECH_HANDLE_URL), schema);

        assertEquals("taro@example.jp", person.text("email"));
        assertEquals("03-0000-0001", person.text("fax"));
        assertEquals("tech@example.jp", group.text("email"));
        assertEquals("電子メイル", group.caption("email"));
        assertEquals(2, person.texts().size());
    }

    @Test
    void titleValueModeOnlyReadsCellsAtTheConfiguredDepth() {
        DetailSchema schema = DetailSchema.builder("detail", 4)
                .textWithLink("admin", "管理者連絡窓口")
                .build();
        Document page = Jsoup.parse(PortalFixtures.DETAIL_1, PortalFixtures.DETAIL_1_URL);

        ExtractedRecord detail = extractor.titleValues(page, schema);

        assertEquals("AD001JP", detail.text("admin"));
        assertEquals(PortalFixtures.ADMIN_HANDLE_URL, detail.link("admin"));
        assertTrue(detail.has("admin"));
        assertNull(detail.caption("missing"));
    }
}
