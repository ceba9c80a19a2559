package com.dubbi.hostmaster.resource.service;

import com.dubbi.hostmaster.portal.error.StructuralException;
import com.dubbi.hostmaster.portal.web.RatioValue;
import com.dubbi.hostmaster.resource.domain.CidrBlock;
import com.dubbi.hostmaster.resource.domain.ResourceInfo;
import com.dubbi.hostmaster.resource.domain.ResourceManagerInfo;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * 資源管理者情報 페이지를 읽는다.
 *
 * <p>4단 중첩 테이블의 각 행은 (제목, 값, 이용률) 세 칸이다. 제목 칸에 {@code entryinfo} 링크가 있으면
 * 그 행은 CIDR 블록이고, 두 번째 칸은 할당일, 세 번째 칸은 블록 이용률이다.
 */
@Component
public class ResourcePageParser {
    static final String TOTAL_UTILIZATION = "総利用率";
    static final String AD_RATIO = "ＡＤ　ｒａｔｉｏ";
    static final String CIDR_LINK_MARKER = "entryinfo";

    private static final Map<String, String> MANAGER_LABELS = Map.ofEntries(
            Map.entry("資源管理者番号", "resourceManagerNo"),
            Map.entry("資源管理者略称", "shortName"),
            Map.entry("管理組織名", "org"),
            Map.entry("Organization", "orgEn"),
            Map.entry("郵便番号", "zipCode"),
            Map.entry("住所", "address"),
            Map.entry("Address", "addressEn"),
            Map.entry("電話番号", "tel"),
            Map.entry("FAX番号", "fax"),
            Map.entry("資源管理責任者", "resourceManagementManager"),
            Map.entry("連絡担当窓口", "contactPerson"),
            Map.entry("一般問い合わせ窓口", "inquiry"),
            Map.entry("資源管理者通知アドレス", "notifyMail"),
            Map.entry("アサインメントウィンドウサイズ", "assignmentWindowSize"),
            Map.entry("管理開始日", "managementStartDate"),
            Map.entry("管理終了日", "managementEndDate"),
            Map.entry("最終更新日", "updateDate")
    );

    public ResourceInfo parse(Document page, String html) {
        Map<String, String> manager = new HashMap<>();
        List<CidrBlock> blocks = new ArrayList<>();
        RatioValue total = null;
        double adRatio = 0;

        String title = "";
        BlockBuilder block = null;
        for (Element cell : page.select("table table table table td")) {
            String text = cell.text().trim();
            switch (cell.elementSiblingIndex()) {
                case 0 -> {
                    title = text;
                    block = null;
                    Element a = cell.selectFirst("a[href]");
                    if (a != null && a.attr("href").contains(CIDR_LINK_MARKER)) {
                        String abs = a.absUrl("href");
                        block = new BlockBuilder(addressOf(text), abs.isEmpty() ? a.attr("href") : abs);
                    }
                }
                case 1 -> {
                    String field = MANAGER_LABELS.get(title);
                    if (field != null) {
                        manager.put(field, text);
                    } else if (block != null) {
                        block.assignDate = text;
                    }
                }
                case 2 -> {
                    if (TOTAL_UTILIZATION.equals(title)) {
                        total = RatioValue.parse(text);
                    } else if (AD_RATIO.equals(title)) {
                        adRatio = parseDouble(text);
                    } else if (block != null) {
                        blocks.add(block.build(RatioValue.parse(text)));
                        block = null;
                    }
                }
                default -> { }
            }
        }

        if (total == null) {
            total = new RatioValue(0, 0, 0);
        }
        return new ResourceInfo(toManager(manager), total.used(), total.total(), total.percent(), adRatio, blocks, html);
    }

    private static String addressOf(String titleText) {
        int paren = titleText.indexOf('(');
        return (paren < 0 ? titleText : titleText.substring(0, paren)).trim();
    }

    private static double parseDouble(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new StructuralException("unexpected " + AD_RATIO + " value '" + text + "'");
        }
    }

    private static ResourceManagerInfo toManager(Map<String, String> m) {
        return new ResourceManagerInfo(
                m.getOrDefault("resourceManagerNo", ""),
                m.getOrDefault("shortName", ""),
                m.getOrDefault("org", ""),
                m.getOrDefault("orgEn", ""),
                m.getOrDefault("zipCode", ""),
                m.getOrDefault("address", ""),
                m.getOrDefault("addressEn", ""),
                m.getOrDefault("tel", ""),
                m.getOrDefault("fax", ""),
                m.getOrDefault("resourceManagementManager", ""),
                m.getOrDefault("contactPerson", ""),
                m.getOrDefault("inquiry", ""),
                m.getOrDefault("notifyMail", ""),
                m.getOrDefault("assignmentWindowSize", ""),
                m.getOrDefault("managementStartDate", ""),
                m.getOrDefault("managementEndDate", ""),
                m.getOrDefault("updateDate", "")
        );
    }

    private static final class BlockBuilder {
        private final String address;
        private final String url;
        private String assignDate = "";

        private BlockBuilder(String address, String url) {
            this.address = address;
            this.url = url;
        }

        private CidrBlock build(RatioValue ratio) {
            return new CidrBlock(address, url, assignDate, ratio.used(), ratio.total(), ratio.percent());
        }
    }
}
