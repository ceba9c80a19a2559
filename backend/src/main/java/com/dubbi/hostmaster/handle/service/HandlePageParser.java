package com.dubbi.hostmaster.handle.service;

import com.dubbi.hostmaster.handle.domain.HandleDetail;
import com.dubbi.hostmaster.portal.web.DetailSchema;
import com.dubbi.hostmaster.portal.web.ExtractedRecord;
import com.dubbi.hostmaster.portal.web.TableExtractor;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * 핸들 상세 페이지(3단 중첩 테이블)를 {@link HandleDetail}로 변환한다.
 * 개인/그룹 여부는 핸들 캡션이 "JPNICハンドル"인지 "グループハンドル"인지로 판단한다.
 */
@Component
public class HandlePageParser {
    static final String PERSON_HANDLE_CAPTION = "JPNICハンドル";
    static final String GROUP_HANDLE_CAPTION = "グループハンドル";

    static final DetailSchema HANDLE = DetailSchema.builder("handle-detail", 3)
            .text("handle", GROUP_HANDLE_CAPTION, PERSON_HANDLE_CAPTION)
            .text("name", "グループ名", "氏名")
            .text("nameEn", "Group Name", "Last, First")
            .text("email", "電子メール", "電子メイル")
            .text("org", "組織名")
            .text("orgEn", "Organization")
            .text("division", "部署")
            .text("divisionEn", "Division")
            .text("title", "肩書")
            .text("titleEn", "Title")
            .text("tel", "電話番号")
            .text("fax", "Fax番号", "FAX番号")
            .text("notifyAddress", "通知アドレス")
            .text("updateDate", "最終更新")
            .build();

    private final TableExtractor tableExtractor;

    public HandlePageParser(TableExtractor tableExtractor) {
        this.tableExtractor = tableExtractor;
    }

    public HandleDetail parse(Document page) {
        ExtractedRecord r = tableExtractor.titleValues(page, HANDLE);
        return new HandleDetail(
                PERSON_HANDLE_CAPTION.equals(r.caption("handle")),
                r.text("handle"),
                r.text("name"),
                r.text("nameEn"),
                r.text("email"),
                r.text("org"),
                r.text("orgEn"),
                r.text("division"),
                r.text("divisionEn"),
                r.text("title"),
                r.text("titleEn"),
                r.text("tel"),
                r.text("fax"),
                r.text("notifyAddress"),
                r.text("updateDate")
        );
    }
}
