package com.dubbi.hostmaster.handle.service;

import com.dubbi.hostmaster.handle.domain.ContactChange;
import com.dubbi.hostmaster.handle.domain.ContactChangeReceipt;
import com.dubbi.hostmaster.handle.domain.HandleDetail;
import com.dubbi.hostmaster.portal.PortalAccess;
import com.dubbi.hostmaster.portal.error.ApplicationException;
import com.dubbi.hostmaster.portal.error.StructuralException;
import com.dubbi.hostmaster.portal.session.PortalSession;
import com.dubbi.hostmaster.portal.web.FormSubmission;
import com.dubbi.hostmaster.portal.web.FormTokenExtractor;
import com.dubbi.hostmaster.portal.web.FormTokens;
import com.dubbi.hostmaster.portal.web.PortalMenu;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * JPNIC 핸들 조회와 担当グループ（担当者）情報 등록/변경 신청.
 *
 * <p>변경 신청은 두 단계다: 입력 폼 제출 → 확인 화면의 "確認" 제출. 확인 화면에 안내 문구가 없으면
 * 포털이 표시한 빨간 오류 문구를 그대로 {@link ApplicationException}으로 돌려준다.
 */
@Service
public class HandleService {
    private static final Logger log = LoggerFactory.getLogger(HandleService.class);

    public static final Pattern HANDLE_PATTERN = Pattern.compile("[A-Za-z0-9-]+");

    static final String HANDLE_PAGE_PATH = "/jpnic/entryinfo_handle.do?jpnic_hdl=";
    static final String REGISTER_ACTION = "regist.do";
    static final String CONFIRM_ACTION = "apply";
    static final String APPLY_CAPTION = "%90%5C%90%BF";
    static final String CONFIRM_CAPTION = "%8Am%94F";
    static final String CONFIRM_PROMPT = "上記の申請内容でよろしければ、「確認」ボタンを押してください。";
    static final String GENERIC_ERROR = "何かしらのエラーが発生しました";
    static final String RECEPTION_CAPTION = "受付番号";

    private final PortalAccess portal;
    private final FormTokenExtractor formTokens;
    private final HandlePageParser handleParser;

    public HandleService(PortalAccess portal, FormTokenExtractor formTokens, HandlePageParser handleParser) {
        this.portal = portal;
        this.formTokens = formTokens;
        this.handleParser = handleParser;
    }

    public HandleDetail fetchHandle(String handle) {
        if (handle == null || !HANDLE_PATTERN.matcher(handle).matches()) {
            throw new IllegalArgumentException("invalid handle: " + handle);
        }
        PortalSession session = portal.open();
        // the handle page is only served once a search menu has been opened in this session
        portal.openMenu(session, PortalMenu.IPV6_SEARCH);
        Document page = session.fetchPage(session.resolve(HANDLE_PAGE_PATH + handle));
        HandleDetail detail = handleParser.parse(page);
        if (detail.handle().isEmpty()) {
            throw new StructuralException("handle page for " + handle + " carries no handle caption");
        }
        return detail;
    }

    public ContactChangeReceipt changeContactInfo(ContactChange change) {
        PortalSession session = portal.open();
        Document form = portal.openMenu(session, PortalMenu.CONTACT_CHANGE);
        FormTokens input = formTokens.extract(form, FormTokenExtractor.actionContains(REGISTER_ACTION));

        FormSubmission apply = FormSubmission.create()
                .add(FormTokens.STRUTS_TOKEN, input.token())
                .add(FormTokens.DEST_DISP, input.destDisp())
                .add(FormTokens.APLY_ID, input.aplyId())
                .add("kind", change.kind())
                .add("jpnic_hdl", change.handle())
                .add("name_jp", change.name())
                .add("name", change.nameEn())
                .add("email", change.email())
                .add("org_nm_jp", change.org())
                .add("org_nm", change.orgEn())
                .add("zipcode", change.zipCode())
                .add("addr_jp", change.address())
                .add("addr", change.addressEn())
                .add("division_jp", change.division())
                .add("division", change.divisionEn())
                .add("title_jp", change.title())
                .add("title", change.titleEn())
                .add("phone", change.tel())
                .add("fax", change.fax())
                .add("ntfy_mail", change.notifyMail())
                .add("aply_from_addr", change.applyMail())
                .add("aply_from_addr_confirm", change.applyMail())
                .add("action", APPLY_CAPTION);
        Document confirm = session.submit(input.actionUrl(), apply);

        if (!confirm.text().contains(CONFIRM_PROMPT)) {
            String message = highlightedError(confirm);
            log.warn("[Contact] {} {} rejected: {}", change.kind(), change.handle(), message);
            throw new ApplicationException(message);
        }

        FormTokens confirmation = formTokens.extract(confirm, FormTokenExtractor.actionContains(CONFIRM_ACTION));
        FormSubmission ok = FormSubmission.create()
                .add(FormTokens.STRUTS_TOKEN, confirmation.token())
                .add(FormTokens.PREV_DISP_ID, confirmation.prevDispId())
                .add(FormTokens.APLY_ID, confirmation.aplyId())
                .add(FormTokens.DEST_DISP, confirmation.destDisp())
                .add("inputconf", CONFIRM_CAPTION);
        Document done = session.submit(confirmation.actionUrl(), ok);

        String recepNo = receptionNumber(done);
        log.info("[Contact] {} {} accepted recepNo={}", change.kind(), change.handle(), recepNo);
        return new ContactChangeReceipt(recepNo);
    }

    /**
     * Text of the last red-highlighted element, or a generic message when the page shows none.
     */
    static String highlightedError(Document page) {
        Elements red = page.select("font[color=red]");
        for (int i = red.size() - 1; i >= 0; i--) {
            String text = red.get(i).text().trim();
            if (!text.isEmpty()) return text;
        }
        return GENERIC_ERROR;
    }

    static String receptionNumber(Document page) {
        for (Element td : page.select("table table td")) {
            Element caption = td.previousElementSibling();
            if (caption != null && caption.text().contains(RECEPTION_CAPTION)) {
                return td.text().trim();
            }
        }
        throw new StructuralException("completion page carries no " + RECEPTION_CAPTION);
    }
}
