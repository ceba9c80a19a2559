package com.dubbi.hostmaster.request.service;

import com.dubbi.hostmaster.portal.PortalAccess;
import com.dubbi.hostmaster.portal.session.PortalSession;
import com.dubbi.hostmaster.portal.web.ExtractedRecord;
import com.dubbi.hostmaster.portal.web.FormSubmission;
import com.dubbi.hostmaster.portal.web.FormTokenExtractor;
import com.dubbi.hostmaster.portal.web.FormTokens;
import com.dubbi.hostmaster.portal.web.PortalMenu;
import com.dubbi.hostmaster.portal.web.RecordSchema;
import com.dubbi.hostmaster.portal.web.RowLayout;
import com.dubbi.hostmaster.portal.web.TableExtractor;
import com.dubbi.hostmaster.request.domain.RequestInfo;
import java.util.List;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RequestListService {
    private static final Logger log = LoggerFactory.getLogger(RequestListService.class);

    public static final Pattern RECEP_NO_PATTERN = Pattern.compile("[A-Za-z0-9-]*");

    static final String SEARCH_CAPTION = "%81%40%8C%9F%8D%F5%81%40";

    static final RecordSchema REQUEST_LISTING = RecordSchema.builder("request-listing")
            .layout(RowLayout.CELL_POSITION)
            .text("recepNo")
            .text("deliNo")
            .text("applyKind")
            .text("applyClass")
            .text("applicant")
            .text("applyDate")
            .text("completeDate")
            .text("status")
            .build();

    private final PortalAccess portal;
    private final FormTokenExtractor formTokens;
    private final TableExtractor tables;

    public RequestListService(PortalAccess portal, FormTokenExtractor formTokens, TableExtractor tables) {
        this.portal = portal;
        this.formTokens = formTokens;
        this.tables = tables;
    }

    /**
     * Lists applications starting at the given reception number (empty lists from the first one).
     */
    public List<RequestInfo> listRequests(String recepNoFrom) {
        String from = recepNoFrom == null ? "" : recepNoFrom.trim();
        if (!RECEP_NO_PATTERN.matcher(from).matches()) {
            throw new IllegalArgumentException("invalid reception number: " + recepNoFrom);
        }
        PortalSession session = portal.open();
        Document form = portal.openMenu(session, PortalMenu.REQUEST_LIST);
        FormTokens tokens = formTokens.extract(form, FormTokenExtractor.anyAction());

        FormSubmission body = FormSubmission.create()
                .add(FormTokens.DEST_DISP, tokens.dispatchId())
                .add("startRecepNo", from)
                .add("endRecepNo", "")
                .add("deliNo", "")
                .add("aplyKind", "")
                .add("aplyClass", "")
                .add("resceAdmSnm", "")
                .add("aplyDateS", "")
                .add("aplyDateE", "")
                .add("completDateS", "")
                .add("completDateE", "")
                .add("statusId", "")
                .add("pswdResceNewConfirm", SEARCH_CAPTION);
        Document listing = session.submit(tokens.actionUrl(), body);

        List<RequestInfo> requests = tables.rows(listing, REQUEST_LISTING).stream()
                .map(RequestListService::toRequest)
                .toList();
        log.info("[Request] from={} rows={}", from.isEmpty() ? "-" : from, requests.size());
        return requests;
    }

    private static RequestInfo toRequest(ExtractedRecord r) {
        return new RequestInfo(
                r.text("recepNo"),
                r.text("deliNo"),
                r.text("applyKind"),
                r.text("applyClass"),
                r.text("applicant"),
                r.text("applyDate"),
                r.text("completeDate"),
                r.text("status")
        );
    }
}
