package com.dubbi.hostmaster.registration.service;

import com.dubbi.hostmaster.portal.web.ExtractedRecord;
import com.dubbi.hostmaster.portal.web.TableExtractor;
import com.dubbi.hostmaster.registration.domain.RegistrationDetail;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

@Component
public class RegistrationDetailParser {
    private final TableExtractor tableExtractor;

    public RegistrationDetailParser(TableExtractor tableExtractor) {
        this.tableExtractor = tableExtractor;
    }

    public RegistrationDetail parse(Document page) {
        ExtractedRecord r = tableExtractor.titleValues(page, RegistrationSchemas.DETAIL);
        return new RegistrationDetail(
                r.text("ipAddress"),
                r.text("resourceAdminShortName"),
                r.text("addressType"),
                r.text("infraUserKind"),
                r.text("networkName"),
                r.text("org"),
                r.text("orgEn"),
                r.text("postCode"),
                r.text("address"),
                r.text("addressEn"),
                r.text("adminHandle"),
                r.link("adminHandle"),
                r.text("techHandle"),
                r.link("techHandle"),
                r.text("nameServer"),
                r.text("dsRecord"),
                r.text("notifyAddress"),
                r.text("deliNo"),
                r.text("recepNo"),
                r.text("assignDate"),
                r.text("returnDate"),
                r.text("updateDate")
        );
    }
}
