package com.dubbi.hostmaster.registration.service;

import com.dubbi.hostmaster.common.util.PortalUrls;
import com.dubbi.hostmaster.handle.domain.HandleDetail;
import com.dubbi.hostmaster.handle.service.HandlePageParser;
import com.dubbi.hostmaster.portal.PortalAccess;
import com.dubbi.hostmaster.portal.session.PortalSession;
import com.dubbi.hostmaster.portal.traversal.LinkResolutionCache;
import com.dubbi.hostmaster.portal.traversal.RateLimiterFactory;
import com.dubbi.hostmaster.portal.web.ExtractedRecord;
import com.dubbi.hostmaster.portal.web.FormSubmission;
import com.dubbi.hostmaster.portal.web.FormTokenExtractor;
import com.dubbi.hostmaster.portal.web.FormTokens;
import com.dubbi.hostmaster.portal.web.PortalMenu;
import com.dubbi.hostmaster.portal.web.TableExtractor;
import com.dubbi.hostmaster.registration.domain.Ipv4Info;
import com.dubbi.hostmaster.registration.domain.Ipv4Search;
import com.dubbi.hostmaster.registration.domain.Ipv6Info;
import com.dubbi.hostmaster.registration.domain.Ipv6Search;
import com.dubbi.hostmaster.registration.domain.RegistrationDetail;
import com.dubbi.hostmaster.registration.domain.SearchResult;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 登録情報検索 (IPv4 / IPv6).
 *
 * <p>흐름: 메뉴 → 검색 폼 → 고정 형식 본문 POST → 목록 추출 → (선택) 상세 순회.
 */
@Service
public class RegistrationSearchService {
    private static final Logger log = LoggerFactory.getLogger(RegistrationSearchService.class);

    static final String RESOURCE_ADMIN_FIELD = "resceAdmSnm";
    static final String IPV4_SEARCH_CAPTION = "　検索　";
    static final String IPV6_SEARCH_CAPTION = "%81%40%8C%9F%8D%F5%81%40";

    private final PortalAccess portal;
    private final FormTokenExtractor formTokens;
    private final TableExtractor tables;
    private final RateLimiterFactory rateLimiters;
    private final RegistrationDetailParser detailParser;
    private final HandlePageParser handleParser;

    public RegistrationSearchService(
            PortalAccess portal,
            FormTokenExtractor formTokens,
            TableExtractor tables,
            RateLimiterFactory rateLimiters,
            RegistrationDetailParser detailParser,
            HandlePageParser handleParser
    ) {
        this.portal = portal;
        this.formTokens = formTokens;
        this.tables = tables;
        this.rateLimiters = rateLimiters;
        this.detailParser = detailParser;
        this.handleParser = handleParser;
    }

    public SearchResult<Ipv4Info> searchIpv4(Ipv4Search search) {
        PortalSession session = portal.open();
        Document form = portal.openMenu(session, PortalMenu.IPV4_SEARCH);
        FormTokens tokens = formTokens.extract(form, FormTokenExtractor.anyAction());

        String resourceAdmin = search.myself() ? tokens.prefilled(RESOURCE_ADMIN_FIELD) : search.resourceAdminShortName();
        FormSubmission body = FormSubmission.create()
                .add("destdisp", tokens.dispatchId())
                .add("ipaddr", search.ipAddress())
                .add("sizeS", search.sizeStart())
                .add("sizeE", search.sizeEnd())
                .add("netwrkName", search.networkName())
                .add("regDateS", search.regDateStart())
                .add("regDateE", search.regDateEnd())
                .add("rtnDateS", search.returnDateStart())
                .add("rtnDateE", search.returnDateEnd())
                .add("organizationName", search.orgName())
                .add(RESOURCE_ADMIN_FIELD, resourceAdmin)
                .add("recepNo", search.recepNo())
                .add("deliNo", search.deliNo())
                .flag("ipaddrKindPa", search.pa())
                .flag("regKindAllo", search.allocate())
                .flag("regKindEvent", search.assignInfra())
                .flag("regKindUser", search.assignUser())
                .flag("regKindSubA", search.subAllocate())
                .flag("ipaddrKindPiHistorical", search.historicalPi())
                .flag("ipaddrKindPiSpecial", search.specialPi())
                .add("action", IPV4_SEARCH_CAPTION);

        Document listing = session.submit(tokens.actionUrl(), body);
        List<Ipv4Info> rows = tables.rows(listing, RegistrationSchemas.IPV4_LISTING).stream()
                .map(RegistrationSearchService::toIpv4)
                .toList();
        log.info("[Search] ipv4 rows={} detail={}", rows.size(), search.detail());
        if (!search.detail()) {
            return new SearchResult<>(rows, List.of());
        }

        DetailTraversal traversal = traversal(session, search.knownHandles());
        List<Ipv4Info> detailed = new ArrayList<>(rows.size());
        for (Ipv4Info row : rows) {
            detailed.add(row.withDetail(traversal.visit(row.ipAddress(), row.detailLink())));
        }
        return finish(detailed, traversal);
    }

    public SearchResult<Ipv6Info> searchIpv6(Ipv6Search search) {
        PortalSession session = portal.open();
        Document form = portal.openMenu(session, PortalMenu.IPV6_SEARCH);
        FormTokens tokens = formTokens.extract(form, FormTokenExtractor.anyAction());

        FormSubmission body = FormSubmission.create().add("destdisp", tokens.dispatchId());
        if (search.myself()) {
            // own-registry search only narrows by the pre-filled resource admin
            body.add("ipaddr", "")
                    .add("sizeS", "")
                    .add("sizeE", "")
                    .add("netwrkName", "")
                    .add("regDateS", "")
                    .add("regDateE", "")
                    .add("rtnDateS", "")
                    .add("rtnDateE", "")
                    .add("organizationName", "")
                    .add(RESOURCE_ADMIN_FIELD, tokens.prefilled(RESOURCE_ADMIN_FIELD))
                    .add("recepNo", "")
                    .add("deliNo", "");
        } else {
            body.add("ipaddr", search.ipAddress())
                    .add("sizeS", search.sizeStart())
                    .add("sizeE", search.sizeEnd())
                    .add("netwrkName", search.networkName())
                    .add("regDateS", search.regDateStart())
                    .add("regDateE", search.regDateEnd())
                    .add("rtnDateS", search.returnDateStart())
                    .add("rtnDateE", search.returnDateEnd())
                    .add("organizationName", search.orgName())
                    .add(RESOURCE_ADMIN_FIELD, search.resourceAdminShortName())
                    .add("recepNo", search.recepNo())
                    .add("deliNo", search.deliNo())
                    .flag("regKindAllo", search.allocate())
                    .flag("regKindEvent", search.assignInfra())
                    .flag("regKindUser", search.assignUser())
                    .flag("regKindSubA", search.subAllocate());
        }
        body.add("action", IPV6_SEARCH_CAPTION);

        Document listing = session.submit(tokens.actionUrl(), body);
        List<Ipv6Info> rows = tables.rows(listing, RegistrationSchemas.IPV6_LISTING).stream()
                .map(RegistrationSearchService::toIpv6)
                .toList();
        log.info("[Search] ipv6 rows={} detail={}", rows.size(), search.detail());
        if (!search.detail()) {
            return new SearchResult<>(rows, List.of());
        }

        DetailTraversal traversal = traversal(session, search.knownHandles());
        List<Ipv6Info> detailed = new ArrayList<>(rows.size());
        for (Ipv6Info row : rows) {
            detailed.add(row.withDetail(traversal.visit(row.ipAddress(), row.detailLink())));
        }
        return finish(detailed, traversal);
    }

    /**
     * Fetches one registration detail page. Only links on the portal host are followed.
     */
    public RegistrationDetail fetchRegistrationDetail(String link) {
        if (link == null || link.isBlank()) {
            throw new IllegalArgumentException("detail link is required");
        }
        PortalSession session = portal.open();
        String url = session.resolve(link);
        if (!PortalUrls.isSameHost(session.baseUrl(), url)) {
            throw new IllegalArgumentException("detail link must point at " + session.baseUrl());
        }
        portal.openMenu(session, PortalMenu.HANDLE_SEARCH);
        return detailParser.parse(session.fetchPage(url));
    }

    private DetailTraversal traversal(PortalSession session, List<String> knownHandles) {
        return new DetailTraversal(
                session,
                rateLimiters.forTraversal(session.deadline()),
                new LinkResolutionCache(knownHandles),
                detailParser,
                handleParser
        );
    }

    private static <T> SearchResult<T> finish(List<T> rows, DetailTraversal traversal) {
        List<HandleDetail> handles = traversal.handles();
        log.info("[Search] resolved handles={}", handles.size());
        return new SearchResult<>(rows, handles);
    }

    private static Ipv4Info toIpv4(ExtractedRecord r) {
        return new Ipv4Info(
                r.text("ipAddress"),
                r.link("ipAddress"),
                r.text("size"),
                r.text("networkName"),
                r.text("assignDate"),
                r.text("returnDate"),
                r.text("orgName"),
                r.text("resourceAdminShortName"),
                r.text("recepNo"),
                r.text("deliNo"),
                r.text("type"),
                r.text("kindId"),
                null
        );
    }

    private static Ipv6Info toIpv6(ExtractedRecord r) {
        return new Ipv6Info(
                r.text("ipAddress"),
                r.link("ipAddress"),
                r.text("networkName"),
                r.text("assignDate"),
                r.text("returnDate"),
                r.text("orgName"),
                r.text("resourceAdminShortName"),
                r.text("recepNo"),
                r.text("deliNo"),
                r.text("kindId"),
                null
        );
    }
}
