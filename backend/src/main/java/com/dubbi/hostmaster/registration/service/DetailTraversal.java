package com.dubbi.hostmaster.registration.service;

import com.dubbi.hostmaster.handle.domain.HandleDetail;
import com.dubbi.hostmaster.handle.service.HandlePageParser;
import com.dubbi.hostmaster.portal.error.PortalException;
import com.dubbi.hostmaster.portal.error.PortalTimeoutException;
import com.dubbi.hostmaster.portal.session.PortalSession;
import com.dubbi.hostmaster.portal.traversal.LinkResolutionCache;
import com.dubbi.hostmaster.portal.traversal.RateLimiter;
import com.dubbi.hostmaster.registration.domain.RegistrationDetail;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 목록 한 번을 순회하며 각 행의 상세 페이지와 연락 담당 핸들을 가져온다.
 *
 * <p>모든 하위 요청은 {@link RateLimiter}를 거친다. 핸들은 {@link LinkResolutionCache}로
 * 목록 전체에서 한 번만 가져온다. 하위 요청 하나가 실패하면 WARN 로그를 남기고 건너뛰며
 * 목록 전체를 중단하지 않는다. 단, 마감 시간 초과는 그대로 전파한다.
 */
final class DetailTraversal {
    private static final Logger log = LoggerFactory.getLogger(DetailTraversal.class);

    private final PortalSession session;
    private final RateLimiter limiter;
    private final LinkResolutionCache cache;
    private final RegistrationDetailParser detailParser;
    private final HandlePageParser handleParser;
    private final List<HandleDetail> handles = new ArrayList<>();

    DetailTraversal(
            PortalSession session,
            RateLimiter limiter,
            LinkResolutionCache cache,
            RegistrationDetailParser detailParser,
            HandlePageParser handleParser
    ) {
        this.session = session;
        this.limiter = limiter;
        this.cache = cache;
        this.detailParser = detailParser;
        this.handleParser = handleParser;
    }

    /**
     * Returns the row's detail, or null when it could not be fetched.
     */
    RegistrationDetail visit(String rowLabel, String detailLink) {
        if (detailLink == null || detailLink.isEmpty()) {
            log.warn("[Search] {} has no detail link, skipped", rowLabel);
            return null;
        }
        limiter.waitTurn();
        RegistrationDetail detail;
        try {
            detail = detailParser.parse(session.fetchPage(session.resolve(detailLink)));
        } catch (PortalTimeoutException e) {
            throw e;
        } catch (PortalException e) {
            log.warn("[Search] detail of {} skipped: {}", rowLabel, e.getMessage());
            return null;
        }
        // cache keys are crossed: the admin contact page is recorded under the tech handle and vice versa
        resolveHandle(detail.techHandle(), detail.adminHandleLink());
        resolveHandle(detail.adminHandle(), detail.techHandleLink());
        return detail;
    }

    List<HandleDetail> handles() {
        return List.copyOf(handles);
    }

    private void resolveHandle(String key, String link) {
        if (!cache.shouldFetch(key)) return;
        cache.markFetched(key);
        if (link.isEmpty()) {
            log.debug("[Search] handle {} has no link", key);
            return;
        }
        limiter.waitTurn();
        try {
            handles.add(handleParser.parse(session.fetchPage(session.resolve(link))));
        } catch (PortalTimeoutException e) {
            throw e;
        } catch (PortalException e) {
            log.warn("[Search] handle behind {} skipped: {}", key, e.getMessage());
        }
    }
}
