package com.dubbi.hostmaster.common.util;

import com.dubbi.hostmaster.portal.error.StructuralException;
import java.net.URI;

/**
 * 포털 링크 정규화 유틸리티
 * 페이지 안의 상대 경로, 루트 경로, 절대 URL을 모두 절대 URL로 바꾸고 fragment는 제거한다.
 *
 * 예:
 * - base=https://portal/jpnic/menu.do, href=entry.do?id=1 -> https://portal/jpnic/entry.do?id=1
 * - base=https://portal, href=/jpnic/entry.do -> https://portal/jpnic/entry.do
 */
public final class PortalUrls {
    private PortalUrls() {}

    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            throw new StructuralException("empty link on portal page " + baseUrl);
        }
        try {
            URI base = URI.create(baseUrl);
            // URI.resolve drops the slash when the base has an empty path
            if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
                base = URI.create(baseUrl + "/");
            }
            String resolved = base.resolve(href.trim()).toString();
            int hash = resolved.indexOf('#');
            return hash < 0 ? resolved : resolved.substring(0, hash);
        } catch (IllegalArgumentException e) {
            throw new StructuralException("invalid portal link '" + href + "' (base " + baseUrl + "): " + e.getMessage());
        }
    }

    /**
     * True when the link points at the same host as the portal base.
     */
    public static boolean isSameHost(String baseUrl, String url) {
        try {
            String a = URI.create(baseUrl).getHost();
            String b = URI.create(url).getHost();
            return a != null && a.equalsIgnoreCase(b);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
