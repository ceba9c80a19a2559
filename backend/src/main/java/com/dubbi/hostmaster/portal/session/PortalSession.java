package com.dubbi.hostmaster.portal.session;

import com.dubbi.hostmaster.common.util.PortalUrls;
import com.dubbi.hostmaster.portal.web.FormSubmission;
import java.time.Duration;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * 로그인된 포털 세션 하나.
 * 쿠키 상태가 서버 측 워크플로 위치를 가리키므로 한 번에 하나의 요청만 순차적으로 보내야 한다.
 * 모든 본문은 여기서 정확히 한 번 레거시 인코딩으로 변환된다.
 */
public class PortalSession {
    public static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";
    public static final String TRANSACTION_CONTENT_TYPE = "text/html";

    private final PortalTransport transport;
    private final LegacyEncoding encoding;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final Deadline deadline;

    public PortalSession(
            PortalTransport transport,
            LegacyEncoding encoding,
            String baseUrl,
            Duration requestTimeout,
            Deadline deadline
    ) {
        this.transport = transport;
        this.encoding = encoding;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
        this.deadline = deadline == null ? Deadline.none() : deadline;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Deadline deadline() {
        return deadline;
    }

    public LegacyEncoding encoding() {
        return encoding;
    }

    /**
     * Resolves a portal link (absolute, root-relative or page-relative) against the base URL.
     */
    public String resolve(String href) {
        return PortalUrls.resolve(baseUrl, href);
    }

    public byte[] get(String url) {
        deadline.check("GET " + url);
        return transport.get(url, timeout());
    }

    public byte[] post(String url, byte[] body, String contentType) {
        deadline.check("POST " + url);
        return transport.post(url, body, contentType, timeout());
    }

    public String fetchText(String url) {
        return encoding.fromLegacy(get(url));
    }

    public Document fetchPage(String url) {
        return Jsoup.parse(fetchText(url), url);
    }

    public Document submit(String url, FormSubmission submission) {
        byte[] body = encoding.toLegacy(submission.render());
        String html = encoding.fromLegacy(post(url, body, FORM_CONTENT_TYPE));
        return Jsoup.parse(html, url);
    }

    /**
     * Posts a line-protocol body to a transactional endpoint and returns the decoded response lines.
     */
    public List<String> exchangeLines(String url, String body) {
        byte[] raw = post(url, encoding.toLegacy(body), TRANSACTION_CONTENT_TYPE);
        return encoding.fromLegacy(raw).lines().toList();
    }

    private Duration timeout() {
        Duration left = deadline.remaining();
        return left.compareTo(requestTimeout) < 0 ? left : requestTimeout;
    }
}
