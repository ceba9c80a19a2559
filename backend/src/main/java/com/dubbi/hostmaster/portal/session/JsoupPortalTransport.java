package com.dubbi.hostmaster.portal.session;

import com.dubbi.hostmaster.portal.error.TransportException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import javax.net.ssl.SSLSocketFactory;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * jsoup 세션 기반 전송 계층.
 * 하나의 {@link Connection} 세션이 쿠키 저장소와 TLS 설정을 모든 요청에 공유한다.
 */
public class JsoupPortalTransport implements PortalTransport {
    private static final Logger log = LoggerFactory.getLogger(JsoupPortalTransport.class);

    private final Connection session;

    public JsoupPortalTransport(String userAgent, SSLSocketFactory sslSocketFactory) {
        Connection base = Jsoup.newSession()
                .userAgent(userAgent)
                .followRedirects(true)
                .ignoreContentType(true)
                .maxBodySize(0);
        if (sslSocketFactory != null) {
            base.sslSocketFactory(sslSocketFactory);
        }
        this.session = base;
    }

    @Override
    public byte[] get(String url, Duration timeout) {
        Connection req = session.newRequest()
                .url(url)
                .method(Connection.Method.GET)
                .timeout(toMillis(timeout));
        return execute("GET", url, req);
    }

    @Override
    public byte[] post(String url, byte[] body, String contentType, Duration timeout) {
        // latin-1 maps every byte to exactly one char, so jsoup writes the legacy bytes back unchanged
        Connection req = session.newRequest()
                .url(url)
                .method(Connection.Method.POST)
                .timeout(toMillis(timeout))
                .header("Content-Type", contentType)
                .postDataCharset(StandardCharsets.ISO_8859_1.name())
                .requestBody(new String(body, StandardCharsets.ISO_8859_1));
        return execute("POST", url, req);
    }

    private byte[] execute(String method, String url, Connection req) {
        try {
            Connection.Response res = req.execute();
            byte[] bytes = res.bodyAsBytes();
            log.debug("[Portal] {} {} -> {} ({} bytes)", method, url, res.statusCode(), bytes.length);
            return bytes;
        } catch (HttpStatusException e) {
            throw new TransportException(
                    String.format("%s %s returned HTTP %d", method, url, e.getStatusCode()), e.getStatusCode(), e);
        } catch (IOException e) {
            throw new TransportException(String.format("%s %s failed: %s", method, url, e.getMessage()), e);
        }
    }

    private static int toMillis(Duration timeout) {
        long millis = timeout.toMillis();
        if (millis <= 0) return 1;
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }
}
