package com.dubbi.hostmaster.portal.session;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dubbi.hostmaster.portal.error.PortalTimeoutException;
import com.dubbi.hostmaster.portal.web.FormSubmission;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

class PortalSessionTest {
    private final LegacyEncoding encoding = LegacyEncoding.windows31j();

    /** Echoes bodies back and remembers the timeouts it was given. */
    private final class EchoTransport implements PortalTransport {
        final List<Duration> timeouts = new ArrayList<>();
        byte[] lastBody;
        String lastContentType;

        @Override
        public byte[] get(String url, Duration timeout) {
            timeouts.add(timeout);
            return encoding.toLegacy("<html><body><a href=\"next.do\">次へ</a></body></html>");
        }

        @Override
        public byte[] post(String url, byte[] body, String contentType, Duration timeout) {
            timeouts.add(timeout);
            lastBody = body;
            lastContentType = contentType;
            return encoding.toLegacy("RET=00\r\nRECEP_NO=1\r\n");
        }
    }

    @Test
    void submitSendsLegacyBytesWithoutPercentEncoding() {
        EchoTransport transport = new EchoTransport();
        PortalSession session = new PortalSession(transport, encoding, "https://portal.test", Duration.ofSeconds(30),
                Deadline.none());

        session.submit("https://portal.test/jpnic/x.do", FormSubmission.create().add("a", "検索").add("b", "%81%40"));

        assertArrayEquals(encoding.toLegacy("a=検索&b=%81%40"), transport.lastBody);
        assertEquals(PortalSession.FORM_CONTENT_TYPE, transport.lastContentType);
    }

    @Test
    void fetchedPagesResolveLinksAgainstTheirUrl() {
        PortalSession session = new PortalSession(new EchoTransport(), encoding, "https://portal.test",
                Duration.ofSeconds(30), Deadline.none());
        Document page = session.fetchPage("https://portal.test/jpnic/menu.do");
        assertEquals("https://portal.test/jpnic/next.do", page.selectFirst("a").absUrl("href"));
    }

    @Test
    void exchangeLinesUsesTransactionContentType() {
        EchoTransport transport = new EchoTransport();
        PortalSession session = new PortalSession(transport, encoding, "https://portal.test", Duration.ofSeconds(30),
                Deadline.none());
        List<String> lines = session.exchangeLines("https://portal.test/webtrans/WebRegisterCtl", "A=1");
        assertEquals(List.of("RET=00", "RECEP_NO=1"), lines);
        assertEquals("text/html", transport.lastContentType);
    }

    @Test
    void requestTimeoutIsBoundedByTheDeadline() {
        EchoTransport transport = new EchoTransport();
        PortalSession session = new PortalSession(transport, encoding, "https://portal.test", Duration.ofSeconds(30),
                Deadline.after(Duration.ofSeconds(5)));
        session.get("https://portal.test/");
        assertTrue(transport.timeouts.get(0).compareTo(Duration.ofSeconds(5)) <= 0);
    }

    @Test
    void expiredDeadlineStopsBeforeTheRequest() {
        EchoTransport transport = new EchoTransport();
        PortalSession session = new PortalSession(transport, encoding, "https://portal.test", Duration.ofSeconds(30),
                Deadline.after(Duration.ZERO, Clock.systemUTC()));
        assertThrows(PortalTimeoutException.class, () -> session.get("https://portal.test/"));
        assertTrue(transport.timeouts.isEmpty());
    }
}
