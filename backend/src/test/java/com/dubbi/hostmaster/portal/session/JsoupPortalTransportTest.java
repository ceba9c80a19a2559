package com.dubbi.hostmaster.portal.session;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dubbi.hostmaster.portal.error.TransportException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsoupPortalTransportTest {
    private HttpServer server;
    private String base;
    private final List<String> cookies = new ArrayList<>();
    private final List<String> contentTypes = new ArrayList<>();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/login", ex -> {
            ex.getResponseHeaders().add("Set-Cookie", "SID=abc123; Path=/");
            reply(ex, 200, "<html>ok</html>".getBytes());
        });
        server.createContext("/echo", ex -> {
            cookies.add(String.valueOf(ex.getRequestHeaders().getFirst("Cookie")));
            contentTypes.add(String.valueOf(ex.getRequestHeaders().getFirst("Content-Type")));
            reply(ex, 200, ex.getRequestBody().readAllBytes());
        });
        server.createContext("/broken", ex -> reply(ex, 500, "boom".getBytes()));
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private static void reply(HttpExchange ex, int status, byte[] body) throws IOException {
        ex.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream out = ex.getResponseBody()) {
            out.write(body);
        }
    }

    @Test
    void legacyBytesAndCookiesSurviveTheRoundTrip() {
        JsoupPortalTransport transport = new JsoupPortalTransport("test-agent", null);
        transport.get(base + "/login", Duration.ofSeconds(5));

        byte[] body = LegacyEncoding.windows31j().toLegacy("a=検索&b=%81%40");
        byte[] echoed = transport.post(base + "/echo", body, "text/html", Duration.ofSeconds(5));

        assertArrayEquals(body, echoed);
        assertTrue(cookies.get(0).contains("SID=abc123"), cookies.get(0));
        assertEquals("text/html", contentTypes.get(0));
    }

    @Test
    void httpErrorBecomesTransportFailureWithStatus() {
        JsoupPortalTransport transport = new JsoupPortalTransport("test-agent", null);
        TransportException e = assertThrows(TransportException.class,
                () -> transport.get(base + "/broken", Duration.ofSeconds(5)));
        assertEquals(500, e.getStatus());
    }

    @Test
    void unreachableHostBecomesTransportFailure() {
        JsoupPortalTransport transport = new JsoupPortalTransport("test-agent", null);
        server.stop(0);
        TransportException e = assertThrows(TransportException.class,
                () -> transport.get(base + "/login", Duration.ofSeconds(2)));
        assertNull(e.getStatus());
    }
}
