package com.capturequeue.app;

import com.capturequeue.core.FetchFailure;
import com.capturequeue.core.FetchedContent;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpContentFetcherTest {
    private HttpServer server;
    private String baseUrl;
    private HttpContentFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/page", exchange -> respond(exchange, 200, "text/html; charset=utf-8",
                "<html><head><title>  Caf&amp;e\n Notes </title></head><body><p>héllo</p></body></html>"));
        server.createContext("/untitled", exchange -> respond(exchange, 200, "text/html",
                "<html><body>no title</body></html>"));
        server.createContext("/missing", exchange -> respond(exchange, 404, "text/plain", "nope"));
        server.createContext("/big", exchange -> respond(exchange, 200, "text/html", "x".repeat(5000)));
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().set("Location", baseUrl + "/page");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "text/html", "late");
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
        fetcher = new HttpContentFetcher(1024);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void fetchesBodyAndTitle() throws Exception {
        FetchedContent fetched = fetcher.fetchContent(baseUrl + "/page", Duration.ofSeconds(5));

        assertTrue(fetched.getContent().contains("<p>héllo</p>"));
        assertEquals("Caf&e Notes", fetched.getTitle());
    }

    @Test
    void missingTitleIsNull() throws Exception {
        assertNull(fetcher.fetchContent(baseUrl + "/untitled", Duration.ofSeconds(5)).getTitle());
    }

    @Test
    void followsRedirects() throws Exception {
        FetchedContent fetched = fetcher.fetchContent(baseUrl + "/moved", Duration.ofSeconds(5));
        assertEquals("Caf&e Notes", fetched.getTitle());
    }

    @Test
    void non2xxIsAFetchFailure() {
        FetchFailure failure = assertThrows(FetchFailure.class,
                () -> fetcher.fetchContent(baseUrl + "/missing", Duration.ofSeconds(5)));
        assertEquals("HTTP 404", failure.getMessage());
        assertEquals(baseUrl + "/missing", failure.getUrl());
    }

    @Test
    void oversizedBodyIsRejected() {
        FetchFailure failure = assertThrows(FetchFailure.class,
                () -> fetcher.fetchContent(baseUrl + "/big", Duration.ofSeconds(5)));
        assertEquals("Content exceeds 1024 bytes", failure.getMessage());
    }

    @Test
    void slowServerTimesOut() {
        FetchFailure failure = assertThrows(FetchFailure.class,
                () -> fetcher.fetchContent(baseUrl + "/slow", Duration.ofMillis(200)));
        assertEquals("Timeout after 200 ms", failure.getMessage());
    }

    @Test
    void malformedUrlIsAFetchFailure() {
        assertThrows(FetchFailure.class, () -> fetcher.fetchContent("notaurl", Duration.ofSeconds(1)));
    }

    @Test
    void charsetFallsBackToUtf8() {
        assertEquals(StandardCharsets.ISO_8859_1, HttpContentFetcher.charsetOf("text/html; charset=ISO-8859-1"));
        assertEquals(StandardCharsets.UTF_8, HttpContentFetcher.charsetOf("text/html; charset=bogus-set"));
        assertEquals(StandardCharsets.UTF_8, HttpContentFetcher.charsetOf(null));
    }
}
