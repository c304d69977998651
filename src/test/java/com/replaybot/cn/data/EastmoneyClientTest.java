package com.replaybot.cn.data;

import com.replaybot.cn.config.Config;
import com.replaybot.cn.model.ServerCandidate;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EastmoneyClientTest {
    private HttpServer server;
    private final List<Integer> clientPorts = Collections.synchronizedList(new ArrayList<>());
    private volatile long handlerDelayMs;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void parseQuote_shouldReadNumericField() {
        QuoteResult result = EastmoneyClient.parseQuote("{\"rc\":0,\"data\":{\"f60\":10.52}}", "f60");

        assertTrue(result.ok());
        assertEquals(10.52, result.value, 1e-9);
    }

    @Test
    void parseQuote_shouldAcceptNumericString() {
        QuoteResult result = EastmoneyClient.parseQuote("{\"data\":{\"f60\":\"3.07\"}}", "f60");

        assertTrue(result.ok());
        assertEquals(3.07, result.value, 1e-9);
    }

    @Test
    void parseQuote_shouldTreatPlaceholderAndGapsAsInvalid() {
        assertEquals(QuoteResult.Kind.INVALID, EastmoneyClient.parseQuote("{\"data\":{\"f60\":\"-\"}}", "f60").kind);
        assertEquals(QuoteResult.Kind.INVALID, EastmoneyClient.parseQuote("{\"data\":null}", "f60").kind);
        assertEquals(QuoteResult.Kind.INVALID, EastmoneyClient.parseQuote("{\"data\":{}}", "f60").kind);
        assertEquals(QuoteResult.Kind.INVALID, EastmoneyClient.parseQuote("{\"data\":{\"f60\":null}}", "f60").kind);
        assertEquals(QuoteResult.Kind.INVALID, EastmoneyClient.parseQuote("{\"data\":{\"f60\":0}}", "f60").kind);
    }

    @Test
    void parseQuote_shouldTreatGarbageAsError() {
        assertEquals(QuoteResult.Kind.ERROR, EastmoneyClient.parseQuote("<html>busy</html>", "f60").kind);
    }

    @Test
    void fetchPreClose_shouldRequestSecidWithDecimalPrices() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        ServerCandidate candidate = startServer(200, "{\"data\":{\"f60\":8.8}}", query, new AtomicInteger());
        EastmoneyClient client = new EastmoneyClient(testConfig());

        QuoteResult result = client.fetchPreClose(candidate, "600000");

        assertTrue(result.ok());
        assertEquals(8.8, result.value, 1e-9);
        assertTrue(query.get().contains("secid=1.600000"));
        assertTrue(query.get().contains("fields=f60"));
        assertTrue(query.get().contains("fltt=2"));
    }

    @Test
    void fetchPreClose_shouldReportHttpErrorStatus() throws Exception {
        ServerCandidate candidate = startServer(503, "busy", new AtomicReference<>(), new AtomicInteger());
        EastmoneyClient client = new EastmoneyClient(testConfig());

        QuoteResult result = client.fetchPreClose(candidate, "000001");

        assertEquals(QuoteResult.Kind.ERROR, result.kind);
        assertTrue(result.error.contains("503"));
    }

    @Test
    void probe_shouldRequireDataObject() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        ServerCandidate healthy = startServer(200, "{\"data\":{\"f60\":3000.1}}", new AtomicReference<>(), hits);
        EastmoneyClient client = new EastmoneyClient(testConfig());

        assertTrue(client.probe(healthy));
        assertEquals(1, hits.get());

        server.stop(0);
        ServerCandidate empty = startServer(200, "{\"data\":null}", new AtomicReference<>(), hits);
        assertFalse(client.probe(empty));
    }

    @Test
    void fetchPreClose_shouldOpenFreshConnectionPerAttempt() throws Exception {
        ServerCandidate candidate = startServer(200, "{\"data\":{\"f60\":5.5}}", new AtomicReference<>(), new AtomicInteger());
        EastmoneyClient client = new EastmoneyClient(testConfig());

        for (int i = 0; i < 3; i++) {
            assertTrue(client.fetchPreClose(candidate, "000001").ok());
        }
        assertTrue(client.probe(candidate));

        assertEquals(4, clientPorts.size());
        assertEquals(4, new HashSet<>(clientPorts).size());
    }

    @Test
    void probe_shouldUseShortProbeTimeout() throws Exception {
        handlerDelayMs = 3000L;
        ServerCandidate slow = startServer(200, "{\"data\":{\"f60\":3000.1}}", new AtomicReference<>(), new AtomicInteger());
        EastmoneyClient client = new EastmoneyClient(Config.fromConfigurationProperties(Path.of("."), Map.of(
                "eastmoney", Map.of("timeout_sec", 30, "probe_timeout_sec", 1)
        )));

        long started = System.nanoTime();
        assertThrows(IOException.class, () -> client.probe(slow));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        assertTrue(elapsedMs < 2500L, "probe waited " + elapsedMs + " ms");
    }

    private Config testConfig() {
        return Config.fromConfigurationProperties(Path.of("."), Map.of(
                "eastmoney", Map.of("timeout_sec", 3, "field", "f60")
        ));
    }

    private ServerCandidate startServer(int status, String body, AtomicReference<String> query, AtomicInteger hits)
            throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/api/qt/stock/get", exchange -> {
            hits.incrementAndGet();
            clientPorts.add(exchange.getRemoteAddress().getPort());
            if (handlerDelayMs > 0L) {
                try {
                    Thread.sleep(handlerDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            query.set(exchange.getRequestURI().getRawQuery());
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        return new ServerCandidate("127.0.0.1", server.getAddress().getPort());
    }
}
