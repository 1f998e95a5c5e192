package me.golemcore.engine.adapter.outbound.health;

import me.golemcore.engine.domain.model.HealthProbeResult;
import me.golemcore.engine.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OkHttpHealthProbeTest {

    private OkHttpMockEngine mockEngine;
    private OkHttpHealthProbe probe;

    @BeforeEach
    void setUp() {
        mockEngine = new OkHttpMockEngine();
        probe = new OkHttpHealthProbe(new OkHttpClient.Builder().addInterceptor(mockEngine).build());
    }

    @Test
    void shouldReportHealthyOn2xx() {
        mockEngine.enqueueJson(200, "{\"status\":\"ok\"}");

        HealthProbeResult result = probe.probe("http://127.0.0.1:12345/health", 250);

        assertTrue(result.healthy());
        assertNull(result.detail());
        OkHttpMockEngine.CapturedRequest request = mockEngine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/health", request.target());
    }

    @Test
    void shouldReportStatusCodeOnErrorAnswer() {
        mockEngine.enqueueText(503, "loading", "text/plain");

        HealthProbeResult result = probe.probe("http://127.0.0.1:12345/health", 250);

        assertFalse(result.healthy());
        assertTrue(result.detail().startsWith("503"));
    }

    @Test
    void shouldReportTransportFailure() {
        mockEngine.enqueueFailure(new ConnectException("Connection refused"));

        HealthProbeResult result = probe.probe("http://127.0.0.1:12345/health", 250);

        assertFalse(result.healthy());
        assertEquals("Connection refused", result.detail());
    }

    @Test
    void shouldRejectMissingOrInvalidUrlWithoutRequest() {
        assertFalse(probe.probe(null, 250).healthy());
        assertEquals("no health url", probe.probe(" ", 250).detail());
        assertTrue(probe.probe("not a url", 250).detail().startsWith("invalid health url"));
        assertEquals(0, mockEngine.getRequestCount());
    }
}
