package pl.marcinmilkowski.rank_similarity.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.rank_similarity.config.SimilarityConfigLoader;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the API server over HTTP on an ephemeral port.
 */
class SimilarityApiServerTest {

    private SimilarityApiServer server;
    private HttpClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        SimilarityConfigLoader config = SimilarityConfigLoader.fromString(
            "{\"version\": \"test\", \"persistence\": 1.0, \"extrapolation_persistence\": 0.9}");
        server = SimilarityApiServer.builder()
            .withConfig(config)
            .withPort(0)
            .build();
        server.start();
        client = HttpClient.newHttpClient();
        baseUrl = "http://localhost:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JSONObject json = JSON.parseObject(response.body());
        assertEquals("ok", json.getString("status"));
        assertEquals("rank-similarity", json.getString("service"));
    }

    @Test
    void testConfig() throws Exception {
        JSONObject json = JSON.parseObject(get("/api/config").body());
        assertEquals("test", json.getJSONObject("config").getString("version"));
    }

    @Test
    @DisplayName("POST /api/rbo uses config defaults when parameters are omitted")
    void testRboDefaults() throws Exception {
        HttpResponse<String> response = post("/api/rbo",
            "{\"first\": [\"a\",\"b\",\"c\",\"d\",\"e\"], \"second\": [\"e\",\"d\",\"c\"], \"depth\": 3}");

        assertEquals(200, response.statusCode());
        JSONObject json = JSON.parseObject(response.body());
        assertEquals("rbo", json.getString("measure"));
        assertEquals(3, json.getIntValue("depth"));
        assertEquals(1.0 / 9.0, json.getDoubleValue("score"), 1e-9);
    }

    @Test
    void testRboWeightedExtrapolated() throws Exception {
        HttpResponse<String> response = post("/api/rbo",
            "{\"first\": [\"a\",\"b\",\"c\"], \"second\": [\"a\",\"c\",\"b\"], \"p\": 0.9, \"extrapolate\": true}");

        JSONObject json = JSON.parseObject(response.body());
        assertEquals(200, response.statusCode());
        assertEquals(0.955, json.getDoubleValue("score"), 1e-9);
        assertNull(json.get("depth"));
    }

    @Test
    @DisplayName("A depth beyond the int range is rejected, not truncated")
    void testOversizedDepthRejected() throws Exception {
        HttpResponse<String> response = post("/api/rbo",
            "{\"first\": [\"a\",\"b\",\"c\"], \"second\": [\"a\",\"c\",\"b\"], \"depth\": 4294967297}");

        assertEquals(400, response.statusCode());
        assertTrue(JSON.parseObject(response.body()).getString("message").contains("depth"));
    }

    @Test
    void testNullDepthFallsBackToUnbounded() throws Exception {
        HttpResponse<String> response = post("/api/rbo",
            "{\"first\": [\"a\",\"b\",\"c\"], \"second\": [\"a\",\"c\",\"b\"], \"depth\": null}");

        assertEquals(200, response.statusCode());
        assertEquals(2.5 / 3.0, JSON.parseObject(response.body()).getDoubleValue("score"), 1e-9);
    }

    @Test
    @DisplayName("A null persistence falls back to the configured default")
    void testNullPersistenceUsesDefault() throws Exception {
        HttpResponse<String> rbo = post("/api/rbo",
            "{\"first\": [\"a\",\"b\",\"c\"], \"second\": [\"a\",\"c\",\"b\"], \"p\": null}");
        assertEquals(200, rbo.statusCode());
        JSONObject rboJson = JSON.parseObject(rbo.body());
        assertEquals(1.0, rboJson.getDoubleValue("p"), 1e-12);
        assertEquals(2.5 / 3.0, rboJson.getDoubleValue("score"), 1e-9);

        HttpResponse<String> ext = post("/api/rbo-ext",
            "{\"first\": [\"a\"], \"second\": [\"a\"], \"p\": null}");
        assertEquals(200, ext.statusCode());
        assertEquals(0.9, JSON.parseObject(ext.body()).getDoubleValue("p"), 1e-12);
    }

    @Test
    void testRboExt() throws Exception {
        HttpResponse<String> response = post("/api/rbo-ext",
            "{\"first\": [\"a\",\"b\"], \"second\": [\"c\",\"a\",\"d\"], \"p\": 0.5}");

        assertEquals(200, response.statusCode());
        assertEquals(0.25, JSON.parseObject(response.body()).getDoubleValue("score"), 1e-9);
    }

    @Test
    void testKendall() throws Exception {
        HttpResponse<String> response = post("/api/kendall",
            "{\"first\": [1, 2, 3], \"second\": [3, 2, 1]}");

        JSONObject json = JSON.parseObject(response.body());
        assertEquals(200, response.statusCode());
        assertEquals(-1.0, json.getDoubleValue("coefficient"), 1e-9);
        assertEquals(3, json.getIntValue("common"));
        assertEquals(100.0, json.getDoubleValue("first_coverage"), 1e-9);
    }

    @Test
    @DisplayName("Duplicate items are a client error")
    void testDuplicateRejected() throws Exception {
        HttpResponse<String> response = post("/api/rbo",
            "{\"first\": [\"a\",\"a\",\"b\"], \"second\": [\"a\"]}");

        assertEquals(400, response.statusCode());
        JSONObject json = JSON.parseObject(response.body());
        assertEquals("error", json.getString("status"));
        assertTrue(json.getString("message").contains("Duplicate"));
    }

    @Test
    void testInvalidPersistenceRejected() throws Exception {
        HttpResponse<String> response = post("/api/rbo-ext",
            "{\"first\": [\"a\"], \"second\": [\"a\"], \"p\": 1.0}");
        assertEquals(400, response.statusCode());
    }

    @Test
    void testNonSequenceRejected() throws Exception {
        HttpResponse<String> response = post("/api/rbo",
            "{\"first\": \"abc\", \"second\": [\"a\"]}");
        assertEquals(400, response.statusCode());
    }

    @Test
    void testMissingFields() throws Exception {
        assertEquals(400, post("/api/kendall", "{\"first\": [\"a\"]}").statusCode());
    }

    @Test
    void testWrongMethod() throws Exception {
        assertEquals(405, get("/api/rbo").statusCode());
    }
}
