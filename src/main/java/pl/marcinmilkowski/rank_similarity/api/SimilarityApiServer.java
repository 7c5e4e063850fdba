package pl.marcinmilkowski.rank_similarity.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.rank_similarity.config.SimilarityConfig;
import pl.marcinmilkowski.rank_similarity.config.SimilarityConfigLoader;
import pl.marcinmilkowski.rank_similarity.kendall.KendallResult;
import pl.marcinmilkowski.rank_similarity.measure.RankBiasedOverlap;
import pl.marcinmilkowski.rank_similarity.measure.RankingSimilarity;
import pl.marcinmilkowski.rank_similarity.model.RankedList;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * REST API server for ranking similarity.
 *
 * Endpoints:
 * - GET  /health       - Health check
 * - GET  /api/config   - Active default parameters
 * - POST /api/rbo      - Fixed-depth RBO: {"first": [...], "second": [...], "depth": 10, "p": 0.9, "extrapolate": true}
 * - POST /api/rbo-ext  - Extrapolated RBO: {"first": [...], "second": [...], "p": 0.98}
 * - POST /api/kendall  - Kendall tau-b over shared items: {"first": [...], "second": [...]}
 *
 * Omitted parameters fall back to the loaded configuration.
 */
public class SimilarityApiServer {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityApiServer.class);

    private final SimilarityConfigLoader configLoader;
    private final SimilarityConfig defaults;
    private final int port;
    private HttpServer server;

    public SimilarityApiServer(SimilarityConfigLoader configLoader, int port) {
        if (configLoader == null) throw new IllegalArgumentException("configLoader must not be null");
        this.configLoader = configLoader;
        this.defaults = configLoader.getConfig();
        this.port = port;
    }

    /**
     * Start the API server. Port 0 binds an ephemeral port, see {@link #getPort()}.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", wrapHandler(this::handleHealth));
        server.createContext("/api/config", wrapHandler(this::handleConfig));
        server.createContext("/api/rbo", wrapHandler(this::handleRbo));
        server.createContext("/api/rbo-ext", wrapHandler(this::handleRboExt));
        server.createContext("/api/kendall", wrapHandler(this::handleKendall));

        server.setExecutor(null);
        server.start();
        logger.info("API server started on http://localhost:{}", getPort());
        logger.info("Endpoints:");
        logger.info("  GET  /health       - Health check");
        logger.info("  GET  /api/config   - Active default parameters");
        logger.info("  POST /api/rbo      - Fixed-depth rank-biased overlap");
        logger.info("  POST /api/rbo-ext  - Extrapolated rank-biased overlap");
        logger.info("  POST /api/kendall  - Kendall tau-b over shared items");
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            logger.info("API server stopped");
        }
    }

    /**
     * Bound port; differs from the requested one when 0 was requested.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Wrap a handler to map validation failures to 400 and everything else to 500.
     */
    private HttpHandler wrapHandler(HttpHandler handler) {
        return exchange -> {
            if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                addCorsHeaders(exchange);
                exchange.sendResponseHeaders(204, -1);
                exchange.close();
                return;
            }
            try {
                addCorsHeaders(exchange);
                handler.handle(exchange);
            } catch (IllegalArgumentException | JSONException e) {
                // bad rankings and parameters are client errors
                logger.debug("Rejected request to {}: {}", exchange.getRequestURI(), e.getMessage());
                sendErrorIfPossible(exchange, 400, e.getMessage());
            } catch (Exception e) {
                logger.error("Unhandled exception for {}", exchange.getRequestURI(), e);
                sendErrorIfPossible(exchange, 500,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            } finally {
                exchange.close();
            }
        };
    }

    private void sendErrorIfPossible(HttpExchange exchange, int status, String message) {
        if (exchange.getResponseCode() != -1) {
            logger.warn("Cannot send error response: headers already sent");
            return;
        }
        try {
            sendError(exchange, status, message);
        } catch (IOException e) {
            logger.debug("Failed to send error response: {}", e.getMessage());
        }
    }

    private void addCorsHeaders(HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type, Authorization");
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", "rank-similarity");
        response.put("port", getPort());
        sendJson(exchange, 200, response);
    }

    private void handleConfig(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("config", configLoader.toJson());
        sendJson(exchange, 200, response);
    }

    private void handleRbo(HttpExchange exchange) throws IOException {
        JSONObject request = readPostJson(exchange);
        if (request == null) {
            return;
        }
        RankingSimilarity<Object> similarity = similarityOf(request);

        int depth = request.get("depth") != null
            ? SimilarityConfig.checkedDepth(request.getLongValue("depth"))
            : defaults.depth();
        double p = request.get("p") != null ? request.getDoubleValue("p") : defaults.persistence();
        Boolean extrapolateParam = request.getBoolean("extrapolate");
        boolean extrapolate = extrapolateParam != null ? extrapolateParam : defaults.extrapolate();

        double score = similarity.rbo(depth, p, extrapolate);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("measure", "rbo");
        response.put("depth", depth == RankBiasedOverlap.UNBOUNDED ? null : depth);
        response.put("p", p);
        response.put("extrapolate", extrapolate);
        response.put("score", score);
        sendJson(exchange, 200, response);
    }

    private void handleRboExt(HttpExchange exchange) throws IOException {
        JSONObject request = readPostJson(exchange);
        if (request == null) {
            return;
        }
        RankingSimilarity<Object> similarity = similarityOf(request);
        double p = request.get("p") != null ? request.getDoubleValue("p") : defaults.extrapolationPersistence();

        double score = similarity.rboExt(p);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("measure", "rbo_ext");
        response.put("p", p);
        response.put("score", score);
        sendJson(exchange, 200, response);
    }

    private void handleKendall(HttpExchange exchange) throws IOException {
        JSONObject request = readPostJson(exchange);
        if (request == null) {
            return;
        }
        KendallResult result = similarityOf(request).kendall();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("measure", "kendall");
        response.put("coefficient", result.isDefined() ? result.coefficient() : null);
        response.put("common", result.commonCount());
        response.put("first_coverage", result.firstCoverage());
        response.put("second_coverage", result.secondCoverage());
        sendJson(exchange, 200, response);
    }

    /**
     * Read a JSON object body; answers 405/400 itself and returns null when the request is unusable.
     */
    private JSONObject readPostJson(HttpExchange exchange) throws IOException {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return null;
        }
        String body = readRequestBody(exchange);
        JSONObject request = body.isBlank() ? null : JSON.parseObject(body);
        if (request == null) {
            sendError(exchange, 400, "Request body must be a JSON object");
            return null;
        }
        return request;
    }

    private RankingSimilarity<Object> similarityOf(JSONObject request) {
        if (!request.containsKey("first") || !request.containsKey("second")) {
            throw new IllegalArgumentException("Missing required fields: first, second");
        }
        RankedList<Object> first = RankedList.from(request.get("first"));
        RankedList<Object> second = RankedList.from(request.get("second"));
        return new RankingSimilarity<>(first, second);
    }

    private String readRequestBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private void sendJson(HttpExchange exchange, int status, Map<String, Object> data) throws IOException {
        String json = JSON.toJSONString(data, JSONWriter.Feature.WriteMapNullValue);
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-store, no-cache, must-revalidate, max-age=0");
        exchange.sendResponseHeaders(status, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", "error");
        error.put("message", message);
        error.put("code", status);
        sendJson(exchange, status, error);
    }

    public static class Builder {
        private SimilarityConfigLoader configLoader;
        private int port = 8080;

        public Builder withConfig(SimilarityConfigLoader configLoader) {
            this.configLoader = configLoader;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public SimilarityApiServer build() {
            if (configLoader == null) {
                throw new IllegalStateException("Config loader is required");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalStateException(String.format(Locale.ROOT, "Invalid port: %d", port));
            }
            return new SimilarityApiServer(configLoader, port);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
