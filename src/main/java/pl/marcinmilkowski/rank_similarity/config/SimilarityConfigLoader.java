package pl.marcinmilkowski.rank_similarity.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.rank_similarity.measure.RankBiasedOverlap;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads default similarity parameters from JSON.
 *
 * Expected JSON structure:
 * {
 *   "version": "1.0",
 *   "persistence": 0.9,
 *   "extrapolate": true,
 *   "depth": 10,
 *   "extrapolation_persistence": 0.98,
 *   "progress_delta": 10
 * }
 *
 * Only "version" is required. A missing "depth" means unbounded.
 */
public class SimilarityConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "/rank-similarity.json";

    private final String version;
    private final SimilarityConfig config;
    private final String source;

    /**
     * Load configuration from the specified path.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the content is invalid
     */
    public SimilarityConfigLoader(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Similarity config file not found: " + configPath);
        }
        this.source = configPath.toString();
        JSONObject root = parseRoot(Files.readString(configPath), source);
        this.version = root.getString("version");
        this.config = parse(root);
        logger.info("Loaded similarity config version {} from {}", version, source);
    }

    private SimilarityConfigLoader(String content, String source) {
        this.source = source;
        JSONObject root = parseRoot(content, source);
        this.version = root.getString("version");
        this.config = parse(root);
        logger.debug("Loaded similarity config version {} from {}", version, source);
    }

    /**
     * Load the configuration bundled on the classpath.
     */
    public static SimilarityConfigLoader fromClasspath() throws IOException {
        try (InputStream in = SimilarityConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled similarity config not found: " + DEFAULT_RESOURCE);
            }
            return new SimilarityConfigLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8),
                "classpath:" + DEFAULT_RESOURCE);
        }
    }

    public static SimilarityConfigLoader fromString(String json) {
        return new SimilarityConfigLoader(json, "inline");
    }

    private static JSONObject parseRoot(String content, String source) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed similarity config " + source + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty similarity config: " + source);
        }
        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in similarity config");
        }
        return root;
    }

    private static SimilarityConfig parse(JSONObject root) {
        SimilarityConfig defaults = SimilarityConfig.defaults();

        double persistence = doubleOrDefault(root, "persistence", defaults.persistence());
        if (persistence != 1.0 && !(persistence > 0.0 && persistence < 1.0)) {
            throw new IllegalArgumentException("'persistence' must be 1.0 or in (0, 1), got " + persistence);
        }

        double extrapolationPersistence = doubleOrDefault(root, "extrapolation_persistence",
            defaults.extrapolationPersistence());
        if (!(extrapolationPersistence > 0.0 && extrapolationPersistence < 1.0)) {
            throw new IllegalArgumentException("'extrapolation_persistence' must be in (0, 1), got "
                + extrapolationPersistence);
        }

        int depth = RankBiasedOverlap.UNBOUNDED;
        if (root.containsKey("depth") && root.get("depth") != null) {
            depth = SimilarityConfig.checkedDepth(root.getLongValue("depth"));
        }

        int progressDelta = root.getIntValue("progress_delta", defaults.progressDelta());
        if (progressDelta < 1 || progressDelta > 100) {
            throw new IllegalArgumentException("'progress_delta' must be in [1, 100], got " + progressDelta);
        }

        Boolean extrapolate = root.getBoolean("extrapolate");
        return new SimilarityConfig(
            persistence,
            extrapolate != null ? extrapolate : defaults.extrapolate(),
            depth,
            extrapolationPersistence,
            progressDelta);
    }

    private static double doubleOrDefault(JSONObject root, String key, double defaultValue) {
        Double value = root.getDouble(key);
        return value != null ? value : defaultValue;
    }

    public String getVersion() {
        return version;
    }

    public SimilarityConfig getConfig() {
        return config;
    }

    public String getSource() {
        return source;
    }

    /**
     * Export the active configuration as a JSON-compatible map.
     */
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("version", version);
        json.put("source", source);
        json.put("persistence", config.persistence());
        json.put("extrapolate", config.extrapolate());
        json.put("depth", config.isDepthBounded() ? config.depth() : null);
        json.put("extrapolation_persistence", config.extrapolationPersistence());
        json.put("progress_delta", config.progressDelta());
        return json;
    }
}
