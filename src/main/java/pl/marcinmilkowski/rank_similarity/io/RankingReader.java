package pl.marcinmilkowski.rank_similarity.io;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.rank_similarity.model.RankedList;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads rankings from files and command-line strings.
 *
 * Supported formats:
 * - plain text: one item per line, blank lines and lines starting with '#' skipped
 * - JSON (file name ending in .json): a top-level array of items
 * - inline: comma-separated items
 *
 * Items are read as strings.
 */
public final class RankingReader {

    private static final Logger logger = LoggerFactory.getLogger(RankingReader.class);

    private RankingReader() {
    }

    public static RankedList<String> read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Ranking file not found: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        List<String> items = fileName.endsWith(".json") ? readJson(path) : readLines(path);
        logger.debug("Read {} items from {}", items.size(), path);
        return RankedList.of(items);
    }

    public static RankedList<String> parseInline(String csv) {
        if (csv == null) {
            throw new IllegalArgumentException("csv must not be null");
        }
        List<String> items = new ArrayList<>();
        for (String part : csv.split(",")) {
            String item = part.trim();
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return RankedList.of(items);
    }

    private static List<String> readLines(Path path) throws IOException {
        List<String> items = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String item = line.trim();
                if (item.isEmpty() || item.startsWith("#")) {
                    continue;
                }
                items.add(item);
            }
        }
        return items;
    }

    private static List<String> readJson(Path path) throws IOException {
        Object parsed;
        try {
            parsed = JSON.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (JSONException e) {
            throw new IOException("Malformed JSON ranking in " + path + ": " + e.getMessage(), e);
        }
        if (!(parsed instanceof JSONArray array)) {
            throw new IOException("Expected a JSON array in " + path);
        }
        List<String> items = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (value == null) {
                throw new IOException("Null item at rank " + i + " in " + path);
            }
            items.add(value.toString());
        }
        return items;
    }
}
