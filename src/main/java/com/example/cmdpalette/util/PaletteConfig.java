package com.example.cmdpalette.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Tunables for the command palette, read from a YAML resource on the classpath.
 * <pre>
 * history:
 *   maxEntries: 50
 * search:
 *   maxResults: 10
 *   shortcutPrefix: ":"
 *   shortcutPrefixMatching: false
 *   fuzzyMinLength: 2
 * </pre>
 * System properties {@code cmdpalette.history.maxEntries} and
 * {@code cmdpalette.search.maxResults} override the file.
 */
public class PaletteConfig {

    private static final Logger logger = LoggerFactory.getLogger(PaletteConfig.class);

    public static final String DEFAULT_RESOURCE = "/palette.yaml";
    public static final String RESOURCE_PROPERTY = "cmdpalette.config";

    public static final int DEFAULT_MAX_HISTORY = 50;
    public static final int DEFAULT_MAX_RESULTS = 10;
    public static final String DEFAULT_SHORTCUT_PREFIX = ":";
    public static final int DEFAULT_FUZZY_MIN_LENGTH = 2;

    private final int maxHistoryEntries;
    private final int maxSearchResults;
    private final String shortcutPrefix;
    private final boolean shortcutPrefixMatching;
    private final int fuzzyMinLength;

    public PaletteConfig(int maxHistoryEntries, int maxSearchResults, String shortcutPrefix,
                         boolean shortcutPrefixMatching, int fuzzyMinLength) {
        if (maxHistoryEntries < 1) {
            throw new IllegalStateException("history.maxEntries must be at least 1, got " + maxHistoryEntries);
        }
        if (maxSearchResults < 1) {
            throw new IllegalStateException("search.maxResults must be at least 1, got " + maxSearchResults);
        }
        if (shortcutPrefix == null || shortcutPrefix.length() != 1 || Character.isWhitespace(shortcutPrefix.charAt(0))) {
            throw new IllegalStateException("search.shortcutPrefix must be a single non-blank character");
        }
        if (fuzzyMinLength < 1) {
            throw new IllegalStateException("search.fuzzyMinLength must be at least 1, got " + fuzzyMinLength);
        }
        this.maxHistoryEntries = maxHistoryEntries;
        this.maxSearchResults = maxSearchResults;
        this.shortcutPrefix = shortcutPrefix;
        this.shortcutPrefixMatching = shortcutPrefixMatching;
        this.fuzzyMinLength = fuzzyMinLength;
    }

    public static PaletteConfig defaults() {
        return new PaletteConfig(DEFAULT_MAX_HISTORY, DEFAULT_MAX_RESULTS, DEFAULT_SHORTCUT_PREFIX,
                false, DEFAULT_FUZZY_MIN_LENGTH);
    }

    /**
     * Load from the resource named by {@code cmdpalette.config}, or {@value #DEFAULT_RESOURCE}.
     */
    public static PaletteConfig load() {
        return load(System.getProperty(RESOURCE_PROPERTY, DEFAULT_RESOURCE));
    }

    /**
     * Load from a classpath resource. A missing resource yields the defaults.
     *
     * @throws IllegalStateException if the resource is not valid YAML or holds invalid values
     */
    public static PaletteConfig load(String resourcePath) {
        Map<String, Object> root = Map.of();
        try (InputStream in = PaletteConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.info("No palette config at {}, using defaults", resourcePath);
            } else {
                root = parse(new InputStreamReader(in, StandardCharsets.UTF_8), resourcePath);
                logger.debug("Loaded palette config from {}", resourcePath);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read palette config " + resourcePath, e);
        }
        return fromMap(root);
    }

    /**
     * Load from YAML text supplied by the caller.
     */
    public static PaletteConfig fromReader(Reader reader) {
        return fromMap(parse(reader, "<reader>"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(Reader reader, String source) {
        Object obj;
        try {
            obj = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed palette config " + source + ": " + e.getMessage(), e);
        }
        if (obj == null) {
            return Map.of();
        }
        if (!(obj instanceof Map)) {
            throw new IllegalStateException("Palette config " + source + " must be a mapping");
        }
        return (Map<String, Object>) obj;
    }

    private static PaletteConfig fromMap(Map<String, Object> root) {
        Map<String, Object> history = section(root, "history");
        Map<String, Object> search = section(root, "search");

        int maxHistory = intValue(history.get("maxEntries"), DEFAULT_MAX_HISTORY, "history.maxEntries");
        int maxResults = intValue(search.get("maxResults"), DEFAULT_MAX_RESULTS, "search.maxResults");
        Object prefix = search.get("shortcutPrefix");
        Object prefixMatching = search.get("shortcutPrefixMatching");
        int fuzzyMin = intValue(search.get("fuzzyMinLength"), DEFAULT_FUZZY_MIN_LENGTH, "search.fuzzyMinLength");

        maxHistory = intValue(System.getProperty("cmdpalette.history.maxEntries"), maxHistory,
                "cmdpalette.history.maxEntries");
        maxResults = intValue(System.getProperty("cmdpalette.search.maxResults"), maxResults,
                "cmdpalette.search.maxResults");

        return new PaletteConfig(
                maxHistory,
                maxResults,
                prefix == null ? DEFAULT_SHORTCUT_PREFIX : prefix.toString(),
                prefixMatching != null && Boolean.parseBoolean(prefixMatching.toString()),
                fuzzyMin);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> root, String key) {
        Object val = root.get(key);
        if (val == null) return Map.of();
        if (!(val instanceof Map)) {
            throw new IllegalStateException("Palette config section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) val;
    }

    private static int intValue(Object val, int fallback, String key) {
        if (val == null || val.toString().isBlank()) return fallback;
        if (val instanceof Integer) return (Integer) val;
        if (val instanceof Long) {
            long l = (Long) val;
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new IllegalStateException(key + " is out of range, got '" + val + "'");
            }
            return (int) l;
        }
        if (val instanceof Number) {
            throw new IllegalStateException(key + " must be an integer, got '" + val + "'");
        }
        try {
            return Integer.parseInt(val.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be an integer, got '" + val + "'", e);
        }
    }

    public int getMaxHistoryEntries() { return maxHistoryEntries; }
    public int getMaxSearchResults() { return maxSearchResults; }
    public String getShortcutPrefix() { return shortcutPrefix; }
    public boolean isShortcutPrefixMatching() { return shortcutPrefixMatching; }
    public int getFuzzyMinLength() { return fuzzyMinLength; }
}
