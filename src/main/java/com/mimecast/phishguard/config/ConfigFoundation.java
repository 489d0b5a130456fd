package com.mimecast.phishguard.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Wraps a JSON5 document parsed into a map and provides typed accessors with defaults.
 * <p>Keys may be dotted to reach into nested objects, e.g. {@code endpoint.port}.
 *
 * <p>JSON5 files are read with Gson in lenient mode which tolerates comments,
 * unquoted keys and single quoted strings.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {
    private static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        try (Reader reader = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
            this.map = parse(reader, path);
        }
        log.debug("Loaded configuration file: {}", path);
    }

    /**
     * Reads a JSON5 classpath resource into a map.
     *
     * @param resource Classpath resource name.
     * @return Configuration map.
     * @throws IOException Resource missing or unparsable.
     */
    protected static Map<String, Object> readResource(String resource) throws IOException {
        try (InputStream is = ConfigFoundation.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resource);
            }
            try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                return parse(reader, resource);
            }
        }
    }

    /**
     * Parses JSON5 content from reader.
     *
     * @param reader Reader instance.
     * @param source Source name used in error messages.
     * @return Configuration map, never null.
     * @throws IOException Content is not a JSON object.
     */
    private static Map<String, Object> parse(Reader reader, String source) throws IOException {
        try {
            Map<String, Object> parsed = new Gson().fromJson(reader, Map.class);
            return parsed != null ? parsed : new HashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    /**
     * Gets property value, following dotted names into nested maps.
     *
     * @param name Property name.
     * @return Object or null.
     */
    protected Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    /**
     * Gets string property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = getProperty(name);
        return value != null ? String.valueOf(value) : def;
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @return Long or null.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets long property with default.
     * <p>Gson reads every JSON number as a double so any Number is accepted.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                log.warn("Property {} is not a number: {}", name, value);
            }
        }
        return def;
    }

    /**
     * Gets list property.
     *
     * @param name Property name.
     * @return List, empty if missing.
     */
    public List<Object> getListProperty(String name) {
        Object value = getProperty(name);
        return value instanceof List ? (List<Object>) value : new ArrayList<>();
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }
}
