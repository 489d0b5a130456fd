package com.mimecast.phishguard.config;

import java.util.Map;

/**
 * Analyzer HTTP endpoint configuration.
 *
 * <p>This class provides type safe access to the {@code endpoint} block of {@code analyzer.json5}.
 */
public class EndpointConfig extends ConfigFoundation {

    /**
     * Default upload limit of 5 MB.
     */
    public static final long DEFAULT_MAX_UPLOAD_BYTES = 5L * 1024 * 1024;

    /**
     * Constructs a new EndpointConfig instance.
     *
     * @param map Configuration map.
     */
    public EndpointConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets the port to listen on.
     *
     * @return Port number.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 8000L));
    }

    /**
     * Gets the bind address.
     *
     * @return Address string.
     */
    public String getBind() {
        return getStringProperty("bind", "0.0.0.0");
    }

    /**
     * Gets the request handling thread count.
     *
     * @return Thread count, at least one.
     */
    public int getThreads() {
        return Math.max(1, Math.toIntExact(getLongProperty("threads", 4L)));
    }

    /**
     * Gets the maximum accepted upload size.
     *
     * @return Size in bytes.
     */
    public long getMaxUploadBytes() {
        return getLongProperty("maxUploadBytes", DEFAULT_MAX_UPLOAD_BYTES);
    }
}
