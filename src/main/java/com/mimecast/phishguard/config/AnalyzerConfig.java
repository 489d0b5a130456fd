package com.mimecast.phishguard.config;

import java.io.IOException;
import java.util.Map;

/**
 * Analyzer configuration.
 *
 * <p>This class provides type safe access to {@code analyzer.json5}.
 * <p>The default file ships on the classpath. A file given on the command line replaces it entirely.
 *
 * @see KeywordsConfig
 * @see EndpointConfig
 */
public class AnalyzerConfig extends ConfigFoundation {

    /**
     * Default configuration classpath resource.
     */
    public static final String RESOURCE = "analyzer.json5";

    /**
     * Default model version.
     */
    public static final String DEFAULT_MODEL_VERSION = "0.1.0-ml";

    /**
     * Constructs a new AnalyzerConfig instance.
     *
     * @param map Configuration map.
     */
    public AnalyzerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new AnalyzerConfig instance from a file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public AnalyzerConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Loads the classpath default configuration.
     *
     * @return AnalyzerConfig instance.
     * @throws IOException Resource missing or unparsable.
     */
    public static AnalyzerConfig defaults() throws IOException {
        return new AnalyzerConfig(readResource(RESOURCE));
    }

    /**
     * Gets the model version reported in every response.
     *
     * @return Version string.
     */
    public String getModelVersion() {
        return getStringProperty("modelVersion", DEFAULT_MODEL_VERSION);
    }

    /**
     * Gets the locale used for highlights and insight descriptions.
     *
     * @return Locale key.
     */
    public String getLocale() {
        return getStringProperty("locale", TemplatesConfig.DEFAULT_LOCALE);
    }

    /**
     * Gets keyword lists configuration.
     *
     * @return KeywordsConfig instance.
     */
    public KeywordsConfig getKeywords() {
        return new KeywordsConfig(getMapProperty("keywords"));
    }

    /**
     * Gets HTTP endpoint configuration.
     *
     * @return EndpointConfig instance.
     */
    public EndpointConfig getEndpoint() {
        return new EndpointConfig(getMapProperty("endpoint"));
    }
}
