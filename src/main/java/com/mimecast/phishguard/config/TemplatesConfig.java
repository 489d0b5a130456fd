package com.mimecast.phishguard.config;

import com.mimecast.phishguard.analysis.HighlightKind;
import com.mimecast.phishguard.analysis.InsightName;
import com.mimecast.phishguard.analysis.MessageCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.Map;

/**
 * Highlight and insight text templates.
 *
 * <p>Loaded from the {@code templates.json5} classpath resource which maps a locale
 * <br>to a {@code highlights} block keyed by {@link HighlightKind} name and an
 * <br>{@code insights} block keyed by insight identifier.
 *
 * <p>Highlight templates are {@link String#format(String, Object...)} patterns with positional parameters.
 * <br>Missing entries fall back to the {@code en} locale and then to the kind name.
 */
public class TemplatesConfig extends ConfigFoundation implements MessageCatalog {
    private static final Logger log = LogManager.getLogger(TemplatesConfig.class);

    /**
     * Templates classpath resource.
     */
    public static final String RESOURCE = "templates.json5";

    /**
     * Fallback locale.
     */
    public static final String DEFAULT_LOCALE = "en";

    private final String locale;

    /**
     * Constructs a new TemplatesConfig instance.
     *
     * @param map    Configuration map.
     * @param locale Locale key.
     */
    public TemplatesConfig(Map<String, Object> map, String locale) {
        super(map);
        this.locale = locale != null ? locale : DEFAULT_LOCALE;
    }

    /**
     * Loads templates from the classpath.
     *
     * @param locale Locale key.
     * @return TemplatesConfig instance.
     * @throws IOException Resource missing or unparsable.
     */
    public static TemplatesConfig load(String locale) throws IOException {
        TemplatesConfig templates = new TemplatesConfig(readResource(RESOURCE), locale);
        if (!templates.hasProperty(templates.locale)) {
            log.warn("No templates for locale {}, using {}", templates.locale, DEFAULT_LOCALE);
        }
        return templates;
    }

    /**
     * Gets the locale key in use.
     *
     * @return Locale key.
     */
    public String getLocale() {
        return locale;
    }

    @Override
    public String highlight(HighlightKind kind, Object... args) {
        String template = lookup("highlights", kind.name());
        if (template == null) {
            return kind.name();
        }

        try {
            return String.format(Locale.ROOT, template, args);
        } catch (IllegalFormatException e) {
            log.warn("Invalid template for {}: {}", kind, e.getMessage());
            return template;
        }
    }

    @Override
    public String insightDescription(InsightName name) {
        return lookup("insights", name.getKey());
    }

    /**
     * Looks up a template for the configured locale with fallback.
     *
     * @param block Block name.
     * @param key   Template key.
     * @return Template or null.
     */
    private String lookup(String block, String key) {
        Object value = getMapProperty(locale + "." + block).get(key);
        if (value == null && !DEFAULT_LOCALE.equals(locale)) {
            value = getMapProperty(DEFAULT_LOCALE + "." + block).get(key);
        }
        return value != null ? String.valueOf(value) : null;
    }
}
