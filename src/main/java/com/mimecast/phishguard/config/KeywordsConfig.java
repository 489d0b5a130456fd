package com.mimecast.phishguard.config;

import com.mimecast.phishguard.analysis.KeywordListProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keyword lists configuration.
 *
 * <p>This class provides type safe access to the {@code keywords} block of {@code analyzer.json5}.
 * <p>Each list falls back to the built-in defaults when missing from the configuration.
 * <br>Values are lower-cased, trimmed and deduplicated keeping first occurrence order.
 */
public class KeywordsConfig extends ConfigFoundation implements KeywordListProvider {

    /**
     * Built-in version identifier.
     */
    public static final String DEFAULT_VERSION = "2024.1";

    /**
     * Built-in suspicious phrases.
     */
    public static final List<String> DEFAULT_SUSPICIOUS = List.of(
            "verify your account",
            "update your password",
            "urgent action required",
            "suspended",
            "click here",
            "login now",
            "bank account",
            "invoice attached",
            "verify identity",
            "account locked",
            "security alert",
            "confirm your identity",
            "act now",
            "limited time",
            "expires soon",
            "click below",
            "verify now",
            "unusual activity",
            "verify payment",
            "update payment"
    );

    /**
     * Built-in trust phrases.
     */
    public static final List<String> DEFAULT_TRUST = List.of(
            "newsletter",
            "receipt",
            "schedule",
            "meeting",
            "thank you",
            "invoice number",
            "order confirmation",
            "shipping",
            "tracking",
            "delivery"
    );

    /**
     * Built-in low trust TLD suffixes.
     */
    public static final List<String> DEFAULT_SUSPICIOUS_DOMAINS = List.of(
            ".tk",
            ".ml",
            ".ga",
            ".cf",
            ".gq",
            ".xyz",
            ".top",
            ".click",
            ".download"
    );

    private final List<String> suspicious;
    private final List<String> trust;
    private final List<String> suspiciousDomains;

    /**
     * Constructs a new KeywordsConfig instance with built-in defaults.
     */
    public KeywordsConfig() {
        this(null);
    }

    /**
     * Constructs a new KeywordsConfig instance.
     *
     * @param map Configuration map.
     */
    public KeywordsConfig(Map<String, Object> map) {
        super(map);
        this.suspicious = readList("suspicious", DEFAULT_SUSPICIOUS);
        this.trust = readList("trust", DEFAULT_TRUST);
        this.suspiciousDomains = readList("suspiciousDomains", DEFAULT_SUSPICIOUS_DOMAINS);
    }

    @Override
    public String getVersion() {
        return getStringProperty("version", DEFAULT_VERSION);
    }

    @Override
    public List<String> getSuspiciousKeywords() {
        return suspicious;
    }

    @Override
    public List<String> getTrustKeywords() {
        return trust;
    }

    @Override
    public List<String> getSuspiciousDomains() {
        return suspiciousDomains;
    }

    /**
     * Reads a list property into an ordered set of normalized strings.
     *
     * @param name     Property name.
     * @param defaults Defaults when missing.
     * @return Unmodifiable list.
     */
    private List<String> readList(String name, List<String> defaults) {
        if (!hasProperty(name)) {
            return defaults;
        }

        Set<String> values = new LinkedHashSet<>();
        getListProperty(name).stream()
                .filter(Objects::nonNull)
                .map(value -> String.valueOf(value).trim().toLowerCase(Locale.ROOT))
                .filter(value -> !value.isEmpty())
                .forEach(values::add);

        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}
