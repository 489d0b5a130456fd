package com.mimecast.phishguard.analysis;

/**
 * Closed set of insight identifiers, in the order they are reported.
 */
public enum InsightName {
    SUSPICIOUS_KEYWORDS("suspicious_keywords"),
    URL_COUNT("url_count"),
    SUSPICIOUS_DOMAINS("suspicious_domains"),
    LINK_MISMATCH("link_mismatch"),
    FROM_DOMAIN_SUSPICIOUS("from_domain_suspicious"),
    TRUST_SIGNALS("trust_signals");

    private final String key;

    InsightName(String key) {
        this.key = key;
    }

    /**
     * Gets the wire identifier.
     *
     * @return Identifier string.
     */
    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }
}
