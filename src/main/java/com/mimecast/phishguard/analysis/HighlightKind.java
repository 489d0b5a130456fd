package com.mimecast.phishguard.analysis;

/**
 * Kinds of evidence sentence, in the order they are reported.
 */
public enum HighlightKind {
    SUSPICIOUS_KEYWORDS,
    SUSPICIOUS_DOMAINS,
    MANY_URLS,
    LINK_MISMATCH,
    FROM_DOMAIN_SUSPICIOUS,
    REPLY_TO_DIFFERENT,
    EXCESSIVE_URGENCY,
    TRUST_SIGNALS
}
