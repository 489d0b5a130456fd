package com.mimecast.phishguard.analysis;

/**
 * Scored signals.
 *
 * <p>Each signal is normalized to [0, 1] before its weight is applied.
 * <br>Negative weights pull the score towards legitimate.
 */
public enum Signal {
    SUSPICIOUS_KEYWORDS,
    URL_COUNT,
    SUSPICIOUS_DOMAINS,
    EXCLAMATION,
    UPPERCASE_RATIO,
    HTML_RATIO,
    LINK_MISMATCH,
    SUSPICIOUS_FROM,
    REPLY_DIFFERENT,
    URGENCY,
    SPELLING,
    TRUST_KEYWORDS
}
