package com.mimecast.phishguard.analysis;

import java.util.List;

/**
 * Provider of the phrase and domain lists used for feature extraction.
 *
 * <p>Lists are ordered, free of duplicates and lower-case. Implementations must be immutable.
 */
public interface KeywordListProvider {

    /**
     * Gets the version identifier of this set of lists.
     *
     * @return Version string.
     */
    String getVersion();

    /**
     * Gets phrases commonly seen in phishing messages.
     *
     * @return List of phrases.
     */
    List<String> getSuspiciousKeywords();

    /**
     * Gets phrases commonly seen in legitimate transactional mail.
     *
     * @return List of phrases.
     */
    List<String> getTrustKeywords();

    /**
     * Gets low trust top level domain suffixes, dot included.
     *
     * @return List of suffixes.
     */
    List<String> getSuspiciousDomains();
}
