package com.mimecast.phishguard.analysis;

/**
 * Localized text for highlights and insight descriptions.
 */
public interface MessageCatalog {

    /**
     * Renders a highlight sentence.
     *
     * @param kind Highlight kind.
     * @param args Positional parameters.
     * @return Sentence.
     */
    String highlight(HighlightKind kind, Object... args);

    /**
     * Gets an insight description.
     *
     * @param name Insight name.
     * @return Description or null if none is defined.
     */
    String insightDescription(InsightName name);
}
