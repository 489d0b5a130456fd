package com.mimecast.phishguard.analysis;

import com.mimecast.phishguard.config.AnalyzerConfig;
import com.mimecast.phishguard.config.KeywordsConfig;
import com.mimecast.phishguard.config.TemplatesConfig;
import com.mimecast.phishguard.mime.EmailContent;
import com.mimecast.phishguard.mime.EmailDecoder;
import com.mimecast.phishguard.mime.MalformedMessageException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Email phishing analyzer.
 * <p>
 * Runs the pipeline: decode (binary input only), normalize, extract features, score,
 * and assembles the {@link AnalysisResponse}.
 * <p>
 * An instance holds only immutable configuration. Build it once and share it,
 * every call is independent and safe to run concurrently.
 *
 * <pre>
 * EmailAnalyzer analyzer = EmailAnalyzer.fromConfig(AnalyzerConfig.defaults());
 * AnalysisResponse response = analyzer.analyzeText("Click here now!", "Account locked", null);
 * </pre>
 */
public class EmailAnalyzer {
    private static final Logger log = LogManager.getLogger(EmailAnalyzer.class);

    private final String modelVersion;
    private final EmailDecoder decoder;
    private final FeatureExtractor extractor;
    private final ScoringEngine engine;

    /**
     * Constructs a new EmailAnalyzer instance.
     *
     * @param modelVersion   Model version reported in responses.
     * @param keywords       Keyword list provider.
     * @param weightProvider Weight provider.
     * @param catalog        Highlight and insight text.
     */
    public EmailAnalyzer(String modelVersion, KeywordListProvider keywords, WeightProvider weightProvider, MessageCatalog catalog) {
        this.modelVersion = Objects.requireNonNull(modelVersion, "modelVersion");
        this.decoder = new EmailDecoder();
        this.extractor = new FeatureExtractor(keywords);
        this.engine = new ScoringEngine(weightProvider, catalog);
    }

    /**
     * Builds an analyzer from configuration with the fixed weight table.
     *
     * @param config AnalyzerConfig instance.
     * @return EmailAnalyzer instance.
     * @throws IOException Unable to load templates.
     */
    public static EmailAnalyzer fromConfig(AnalyzerConfig config) throws IOException {
        KeywordsConfig keywords = config.getKeywords();
        log.info("Analyzer model {} using keyword lists {} and locale {}",
                config.getModelVersion(), keywords.getVersion(), config.getLocale());

        return new EmailAnalyzer(config.getModelVersion(), keywords, new FixedWeightProvider(),
                TemplatesConfig.load(config.getLocale()));
    }

    public String getModelVersion() {
        return modelVersion;
    }

    /**
     * Analyzes a plain text submission.
     * <p>The body doubles as HTML body when it looks like an HTML document.
     *
     * @param body    Body text.
     * @param subject Subject or null.
     * @param headers Raw headers or null.
     * @return AnalysisResponse instance.
     */
    public AnalysisResponse analyzeText(String body, String subject, String headers) {
        String safeBody = Objects.toString(body, "");
        boolean looksHtml = StringUtils.containsIgnoreCase(safeBody, "<html")
                || StringUtils.containsIgnoreCase(safeBody, "<body");

        EmailContent content = EmailContent.builder()
                .subject(subject)
                .body(safeBody)
                .rawHeaders(headers)
                .htmlBody(looksHtml ? safeBody : null)
                .build();

        return analyze(content);
    }

    /**
     * Analyzes a raw RFC 822 message.
     *
     * @param bytes Message bytes.
     * @return AnalysisResponse instance.
     * @throws MalformedMessageException If the bytes cannot be parsed as a message.
     */
    public AnalysisResponse analyzeEml(byte[] bytes) throws MalformedMessageException {
        return analyze(decoder.decode(bytes));
    }

    /**
     * Analyzes decoded content.
     *
     * @param content EmailContent instance.
     * @return AnalysisResponse instance.
     */
    public AnalysisResponse analyze(EmailContent content) {
        ScoreResult result = engine.score(extractFeatures(content));

        EmailMetadata metadata = new EmailMetadata(
                content.getSubject(),
                content.getFromAddress(),
                content.getReplyTo(),
                content.getToAddresses()
        );

        log.info("Analysis complete: verdict={}, score={}, highlights={}",
                result.getVerdict(), String.format(Locale.ROOT, "%.3f", result.getScore()), result.getHighlights().size());

        return new AnalysisResponse(
                result.getVerdict(),
                result.getConfidence(),
                modelVersion,
                metadata,
                result.getHighlights(),
                result.getInsights()
        );
    }

    /**
     * Normalizes content and extracts features.
     *
     * @param content EmailContent instance.
     * @return EmailFeatures instance.
     */
    public EmailFeatures extractFeatures(EmailContent content) {
        String normalizedBody = MessageNormalizer.normalize(content.getBody());
        String normalizedSubject = MessageNormalizer.normalize(content.getSubject());
        String headers = Objects.toString(content.getRawHeaders(), "").toLowerCase(Locale.ROOT);

        return extractor.extract(content, normalizedBody, normalizedSubject, headers);
    }

    /**
     * Scores features without building a response.
     *
     * @param features EmailFeatures instance.
     * @return ScoreResult instance.
     */
    public ScoreResult score(EmailFeatures features) {
        return engine.score(features);
    }
}
