package com.mimecast.phishguard.analysis;

import com.mimecast.phishguard.mime.EmailContent;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@link EmailFeatures} from message content.
 * <p>
 * Keyword and urgency matching runs on normalized text. URLs, punctuation, case and markup
 * signals are measured on the original body so nothing is lost to normalization.
 * <p>
 * Markup heuristics are plain regular expressions, not an HTML parser.
 * Obfuscated or broken markup may evade them or trigger them spuriously.
 * <p>
 * Extraction is a pure function of its input and never fails.
 */
public class FeatureExtractor {
    private static final Logger log = LogManager.getLogger(FeatureExtractor.class);

    /**
     * Sample size for the uppercase ratio.
     */
    static final int UPPERCASE_SAMPLE = 1000;

    private static final Pattern URL_PATTERN = Pattern.compile(
            "http[s]?://(?:[a-zA-Z]|[0-9]|[$-_@.&+]|[!*\\\\(\\\\),]|(?:%[0-9a-fA-F][0-9a-fA-F]))+"
    );

    private static final Pattern LINK_PATTERN = Pattern.compile(
            "<a[^>]+href=[\"']([^\"']+)[\"'][^>]*>([^<]+)</a>",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * Network location of a URL, as in scheme://netloc/path.
     */
    private static final Pattern NETLOC_PATTERN = Pattern.compile("^(?:[a-zA-Z][a-zA-Z0-9+.-]*:)?//([^/?#]*)");

    private static final Pattern DOMAIN_PATTERN = Pattern.compile("@([\\w.-]+)", Pattern.UNICODE_CHARACTER_CLASS);

    private static final List<Pattern> URGENCY_PATTERNS = compileAll(Pattern.CASE_INSENSITIVE,
            "\\burgent\\b",
            "\\bimmediate\\b",
            "\\basap\\b",
            "\\bnow\\b",
            "\\bexpire\\b",
            "\\blimited\\b",
            "\\bact now\\b",
            "\\bverify now\\b"
    );

    private static final List<Pattern> UNUSUAL_PATTERNS = compileAll(0,
            "[a-z]{15,}",   // Very long words.
            "[A-Z]{5,}",    // Many consecutive capitals.
            "[0-9]{4,}"     // Many consecutive digits.
    );

    private final KeywordListProvider keywords;

    /**
     * Constructs a new FeatureExtractor instance.
     *
     * @param keywords Keyword list provider.
     */
    public FeatureExtractor(KeywordListProvider keywords) {
        this.keywords = keywords;
    }

    /**
     * Extracts features.
     *
     * @param content           Email content.
     * @param normalizedBody    Normalized body.
     * @param normalizedSubject Normalized subject.
     * @param lowerHeaders      Lower-cased raw headers.
     * @return EmailFeatures instance.
     */
    public EmailFeatures extract(EmailContent content, String normalizedBody, String normalizedSubject, String lowerHeaders) {
        String text = normalizedBody + " " + normalizedSubject;
        String body = content.getBody();
        String subject = Objects.toString(content.getSubject(), "");

        List<String> urls = extractUrls(body);
        int suspiciousDomainCount = (int) urls.stream()
                .map(url -> url.toLowerCase(Locale.ROOT))
                .filter(this::containsSuspiciousDomain)
                .count();

        int bodyLength = body.length();

        EmailFeatures features = EmailFeatures.builder()
                .suspiciousKeywordCount(countHits(text, keywords.getSuspiciousKeywords()))
                .trustKeywordCount(countHits(text, keywords.getTrustKeywords()))
                .urlCount(urls.size())
                .suspiciousDomainCount(suspiciousDomainCount)
                .exclamationCount(StringUtils.countMatches(body, '!') + StringUtils.countMatches(subject, '!'))
                .questionCount(StringUtils.countMatches(body, '?') + StringUtils.countMatches(subject, '?'))
                .uppercaseRatio(uppercaseRatio(body))
                .bodyLength(bodyLength)
                .subjectLength(subject.length())
                .hasHtml(content.getHtmlBody() != null || StringUtils.containsIgnoreCase(body, "<html"))
                .htmlRatio(bodyLength > 0 ? (double) countMatches(MessageNormalizer.TAG_PATTERN, body) / bodyLength : 0.0)
                .linkTextMismatch(hasLinkTextMismatch(body))
                .fromDomainSuspicious(isDomainSuspicious(content.getFromAddress()))
                .replyToDifferent(content.getReplyTo() != null && content.getFromAddress() != null
                        && !extractDomain(content.getReplyTo()).equals(extractDomain(content.getFromAddress())))
                .urgencyWords(URGENCY_PATTERNS.stream().mapToInt(p -> countMatches(p, text)).sum())
                .spellingErrorsEstimate(estimateSpellingErrors(normalizedBody))
                .build();

        log.debug("Extracted features: {}", features);
        return features;
    }

    /**
     * Counts how many phrases appear in text, each at most once.
     *
     * @param text    Text to search.
     * @param phrases Phrases.
     * @return Hit count.
     */
    static int countHits(String text, List<String> phrases) {
        return (int) phrases.stream().filter(text::contains).count();
    }

    /**
     * Extracts every HTTP(S) URL, duplicates included.
     *
     * @param text Text to scan.
     * @return List of URLs.
     */
    static List<String> extractUrls(String text) {
        List<String> urls = new ArrayList<>();
        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            urls.add(matcher.group());
        }
        return urls;
    }

    /**
     * Extracts the domain following the first {@code @}.
     *
     * @param address Email address, may be null.
     * @return Domain or empty string.
     */
    static String extractDomain(String address) {
        if (address == null) {
            return "";
        }
        Matcher matcher = DOMAIN_PATTERN.matcher(address);
        return matcher.find() ? matcher.group(1) : "";
    }

    /**
     * Checks if the sender domain carries a low trust suffix.
     *
     * @param address Email address, may be null.
     * @return Boolean.
     */
    private boolean isDomainSuspicious(String address) {
        return containsSuspiciousDomain(extractDomain(address).toLowerCase(Locale.ROOT));
    }

    private boolean containsSuspiciousDomain(String lowerText) {
        return keywords.getSuspiciousDomains().stream().anyMatch(lowerText::contains);
    }

    /**
     * Checks for anchors whose visible text shows a URL on a different host than the target.
     *
     * @param body Original body.
     * @return True on the first mismatch found.
     */
    static boolean hasLinkTextMismatch(String body) {
        Matcher matcher = LINK_PATTERN.matcher(body);
        while (matcher.find()) {
            String host = extractHost(matcher.group(1)).toLowerCase(Locale.ROOT);
            String text = matcher.group(2).toLowerCase(Locale.ROOT);

            // Visible text mentions a link but the target points elsewhere.
            if (text.contains("http") && !text.contains(host)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extracts the network location of a URL.
     *
     * @param url URL string.
     * @return Host with optional port and user info, empty when there is none.
     */
    static String extractHost(String url) {
        Matcher matcher = NETLOC_PATTERN.matcher(url.trim());
        return matcher.find() ? matcher.group(1) : "";
    }

    /**
     * Fraction of upper-case letters in the first characters of the body.
     *
     * @param body Original body.
     * @return Ratio in [0, 1].
     */
    static double uppercaseRatio(String body) {
        String sample = StringUtils.left(body, UPPERCASE_SAMPLE);
        if (sample.isEmpty()) {
            return 0.0;
        }

        long upper = sample.chars().filter(Character::isUpperCase).count();
        return (double) upper / sample.length();
    }

    /**
     * Rough spelling error estimate from unusual character runs.
     *
     * @param normalizedBody Normalized body.
     * @return Estimate in [0, 1].
     */
    static double estimateSpellingErrors(String normalizedBody) {
        int errors = UNUSUAL_PATTERNS.stream().mapToInt(p -> countMatches(p, normalizedBody)).sum();
        int words = Math.max(1, StringUtils.split(normalizedBody).length);
        return Math.min(1.0, (double) errors / words * 0.1);
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static List<Pattern> compileAll(int flags, String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, flags));
        }
        return List.copyOf(patterns);
    }
}
