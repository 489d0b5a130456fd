package com.mimecast.phishguard.analysis;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mimecast.phishguard.config.AnalyzerConfig;
import com.mimecast.phishguard.mime.EmailContent;
import com.mimecast.phishguard.mime.MalformedMessageException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pipeline tests for EmailAnalyzer.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class EmailAnalyzerTest {

    private EmailAnalyzer analyzer;

    @BeforeAll
    void setUp() throws IOException {
        analyzer = EmailAnalyzer.fromConfig(AnalyzerConfig.defaults());
    }

    @Test
    void testPhishingText() {
        String body = "Dear user, please verify your account now, your account is suspended!!! "
                + "click here: http://secure-login.tk/verify";

        EmailFeatures features = analyzer.extractFeatures(EmailContent.builder().body(body).build());
        assertTrue(features.getSuspiciousKeywordCount() >= 2, "At least two suspicious phrases");
        assertTrue(features.getSuspiciousDomainCount() >= 1, "The .tk link should count");
        assertTrue(features.getUrgencyWords() >= 1, "At least one urgency word");

        AnalysisResponse response = analyzer.analyzeText(body, null, null);

        assertEquals(Verdict.PHISHING, response.getVerdict(), "Verdict should be phishing");
        assertTrue(response.getConfidence() > 0, "Confidence should be positive");
        assertEquals("0.1.0-ml", response.getModelVersion(), "Model version should be reported");
        assertEquals(6, response.getInsights().size(), "Six insights");
        assertTrue(response.getHighlights().contains("Detected 3 suspicious word(s) or phrase(s) in the message."),
                "Keyword highlight should be present");
        assertTrue(response.getHighlights().contains("Detected 1 link(s) pointing to a suspicious domain."),
                "Domain highlight should be present");
    }

    @Test
    void testLegitimateText() {
        String body = "Hi team, attaching the invoice number 4521 and tracking info for your shipping order. Thanks!";

        EmailFeatures features = analyzer.extractFeatures(EmailContent.builder().body(body).build());
        assertEquals(0, features.getSuspiciousKeywordCount(), "No suspicious phrases");
        assertTrue(features.getTrustKeywordCount() >= 3, "At least three trust phrases");

        AnalysisResponse response = analyzer.analyzeText(body, null, null);

        assertEquals(Verdict.LEGITIMATE, response.getVerdict(), "Verdict should be legitimate");
        assertEquals(List.of("Detected 3 trust signal(s) that may indicate a legitimate message."),
                response.getHighlights(), "Only the trust highlight should be present");
    }

    @Test
    void testEmptyText() {
        AnalysisResponse response = analyzer.analyzeText("", null, null);

        assertEquals(Verdict.LEGITIMATE, response.getVerdict(), "Empty message scores the base");
        assertEquals(0.4, response.getConfidence(), 1e-9, "Base confidence");
        assertNull(response.getMetadata().getSubject(), "Subject should be absent");
        assertTrue(response.getMetadata().getToAddresses().isEmpty(), "No recipients");
        response.getInsights().forEach(insight -> assertEquals(0, insight.getValue(), "Insight should be zero: " + insight));
    }

    @Test
    void testReplyToDifference() {
        EmailContent same = EmailContent.builder()
                .body("Please send the report.")
                .fromAddress("boss@company.com")
                .replyTo("boss@company.com")
                .build();
        EmailContent different = EmailContent.builder()
                .body("Please send the report.")
                .fromAddress("boss@company.com")
                .replyTo("boss@totally-different.ru")
                .build();

        EmailFeatures differentFeatures = analyzer.extractFeatures(different);
        assertTrue(differentFeatures.isReplyToDifferent(), "Reply-to should differ");

        double delta = analyzer.score(differentFeatures).getScore()
                - analyzer.score(analyzer.extractFeatures(same)).getScore();
        assertEquals(0.10, delta, 1e-9, "Reply-to difference alone should add 0.10");

        AnalysisResponse response = analyzer.analyze(different);
        assertEquals("boss@totally-different.ru", response.getMetadata().getReplyTo(), "Metadata should carry reply-to");
        assertTrue(response.getHighlights().contains("The reply-to address differs from the sender's address."),
                "Reply-to highlight should be present");
    }

    @Test
    void testHtmlText() {
        String body = "<html><body><a href=\"http://evil.tk/login\">https://www.mybank.com</a></body></html>";

        EmailFeatures features = analyzer.extractFeatures(EmailContent.builder().body(body).htmlBody(body).build());
        assertTrue(features.hasHtml(), "HTML should be detected");
        assertTrue(features.isLinkTextMismatch(), "Mismatch should be detected");

        AnalysisResponse response = analyzer.analyzeText(body, "Sign in", null);
        assertTrue(response.getHighlights().contains("A link's visible text does not match its actual destination."),
                "Mismatch highlight should be present");
        assertEquals("Sign in", response.getMetadata().getSubject(), "Subject should be echoed");
    }

    @Test
    void testEml() throws Exception {
        byte[] bytes = Files.readAllBytes(Paths.get("src/test/resources/mime/nested.eml"));

        AnalysisResponse response = analyzer.analyzeEml(bytes);

        assertEquals(Verdict.PHISHING, response.getVerdict(), "Nested phishing sample should be phishing");
        assertEquals("\"Security Team\" <security@paypa1-support.tk>", response.getMetadata().getFromAddress(),
                "From should be echoed");
        assertEquals(List.of("victim@example.com"), response.getMetadata().getToAddresses(), "To should be echoed");
        assertTrue(response.getHighlights().contains("The sender's domain is suspicious."), "Sender highlight");
        assertTrue(response.getHighlights().contains("The reply-to address differs from the sender's address."),
                "Reply-to highlight");
    }

    @Test
    void testEmlLegitimate() throws Exception {
        byte[] bytes = Files.readAllBytes(Paths.get("src/test/resources/mime/multipart-alternative.eml"));

        AnalysisResponse response = analyzer.analyzeEml(bytes);

        assertEquals(Verdict.LEGITIMATE, response.getVerdict(), "Invoice sample should be legitimate");
        assertEquals("Invoice ready", response.getMetadata().getSubject(), "Decoded subject should be echoed");
    }

    @Test
    void testMalformedEml() {
        byte[] bytes = "\r\n \r\n\t\r\n".getBytes(StandardCharsets.UTF_8);

        assertThrows(MalformedMessageException.class, () -> analyzer.analyzeEml(bytes), "Blank input should throw");
        assertThrows(MalformedMessageException.class, () -> analyzer.analyzeEml(new byte[0]), "Empty input should throw");
    }

    @Test
    void testHeaderlessEml() throws MalformedMessageException {
        byte[] bytes = ("Dear user, please verify your account now, your account is suspended!!!\n"
                + "click here: http://secure-login.tk/verify\n").getBytes(StandardCharsets.UTF_8);

        AnalysisResponse response = analyzer.analyzeEml(bytes);

        assertEquals(Verdict.PHISHING, response.getVerdict(), "Headerless phishing text should be flagged");
        assertTrue(response.getInsights().stream().anyMatch(insight -> insight.getValue() > 0),
                "Insights should reflect the body");
    }

    @Test
    void testSerializedFieldNames() {
        AnalysisResponse response = analyzer.analyzeText("Click here now!", "Hello", null);

        JsonObject json = JsonParser.parseString(new GsonBuilder().serializeNulls().create().toJson(response))
                .getAsJsonObject();

        assertTrue(json.has("verdict"), "verdict");
        assertTrue(json.has("confidence"), "confidence");
        assertEquals("0.1.0-ml", json.get("model_version").getAsString(), "model_version");
        assertTrue(json.getAsJsonObject("metadata").has("from_address"), "metadata.from_address");
        assertTrue(json.getAsJsonObject("metadata").has("reply_to"), "metadata.reply_to");
        assertTrue(json.getAsJsonObject("metadata").has("to_addresses"), "metadata.to_addresses");
        assertEquals(6, json.getAsJsonArray("insights").size(), "insights");
        assertTrue(json.getAsJsonArray("highlights").size() > 0, "highlights");
        assertTrue(List.of("phishing", "legitimate").contains(json.get("verdict").getAsString()), "Verdict label");
    }
}
