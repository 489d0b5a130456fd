package com.mimecast.phishguard.mime;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EmailDecoder.
 */
class EmailDecoderTest {

    private final EmailDecoder decoder = new EmailDecoder();

    private static byte[] fixture(String name) throws IOException {
        return Files.readAllBytes(Paths.get("src/test/resources/mime/" + name));
    }

    @Test
    void testPlainPartPreferredOverHtml() throws Exception {
        EmailContent content = decoder.decode(fixture("multipart-alternative.eml"));

        assertEquals("Hello Bob,\nYour invoice number 4521 is ready. Thank you for your order. Tracking details will follow.",
                content.getBody().strip().replace("\r\n", "\n"), "Body should be the decoded text/plain part");
        assertFalse(content.getBody().contains("<html>"), "Body should not come from the HTML part");
        assertNotNull(content.getHtmlBody(), "HTML body should be captured");
        assertTrue(content.getHtmlBody().contains("<b>invoice number 4521</b>"), "HTML body should be the text/html part");
    }

    @Test
    void testHeaders() throws Exception {
        EmailContent content = decoder.decode(fixture("multipart-alternative.eml"));

        assertEquals("Invoice ready", content.getSubject(), "Encoded subject should be decoded");
        assertEquals("Billing <billing@company.com>", content.getFromAddress(), "From should be read as is");
        assertEquals("billing@company.com", content.getReplyTo(), "Reply-To should be read as is");
        assertEquals(List.of("bob@example.com", "alice@example.com"), content.getToAddresses(),
                "Every To header should be collected in order");

        String[] lines = content.getRawHeaders().split("\n");
        assertEquals("Return-Path: <billing@company.com>", lines[0], "Headers should keep original order");
        assertTrue(content.getRawHeaders().contains("Message-ID: <alt-0001@company.com>"), "Headers should be flattened");
    }

    @Test
    void testNestedMultipart() throws Exception {
        EmailContent content = decoder.decode(fixture("nested.eml"));

        assertTrue(content.getBody().startsWith("Unusual activity was detected."),
                "Nested text/plain should be found depth first");
        assertTrue(content.getHtmlBody().contains("https://www.paypal.com/signin"),
                "Nested text/html should be found depth first");
        assertEquals("Security alert for your account", content.getSubject(), "Folded subject should be unfolded");
        assertEquals("collect@harvest.xyz", content.getReplyTo(), "Reply-To should be read");
    }

    @Test
    void testDeclaredCharset() throws Exception {
        EmailContent content = decoder.decode(fixture("charset.eml"));

        assertEquals("Votre compte a été suspendu. Café gratuit.", content.getBody().strip(),
                "ISO-8859-1 payload should be decoded");
        assertEquals("Votre compte a été suspendu", content.getSubject(), "UTF-8 encoded word should be decoded");
        assertNull(content.getHtmlBody(), "Single part message has no HTML body");
    }

    @Test
    void testUnknownCharsetFallsBackToUtf8() throws Exception {
        EmailContent content = decoder.decode(fixture("unknown-charset.eml"));

        assertEquals("Plain ascii text survives.", content.getBody().strip(), "Unknown charset should decode as UTF-8");
    }

    @Test
    void testHtmlOnlyUsesFirstPart() throws Exception {
        EmailContent content = decoder.decode(fixture("html-only.eml"));

        assertTrue(content.getBody().contains("<h1>LIMITED TIME</h1>"), "Body should fall back to the first part");
        assertEquals(content.getBody(), content.getHtmlBody(), "HTML body should be the same part");
    }

    @Test
    void testEmbeddedMessage() throws Exception {
        EmailContent content = decoder.decode(fixture("forwarded.eml"));

        assertEquals("The meeting schedule for next week is attached.", content.getBody().strip(),
                "Body should be found inside message/rfc822");
        assertEquals("Fwd: meeting schedule", content.getSubject(), "Outer subject should be used");
    }

    @Test
    void testEmptyBody() throws Exception {
        EmailContent content = decoder.decode(fixture("no-body.eml"));

        assertEquals("", content.getBody().strip(), "Body should be empty");
        assertEquals("Nothing to see", content.getSubject(), "Subject should be read");
        assertNull(content.getReplyTo(), "Missing Reply-To should be null");
    }

    @Test
    void testMissingHeaders() throws Exception {
        EmailContent content = decoder.decode("just a body line\n".getBytes(StandardCharsets.UTF_8));

        assertNull(content.getSubject(), "Missing subject should be null");
        assertNull(content.getFromAddress(), "Missing From should be null");
        assertTrue(content.getToAddresses().isEmpty(), "Missing To should be an empty list");
        assertEquals("just a body line", content.getBody().trim(), "Body should be kept");
    }

    @Test
    void testHeaderlessText() throws Exception {
        EmailContent content = decoder.decode("Verify your account now at http://x.tk/login\nThanks\n".getBytes(StandardCharsets.UTF_8));

        assertTrue(content.getBody().contains("Verify your account now at http://x.tk/login"), "Body should hold the first line");
        assertTrue(content.getBody().contains("Thanks"), "Body should hold the second line");
        assertNull(content.getSubject(), "Subject should be null");
        assertEquals("", content.getRawHeaders(), "No headers should be dumped");
    }

    @Test
    void testHeadersWithoutSeparator() throws Exception {
        EmailContent content = decoder.decode("Subject: Notice\r\nFrom: a@b.tk\r\nVerify your account now\r\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("Notice", content.getSubject(), "Subject should be parsed");
        assertEquals("a@b.tk", content.getFromAddress(), "From should be parsed");
        assertEquals("Verify your account now", content.getBody().trim(), "Body should start at the first non header line");
        assertFalse(content.getRawHeaders().contains("Verify"), "Body line should not be dumped as a header");
    }

    @Test
    void testMissingBoundaryFallsBackToRawContent() throws Exception {
        EmailContent content = decoder.decode(fixture("missing-boundary.eml"));

        assertEquals("Account notice", content.getSubject(), "Subject");
        assertEquals("a@b.tk", content.getFromAddress(), "From");
        assertEquals("verify your account now", content.getBody().trim(), "Body should be the raw payload");
        assertNull(content.getHtmlBody(), "No HTML body");
    }

    @Test
    void testBlankInput() throws IOException {
        byte[] bytes = fixture("blank.eml");

        MalformedMessageException e = assertThrows(MalformedMessageException.class, () -> decoder.decode(bytes),
                "Whitespace only input should be rejected");
        assertNotNull(e.getMessage(), "Exception should carry a reason");
    }

    @Test
    void testEmptyInput() {
        assertThrows(MalformedMessageException.class, () -> decoder.decode(new byte[0]), "Empty input should be rejected");
        assertThrows(MalformedMessageException.class, () -> decoder.decode(null), "Null input should be rejected");
    }
}
