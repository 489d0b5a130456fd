package com.mimecast.phishguard.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MessageNormalizer.
 */
class MessageNormalizerTest {

    @Test
    void testStripsTagsAndCollapsesWhitespace() {
        assertEquals("hello world click here",
                MessageNormalizer.normalize("<p>Hello</p>\n\n  <b>WORLD</b>\t<a href=\"x\">Click here</a>"),
                "Tags should become spaces and whitespace should collapse");
    }

    @Test
    void testEmptyAndNull() {
        assertEquals("", MessageNormalizer.normalize(null), "Null should normalize to empty");
        assertEquals("", MessageNormalizer.normalize(""), "Empty should stay empty");
        assertEquals("", MessageNormalizer.normalize(" \n\t<br/> "), "Whitespace and tags only should normalize to empty");
    }

    @Test
    void testPunctuationKept() {
        assertEquals("act now!!! visit http://x.tk/a?b=1",
                MessageNormalizer.normalize("ACT NOW!!!  Visit http://x.tk/a?b=1"), "Punctuation and URLs should survive");
    }

    @Test
    void testUnclosedAngleBracketKept() {
        assertEquals("a < b", MessageNormalizer.normalize("a < b"), "Unterminated bracket is not a tag");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Dear user, please VERIFY your account now!",
            "<html><body><h1>Title</h1>\r\n<p>Body  text</p></body></html>",
            "  مرحبا   بكم  ",
            "Ünïcödé spaces here"
    })
    void testIdempotent(String input) {
        String once = MessageNormalizer.normalize(input);

        assertEquals(once, MessageNormalizer.normalize(once), "Normalizing twice should equal normalizing once");
        assertEquals(once.strip(), once, "Result should be trimmed");
        assertFalse(once.contains("  "), "Result should not contain double spaces");
    }
}
