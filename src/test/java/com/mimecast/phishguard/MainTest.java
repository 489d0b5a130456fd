package com.mimecast.phishguard;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CLI tests for Main.
 */
class MainTest {

    @Test
    void testUsage() {
        assertEquals(0, new Main(new String[0]).getStatus(), "Usage should not fail");
    }

    @Test
    void testText() {
        Main main = new Main(new String[]{"--text", "Click here now!", "--subject", "Account locked"});

        assertEquals(0, main.getStatus(), "Text analysis should succeed");
    }

    @Test
    void testFile() {
        Main main = new Main(new String[]{"--file", "src/test/resources/mime/nested.eml"});

        assertEquals(0, main.getStatus(), "File analysis should succeed");
    }

    @Test
    void testMalformedFile() {
        Main main = new Main(new String[]{"--file", "src/test/resources/mime/blank.eml"});

        assertEquals(2, main.getStatus(), "Malformed file should report status 2");
    }

    @Test
    void testMissingFile() {
        Main main = new Main(new String[]{"--file", "src/test/resources/mime/does-not-exist.eml"});

        assertEquals(1, main.getStatus(), "Missing file should report status 1");
    }

    @Test
    void testBadOption() {
        assertEquals(1, new Main(new String[]{"--nope"}).getStatus(), "Unknown option should report status 1");
    }

    @Test
    void testLoggingLevelsUntouched() {
        Level root = LogManager.getRootLogger().getLevel();
        Level own = LogManager.getLogger(Main.class).getLevel();

        new Main(new String[]{"--text", "Click here now!"});

        assertEquals(root, LogManager.getRootLogger().getLevel(), "Root level should be left as configured");
        assertEquals(own, LogManager.getLogger(Main.class).getLevel(), "Main logger level should be left as configured");
        assertTrue(LogManager.getLogger(Main.class).isWarnEnabled(), "Warnings should still be logged");
    }
}
