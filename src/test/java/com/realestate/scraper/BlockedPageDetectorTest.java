package com.realestate.scraper;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for bot-challenge and block page detection.
 */
public class BlockedPageDetectorTest {
    private final BlockedPageDetector detector = new BlockedPageDetector(TestDocuments.config());

    @Test
    void testShortDocumentIsBlocked() {
        Optional<String> reason = detector.detect("<html><body>Loading</body></html>");
        assertTrue(reason.isPresent());
        assertTrue(reason.get().contains("below minimum"));
        assertTrue(detector.detect(null).isPresent());
    }

    @Test
    void testMarkerIsBlockedRegardlessOfLength() {
        String html = TestDocuments.page("", "<div id=\"px-captcha\">Press &amp; Hold to confirm you are a human</div>");
        Optional<String> reason = detector.detect(html);
        assertTrue(reason.isPresent());
        assertTrue(reason.get().contains("px-captcha"));
    }

    @Test
    void testMarkerMatchesEntityEncodedText() {
        String html = TestDocuments.page("", "<p>Press &amp; Hold to continue browsing</p>");
        Optional<String> reason = detector.detect(html);
        assertTrue(reason.isPresent());
        assertTrue(reason.get().contains("press & hold"));
    }

    @Test
    void testRegularPageIsNotBlocked() {
        assertTrue(detector.detect(TestDocuments.page("<title>123 Main St</title>", "<h1>$450,000</h1>")).isEmpty());
    }

    @Test
    void testMinimumLengthIsConfigurable() {
        BlockedPageDetector lenient = new BlockedPageDetector(TestDocuments.config().withBlockedMinLength(10));
        assertTrue(lenient.detect("<html><body>Loading</body></html>").isEmpty());
    }
}
