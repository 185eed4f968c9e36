package com.binday.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;

public class UtilsTest {
    @Test
    void testSanitizeFilename() {
        assertEquals("1_High_Street__Bath", Utils.sanitizeFilename("1 High Street, Bath"));
        assertEquals("Flat_2_10_Long_Road", Utils.sanitizeFilename("Flat 2/10 Long Road"));
        assertEquals("", Utils.sanitizeFilename(null));
    }

    @Test
    void testRetryPlaywrightActionSuccess() {
        int result = Utils.retryPlaywrightAction(() -> 42, 3, "test action");
        assertEquals(42, result);
    }

    @Test
    void testRetrySucceedsAfterFailures() {
        AtomicInteger calls = new AtomicInteger();
        String result = Utils.retryPlaywrightAction(() -> {
            if (calls.incrementAndGet() < 3) throw new IllegalStateException("not yet");
            return "loaded";
        }, 3, "flaky action", 1);
        assertEquals("loaded", result);
        assertEquals(3, calls.get());
    }

    @Test
    void testRetryPlaywrightActionFailure() {
        AtomicInteger calls = new AtomicInteger();
        Integer result = Utils.retryPlaywrightAction(() -> {
            calls.incrementAndGet();
            throw new RuntimeException("fail");
        }, 2, "fail action", 1);
        assertNull(result);
        assertEquals(2, calls.get());
    }
}
