package com.issuesextractor.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

    @Test
    void testSanitizeFilename() {
        assertEquals("My_Issues_Export_____", Utils.sanitizeFilename("My:Issues/Export?*<>|"));
        assertEquals("", Utils.sanitizeFilename(null));
    }

    @Test
    void testRetrySuccess() {
        int result = Utils.retry(() -> 42, 3, 0, "test action");
        assertEquals(42, result);
    }

    @Test
    void testRetrySucceedsAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();
        String result = Utils.retry(() -> {
            if (calls.incrementAndGet() < 3) throw new StaleHandleException("re-rendered");
            return "clicked";
        }, 3, 1, "flaky click");

        assertEquals("clicked", result);
        assertEquals(3, calls.get());
    }

    @Test
    void testRetryFailure() {
        Integer result = Utils.retry(() -> { throw new RuntimeException("fail"); }, 2, 0, "fail action");
        assertNull(result);
    }

    @Test
    void testRetryNeverRetriesDeadPage() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(PageUnavailableException.class, () -> Utils.retry(() -> {
            calls.incrementAndGet();
            throw new PageUnavailableException("browser closed");
        }, 5, 0, "dead page"));
        assertEquals(1, calls.get());
    }

    @Test
    void testTextHelpers() {
        assertEquals("a b c", Utils.collapseWhitespace("  a \n b\t\tc "));
        assertEquals(List.of("first", "second"), Utils.lines("\n first \r\n\n second\n"));
        assertEquals("first", Utils.firstLine("\n first \nsecond"));
        assertEquals("", Utils.firstLine(null));
    }
}
