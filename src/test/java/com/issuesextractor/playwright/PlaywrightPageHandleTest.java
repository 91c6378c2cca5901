package com.issuesextractor.playwright;

import com.issuesextractor.scraper.ElementHandle;
import com.issuesextractor.scraper.PageUnavailableException;
import com.issuesextractor.scraper.Query;
import com.issuesextractor.scraper.StaleHandleException;
import com.microsoft.playwright.Keyboard;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class PlaywrightPageHandleTest {

    private Page page;
    private PlaywrightPageHandle handle;

    @BeforeEach
    void setUp() {
        page = Mockito.mock(Page.class);
        handle = new PlaywrightPageHandle(page, 5_000);
    }

    @Test
    void testConstructorAppliesActionTimeout() {
        verify(page).setDefaultTimeout(5_000);
    }

    @Test
    void testSelectorTranslation() {
        assertEquals("tr.sapMLIB", PlaywrightPageHandle.toSelector(Query.css("tr.sapMLIB")));
        assertEquals("xpath=//tr[@role='row']", PlaywrightPageHandle.toSelector(Query.xpath("//tr[@role='row']")));
        assertEquals("text=Issues", PlaywrightPageHandle.toSelector(Query.text("Issues")));
        assertThrows(IllegalArgumentException.class, () -> PlaywrightPageHandle.toSelector(Query.script("() => []")));
    }

    @Test
    void testQueryWrapsPlaywrightHandles() {
        com.microsoft.playwright.ElementHandle first = Mockito.mock(com.microsoft.playwright.ElementHandle.class);
        com.microsoft.playwright.ElementHandle second = Mockito.mock(com.microsoft.playwright.ElementHandle.class);
        when(first.innerText()).thenReturn("Renew SSL cert");
        when(page.querySelectorAll("xpath=//tr")).thenReturn(List.of(first, second));

        List<ElementHandle> rows = handle.query(Query.xpath("//tr"), null);

        assertEquals(2, rows.size());
        assertEquals("Renew SSL cert", rows.get(0).text());
    }

    @Test
    void testScopedQueryRunsOnScopeElement() {
        com.microsoft.playwright.ElementHandle row = Mockito.mock(com.microsoft.playwright.ElementHandle.class);
        com.microsoft.playwright.ElementHandle cell = Mockito.mock(com.microsoft.playwright.ElementHandle.class);
        when(row.querySelectorAll(":scope > td")).thenReturn(List.of(cell));

        List<ElementHandle> cells = handle.query(Query.css(":scope > td"), new PlaywrightElementHandle(row));

        assertEquals(1, cells.size());
        verify(page, never()).querySelectorAll(anyString());
    }

    @Test
    void testDetachedElementBecomesStale() {
        com.microsoft.playwright.ElementHandle el = Mockito.mock(com.microsoft.playwright.ElementHandle.class);
        when(el.innerText()).thenThrow(new PlaywrightException("Element is not attached to the DOM"));

        assertThrows(StaleHandleException.class, () -> new PlaywrightElementHandle(el).text());
    }

    @Test
    void testErrorTranslation() {
        assertTrue(PlaywrightPageHandle.translate(new TimeoutError("Timeout 5000ms exceeded")) instanceof StaleHandleException);
        assertTrue(PlaywrightPageHandle.translate(
            new PlaywrightException("Target page, context or browser has been closed")) instanceof PageUnavailableException);
        assertTrue(PlaywrightPageHandle.translate(
            new PlaywrightException("Execution context was destroyed, most likely because of a navigation")) instanceof StaleHandleException);
        PlaywrightException other = new PlaywrightException("Unexpected token");
        assertSame(other, PlaywrightPageHandle.translate(other));
    }

    @Test
    void testClosedPageIsUnavailable() {
        when(page.isClosed()).thenReturn(true);

        assertThrows(PageUnavailableException.class, () -> handle.query(Query.css("tr"), null));
        assertThrows(PageUnavailableException.class, () -> handle.pressKey("End"));
    }

    @Test
    void testPressKeyUsesKeyboard() {
        Keyboard keyboard = Mockito.mock(Keyboard.class);
        when(page.keyboard()).thenReturn(keyboard);

        handle.pressKey("PageDown");

        verify(keyboard).press("PageDown");
    }

    @Test
    void testReadyStateComplete() {
        when(page.evaluate("() => document.readyState")).thenReturn("complete");
        assertTrue(handle.currentReadyState());
    }
}
