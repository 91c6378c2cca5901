package com.issuesextractor.scraper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LocatorChainTest {

    @Test
    void testResolveFallsThroughToLaterStrategy() {
        FakeElement button = FakeElement.of("Issues", "tab");
        FakePage page = new FakePage().add(button);
        QuerySpec spec = QuerySpec.of("ISSUES_TAB", Query.css("sapMITBText"), Query.xpath("tab"));

        Optional<ElementHandle> found = Fixtures.chain(page).resolve(spec, null);

        assertTrue(found.isPresent());
        assertSame(button, found.get());
    }

    @Test
    void testResolveSkipsHiddenAndDisabledCandidates() {
        FakeElement hidden = FakeElement.of("Next", "next").hidden();
        FakeElement disabled = FakeElement.of("Next", "next").disabled();
        FakeElement usable = FakeElement.of("Next", "pager-next");
        FakePage page = new FakePage().add(hidden, disabled, usable);
        QuerySpec spec = QuerySpec.of("NEXT_PAGE", Query.css("next"), Query.css("pager-next"));

        Optional<ElementHandle> found = Fixtures.chain(page).resolve(spec, null);

        assertSame(usable, found.orElseThrow());
    }

    @Test
    void testResolveReturnsEmptyWhenEveryStrategyFails() {
        FakePage page = new FakePage().add(FakeElement.of("unrelated", "div"));
        QuerySpec spec = QuerySpec.of("SETTINGS_BUTTON", Query.css("settings"), Query.text("Settings"));

        assertTrue(Fixtures.chain(page).resolve(spec, null).isEmpty());
        assertTrue(Fixtures.chain(page).resolve(new QuerySpec("EMPTY", List.of()), null).isEmpty());
    }

    @Test
    void testScriptCandidateIsScrolledIntoViewBeforeRejecting() {
        FakeElement offscreen = FakeElement.of("Show more", "more").hidden();
        offscreen.revealOnScroll = true;
        FakePage page = new FakePage().add(offscreen);
        page.onScriptQuery("findMore", scope -> List.of(offscreen));
        QuerySpec spec = QuerySpec.of("SHOW_MORE", Query.script("findMore"));

        Optional<ElementHandle> found = Fixtures.chain(page).resolve(spec, null);

        assertSame(offscreen, found.orElseThrow());
        assertEquals(List.of(offscreen), page.scrolledTo);
    }

    @Test
    void testResolveAllUsesFirstStrategyWithVisibleMatches() {
        FakePage page = new FakePage().add(
            FakeElement.of("ghost", "tr").hidden(),
            FakeElement.of("a", "li"),
            FakeElement.of("b", "li"));
        QuerySpec spec = QuerySpec.of("ISSUE_ROWS", Query.css("tr"), Query.css("li"));

        List<ElementHandle> rows = Fixtures.chain(page).resolveAll(spec, null);

        assertEquals(2, rows.size());
        assertEquals("a", rows.get(0).text());
    }

    @Test
    void testResolveAndActRetriesWhenHandleGoesStale() {
        FakeElement tab = FakeElement.of("Issues", "issues-tab");
        tab.clickFailures = 2;
        FakePage page = new FakePage().add(tab);

        boolean clicked = Fixtures.chain(page).click(QuerySpec.of("ISSUES_TAB", Query.css("issues-tab")), null);

        assertTrue(clicked);
        assertEquals(List.of(tab), page.clicked);
        assertEquals(0, tab.clickFailures);
    }

    @Test
    void testResolveAndActGivesUpAfterRetryBudget() {
        FakeElement tab = FakeElement.of("Issues", "issues-tab");
        tab.clickFailures = 5;
        FakePage page = new FakePage().add(tab);

        boolean clicked = Fixtures.chain(page).click(QuerySpec.of("ISSUES_TAB", Query.css("issues-tab")), null);

        assertFalse(clicked);
        assertTrue(page.clicked.isEmpty());
        assertEquals(2, tab.clickFailures);
    }

    @Test
    void testResolveAndActReportsAbsentTarget() {
        FakePage page = new FakePage();
        assertFalse(Fixtures.chain(page).click(QuerySpec.of("NEXT_PAGE", Query.css("next")), null));
    }

    @Test
    void testFilterRejectsCandidates() {
        FakeElement first = FakeElement.of("Show more", "show-more");
        FakeElement second = FakeElement.of("Load more", "show-more");
        FakePage page = new FakePage().add(first, second);

        Optional<ElementHandle> found = Fixtures.chain(page)
            .resolve(QuerySpec.of("SHOW_MORE", Query.css("show-more")), null, c -> c.text().startsWith("Load"));

        assertSame(second, found.orElseThrow());
    }

    @Test
    void testStaleScopeYieldsNoMatch() {
        FakeElement row = Fixtures.row("Renew SSL cert", "Task");
        FakePage page = new FakePage().add(row);
        row.detached = true;

        assertTrue(Fixtures.chain(page).resolveAll(QuerySpec.of("ROW_CELLS", Query.css("td")), row).isEmpty());
    }

    @Test
    void testClosedPagePropagates() {
        FakePage page = new FakePage().add(FakeElement.of("Issues", "issues-tab"));
        page.close();
        LocatorChain chain = Fixtures.chain(page);

        assertThrows(PageUnavailableException.class,
            () -> chain.resolve(QuerySpec.of("ISSUES_TAB", Query.css("issues-tab")), null));
    }
}
