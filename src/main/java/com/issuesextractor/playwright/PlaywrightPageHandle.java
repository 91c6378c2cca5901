package com.issuesextractor.playwright;

import com.issuesextractor.scraper.ElementHandle;
import com.issuesextractor.scraper.PageHandle;
import com.issuesextractor.scraper.PageScripts;
import com.issuesextractor.scraper.PageUnavailableException;
import com.issuesextractor.scraper.Query;
import com.issuesextractor.scraper.StaleHandleException;
import com.microsoft.playwright.JSHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link PageHandle} backed by a Playwright {@link Page}.
 * <p>
 * Workflow:
 * <ul>
 *   <li>CSS, XPath and text strategies map onto Playwright selector engines ({@code xpath=}, {@code text=}).</li>
 *   <li>Script strategies are evaluated with {@link Page#evaluateHandle} and the returned array is unpacked into element handles.</li>
 *   <li>Every call runs under the page's default timeout, set from the action timeout.</li>
 *   <li>Detached/disposed element errors and timeouts become {@link StaleHandleException}; a closed page,
 *       context or browser becomes {@link PageUnavailableException}.</li>
 * </ul>
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class PlaywrightPageHandle implements PageHandle {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightPageHandle.class);

    private final Page page;

    public PlaywrightPageHandle(Page page, long actionTimeoutMs) {
        if (page == null) throw new IllegalArgumentException("Page cannot be null");
        this.page = page;
        page.setDefaultTimeout(actionTimeoutMs);
    }

    @Override
    public List<ElementHandle> query(Query query, ElementHandle scope) {
        ensureOpen();
        if (query.kind() == Query.Kind.SCRIPT) {
            return call(() -> scriptQuery(query.expression(), scope));
        }
        String selector = toSelector(query);
        return call(() -> {
            List<com.microsoft.playwright.ElementHandle> found = scope == null
                ? page.querySelectorAll(selector)
                : unwrap(scope).querySelectorAll(selector);
            return wrap(found);
        });
    }

    @Override
    public Object evaluate(String script, Object... args) {
        ensureOpen();
        Object arg;
        if (args == null || args.length == 0) {
            arg = null;
        } else if (args.length == 1) {
            arg = unwrapArg(args[0]);
        } else {
            List<Object> list = new ArrayList<>(args.length);
            for (Object a : args) list.add(unwrapArg(a));
            arg = list;
        }
        return call(() -> page.evaluate(script, arg));
    }

    @Override
    public void scrollTo(ElementHandle target) {
        ensureOpen();
        if (target == null) {
            call(() -> page.evaluate(PageScripts.SCROLL_WINDOW_BOTTOM));
            return;
        }
        call(() -> {
            unwrap(target).scrollIntoViewIfNeeded();
            return null;
        });
    }

    @Override
    public void click(ElementHandle target) {
        ensureOpen();
        call(() -> {
            com.microsoft.playwright.ElementHandle el = unwrap(target);
            el.scrollIntoViewIfNeeded();
            el.click();
            return null;
        });
    }

    @Override
    public void typeText(ElementHandle target, String text) {
        ensureOpen();
        call(() -> {
            unwrap(target).fill(text == null ? "" : text);
            return null;
        });
    }

    @Override
    public void pressKey(String key) {
        ensureOpen();
        call(() -> {
            page.keyboard().press(key);
            return null;
        });
    }

    @Override
    public void pause(long millis) {
        ensureOpen();
        call(() -> {
            page.waitForTimeout(millis);
            return null;
        });
    }

    @Override
    public boolean currentReadyState() {
        ensureOpen();
        return call(() -> "complete".equals(page.evaluate("() => document.readyState")));
    }

    // --- Helpers ---

    static String toSelector(Query query) {
        return switch (query.kind()) {
            case CSS -> query.expression();
            case XPATH -> "xpath=" + query.expression();
            case TEXT -> "text=" + query.expression();
            case SCRIPT -> throw new IllegalArgumentException("Script strategies have no selector form");
        };
    }

    private List<ElementHandle> scriptQuery(String function, ElementHandle scope) {
        JSHandle result = page.evaluateHandle(function, scope == null ? null : unwrap(scope));
        try {
            List<Map.Entry<String, JSHandle>> entries = new ArrayList<>(result.getProperties().entrySet());
            entries.sort(Comparator.comparingInt(e -> indexOf(e.getKey())));
            List<ElementHandle> out = new ArrayList<>();
            for (Map.Entry<String, JSHandle> entry : entries) {
                com.microsoft.playwright.ElementHandle el = entry.getValue().asElement();
                if (el != null) out.add(new PlaywrightElementHandle(el));
            }
            return out;
        } finally {
            result.dispose();
        }
    }

    private static int indexOf(String key) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static List<ElementHandle> wrap(List<com.microsoft.playwright.ElementHandle> found) {
        List<ElementHandle> out = new ArrayList<>(found == null ? 0 : found.size());
        if (found != null) for (com.microsoft.playwright.ElementHandle el : found) out.add(new PlaywrightElementHandle(el));
        return out;
    }

    private static com.microsoft.playwright.ElementHandle unwrap(ElementHandle handle) {
        if (handle instanceof PlaywrightElementHandle pw) return pw.delegate();
        throw new IllegalArgumentException("Not a Playwright element handle: " + handle);
    }

    private static Object unwrapArg(Object arg) {
        return arg instanceof PlaywrightElementHandle pw ? pw.delegate() : arg;
    }

    private void ensureOpen() {
        if (page.isClosed()) throw new PageUnavailableException("Page has been closed");
    }

    /**
     * Runs a Playwright call and translates its failures into the engine's error taxonomy.
     */
    static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (PlaywrightException e) {
            throw translate(e);
        }
    }

    static RuntimeException translate(PlaywrightException e) {
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (e instanceof TimeoutError) {
            return new StaleHandleException("Timed out waiting for element: " + e.getMessage(), e);
        }
        if (msg.contains("has been closed") || msg.contains("target closed") || msg.contains("browser closed")
            || msg.contains("connection closed")) {
            logger.error("Page is no longer usable: {}", e.getMessage());
            return new PageUnavailableException(e.getMessage(), e);
        }
        if (msg.contains("not attached") || msg.contains("detached") || msg.contains("disposed")
            || msg.contains("execution context was destroyed")) {
            return new StaleHandleException(e.getMessage(), e);
        }
        return e;
    }
}
