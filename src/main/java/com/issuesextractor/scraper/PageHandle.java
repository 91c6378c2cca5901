package com.issuesextractor.scraper;

import java.util.List;

/**
 * Contract the extraction engine consumes from the browser-session collaborator.
 * <p>
 * Implementations bound every call with a timeout. Operations on a dead page throw
 * {@link PageUnavailableException}; operations on a detached element throw
 * {@link StaleHandleException}.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public interface PageHandle {

    /**
     * Finds all elements matching one locator strategy.
     * @param query the strategy to evaluate
     * @param scope element to search within, or null for the whole document
     * @return matching handles in document order, empty when nothing matches
     */
    List<ElementHandle> query(Query query, ElementHandle scope);

    /**
     * Evaluates a script function in the page. Element handles among the arguments are passed
     * through as DOM nodes.
     * @param script JavaScript function source
     * @param args arguments for the function
     * @return the serialized result, may be null
     */
    Object evaluate(String script, Object... args);

    /**
     * Scrolls the element into view.
     */
    void scrollTo(ElementHandle target);

    void click(ElementHandle target);

    void typeText(ElementHandle target, String text);

    /**
     * Presses a keyboard key on the focused document (e.g. {@code PageDown}, {@code End}).
     */
    void pressKey(String key);

    /**
     * Lets the page settle for a bounded amount of time.
     */
    void pause(long millis);

    /**
     * @return true when the document has finished loading
     */
    boolean currentReadyState();
}
