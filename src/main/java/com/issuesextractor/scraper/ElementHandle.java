package com.issuesextractor.scraper;

/**
 * Opaque reference to one live DOM node, valid only for the current render.
 * <p>
 * Handles are never cached across convergence iterations. Every method may throw
 * {@link StaleHandleException} once the node has been detached by a re-render.
 */
public interface ElementHandle {
    /**
     * @return rendered text of the node, never null
     */
    String text();

    /**
     * @param name attribute name
     * @return attribute value, or null when absent
     */
    String attribute(String name);

    boolean isVisible();

    /**
     * @return true when the node accepts interaction (not disabled)
     */
    boolean isEnabled();
}
