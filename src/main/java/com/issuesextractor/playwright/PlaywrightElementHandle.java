package com.issuesextractor.playwright;

import com.issuesextractor.scraper.ElementHandle;

/**
 * {@link ElementHandle} backed by a Playwright element handle.
 */
public class PlaywrightElementHandle implements ElementHandle {
    private final com.microsoft.playwright.ElementHandle delegate;

    public PlaywrightElementHandle(com.microsoft.playwright.ElementHandle delegate) {
        if (delegate == null) throw new IllegalArgumentException("delegate cannot be null");
        this.delegate = delegate;
    }

    com.microsoft.playwright.ElementHandle delegate() {
        return delegate;
    }

    @Override
    public String text() {
        return PlaywrightPageHandle.call(() -> {
            String s = delegate.innerText();
            return s == null ? "" : s;
        });
    }

    @Override
    public String attribute(String name) {
        return PlaywrightPageHandle.call(() -> delegate.getAttribute(name));
    }

    @Override
    public boolean isVisible() {
        return PlaywrightPageHandle.call(delegate::isVisible);
    }

    @Override
    public boolean isEnabled() {
        return PlaywrightPageHandle.call(delegate::isEnabled);
    }
}
