package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observer for extraction progress. Consoles, GUIs and logs subscribe through this interface
 * instead of the engine writing to any presentation layer.
 */
@FunctionalInterface
public interface ExtractionProgressListener {

    void onProgress(ProgressEvent event);

    /**
     * Listener that ignores every event.
     */
    static ExtractionProgressListener none() {
        return event -> { };
    }

    /**
     * Listener that writes events to the application log.
     */
    static ExtractionProgressListener logging() {
        Logger logger = LoggerFactory.getLogger(ExtractionProgressListener.class);
        return event -> logger.info("[{}] iteration={} rows={} target={} {}",
            event.stage(), event.iteration(), event.rowsLoaded(), event.targetEstimate(),
            event.message() == null ? "" : event.message());
    }
}
