package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service that extracts every issue rendered in a virtualized issues table.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Opens the issues view through {@link LocatorChain} and, optionally, the "select all columns" dialog.</li>
 *   <li>Estimates the row total with {@link TargetCountProbe}.</li>
 *   <li>Drives {@link LazyLoadConvergence} until the rendered rows stop growing.</li>
 *   <li>Infers the column schema once, from the header row and the first loaded rows.</li>
 *   <li>Extracts every rendered row with {@link RowExtractor}; skipped rows are counted, never fatal.</li>
 *   <li>Follows the next-page control while rows are still missing, up to the page limit.</li>
 *   <li>Reports duplicate titles through {@link DuplicateTitleTracker} without dropping any row.</li>
 * </ul>
 * Only {@link PageUnavailableException} aborts a run.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public class ExtractionService implements ExtractionServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionService.class);

    private static final int SCHEMA_SAMPLE_ROWS = 3;
    private static final int READY_STATE_CHECKS = 10;

    private final PageHandle page;
    private final LocatorCatalog catalog;
    private final ExtractorConfig config;
    private final ExtractionProgressListener listener;
    private final LocatorChain chain;
    private final IssueRowFinder rowFinder;
    private final TableSchemaInference schemaInference;
    private final RowExtractor rowExtractor;
    private final LazyLoadConvergence convergence;
    private final TargetCountProbe countProbe;

    public ExtractionService(PageHandle page, LocatorCatalog catalog, ExtractorConfig config, ExtractionProgressListener listener) {
        if (page == null) throw new IllegalArgumentException("PageHandle cannot be null");
        this.page = page;
        this.catalog = catalog == null ? LocatorCatalog.loadDefault() : catalog;
        this.config = config == null ? new ExtractorConfig() : config;
        this.listener = listener == null ? ExtractionProgressListener.none() : listener;
        this.chain = new LocatorChain(page, this.config);
        this.rowFinder = new IssueRowFinder(chain, this.catalog);
        RowCellResolver cellResolver = new RowCellResolver(chain, this.catalog);
        this.schemaInference = new TableSchemaInference(chain, this.catalog, cellResolver);
        this.rowExtractor = new RowExtractor(chain, this.catalog, cellResolver, new IssueNormalizer(this.config.getMaxValueLength()));
        this.convergence = new LazyLoadConvergence(page, chain, this.catalog, rowFinder, this.config, this.listener);
        this.countProbe = new TargetCountProbe(chain, this.catalog, rowFinder, this.config);
    }

    @Override
    public ExtractionResult run() {
        openIssuesView();
        int target = countProbe.estimate();

        List<IssueRecord> records = new ArrayList<>();
        List<LoadOutcome> loads = new ArrayList<>();
        DuplicateTitleTracker tracker = new DuplicateTitleTracker();
        SchemaMap schema = null;
        int attempted = 0;
        int skipped = 0;
        String previousFirstRow = null;

        for (int pageNo = 1; pageNo <= Math.max(1, config.getMaxPages()); pageNo++) {
            int remaining = Math.max(1, target - attempted);
            LoadOutcome outcome = convergence.loadAll(remaining, config.getMaxScrollIterations());
            loads.add(outcome);

            List<ElementHandle> rows = rowFinder.findRows();
            if (rows.isEmpty()) {
                logger.warn("No rows rendered on page {}", pageNo);
                break;
            }
            String firstRow = firstRowText(rows);
            if (previousFirstRow != null && previousFirstRow.equals(firstRow)) {
                logger.info("Page {} shows the same rows as the previous page; stopping pagination.", pageNo);
                loads.remove(loads.size() - 1);
                break;
            }
            previousFirstRow = firstRow;

            if (schema == null) {
                listener.onProgress(new ProgressEvent(ProgressEvent.Stage.SCHEMA, 0, rows.size(), target, "inferring columns"));
                ElementHandle header = schemaInference.findHeaderRow().orElse(null);
                schema = schemaInference.infer(header, rows.subList(0, Math.min(SCHEMA_SAMPLE_ROWS, rows.size())));
            }

            for (int i = 0; i < rows.size(); i++) {
                attempted++;
                Optional<IssueRecord> record = rowExtractor.extract(rows.get(i), schema);
                if (record.isPresent()) {
                    records.add(record.get());
                    tracker.track(record.get());
                } else {
                    skipped++;
                }
                if ((i + 1) % 50 == 0 || i == rows.size() - 1) {
                    listener.onProgress(new ProgressEvent(ProgressEvent.Stage.EXTRACTION, i + 1, records.size(), target,
                        "page " + pageNo));
                }
            }

            if (attempted >= target || pageNo >= config.getMaxPages() || !advancePage()) break;
            listener.onProgress(new ProgressEvent(ProgressEvent.Stage.PAGINATION, pageNo + 1, records.size(), target, "next page"));
        }

        DuplicateReport duplicates = tracker.report();
        ExtractionResult.Status status;
        if (records.isEmpty()) {
            status = ExtractionResult.Status.EMPTY;
        } else if (loads.stream().allMatch(LoadOutcome::isComplete)) {
            status = ExtractionResult.Status.COMPLETE;
        } else {
            status = ExtractionResult.Status.PARTIAL;
        }
        logger.info("Extraction {}: {} rows attempted, {} extracted, {} skipped, {} duplicate titles, {} page(s)",
            status, attempted, records.size(), skipped, duplicates.duplicateTitleCount(), loads.size());
        listener.onProgress(new ProgressEvent(ProgressEvent.Stage.DONE, attempted, records.size(), target, status.name()));
        return new ExtractionResult(records, attempted, skipped, duplicates, schema, loads, status);
    }

    @Override
    public void openIssuesView() {
        listener.onProgress(new ProgressEvent(ProgressEvent.Stage.NAVIGATION, 0, 0, 0, "opening issues view"));
        waitForReady();
        if (config.isOpenIssuesTab()) {
            if (chain.click(catalog.spec(LocatorTarget.ISSUES_TAB), null)) {
                logger.info("Opened issues tab");
                settle();
            } else {
                logger.info("No issues tab found; assuming the issues view is already open.");
            }
        }
        if (config.isSelectAllColumns()) {
            selectAllColumns();
        }
    }

    /**
     * Opens the table settings and ticks "select all" so every column renders.
     * @return true when the dialog was confirmed
     */
    boolean selectAllColumns() {
        if (!chain.click(catalog.spec(LocatorTarget.SETTINGS_BUTTON), null)) {
            logger.debug("No table settings control; keeping the visible columns.");
            return false;
        }
        settle();
        chain.click(catalog.spec(LocatorTarget.COLUMNS_TAB), null);
        if (!chain.click(catalog.spec(LocatorTarget.SELECT_ALL_COLUMNS), null)) {
            logger.warn("Settings opened but no select-all control was found.");
        }
        boolean confirmed = chain.click(catalog.spec(LocatorTarget.CONFIRM_COLUMNS), null);
        if (confirmed) {
            logger.info("Selected all table columns");
            settle();
        } else {
            logger.warn("Could not confirm the column selection dialog.");
        }
        return confirmed;
    }

    private boolean advancePage() {
        boolean clicked = chain.click(catalog.spec(LocatorTarget.NEXT_PAGE), null);
        if (!clicked) {
            logger.debug("No enabled next-page control; pagination finished.");
            return false;
        }
        settle();
        waitForReady();
        return true;
    }

    private void waitForReady() {
        for (int i = 0; i < READY_STATE_CHECKS && !page.currentReadyState(); i++) {
            page.pause(Math.max(100, config.getSettleDelayMs()));
        }
    }

    private void settle() {
        if (config.getSettleDelayMs() > 0) page.pause(config.getSettleDelayMs());
    }

    private static String firstRowText(List<ElementHandle> rows) {
        try {
            return rows.get(0).text();
        } catch (StaleHandleException e) {
            logger.debug("First row went stale before it could be read: {}", e.getMessage());
            return null;
        }
    }
}
