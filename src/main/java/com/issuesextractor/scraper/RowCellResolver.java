package com.issuesextractor.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a rendered row into cells and reads a value from each cell.
 * <p>
 * Segmentation tries the {@link LocatorTarget#ROW_CELLS} strategies in order and keeps the first
 * one yielding at least {@link #MIN_CELLS} cells. Rows no strategy can split become pseudo-cells,
 * one per line of the row text.
 * <p>
 * Cell values fall back from direct text, to value-bearing attributes, to the first descendant
 * with text, to script-evaluated text content.
 */
public class RowCellResolver {
    private static final Logger logger = LoggerFactory.getLogger(RowCellResolver.class);

    static final int MIN_CELLS = 2;
    private static final List<String> VALUE_ATTRIBUTES = List.of("title", "aria-label", "value");

    private final LocatorChain chain;
    private final LocatorCatalog catalog;

    public RowCellResolver(LocatorChain chain, LocatorCatalog catalog) {
        this.chain = chain;
        this.catalog = catalog;
    }

    /**
     * One cell of a row: either a live element or a line of text split from the row.
     */
    public static final class Cell {
        private final ElementHandle element;
        private final String text;

        private Cell(ElementHandle element, String text) {
            this.element = element;
            this.text = text;
        }

        static Cell of(ElementHandle element) {
            return new Cell(element, null);
        }

        static Cell pseudo(String text) {
            return new Cell(null, text);
        }

        public boolean isPseudo() {
            return element == null;
        }
    }

    /**
     * Segments a row into cells.
     * @throws StaleHandleException when the row itself is detached
     */
    public List<Cell> cells(ElementHandle row) {
        QuerySpec spec = catalog.spec(LocatorTarget.ROW_CELLS);
        for (Query query : spec.strategies()) {
            List<ElementHandle> found = chain.runQuery(spec, query, row);
            if (found.size() >= MIN_CELLS) {
                List<Cell> cells = new ArrayList<>(found.size());
                for (ElementHandle e : found) cells.add(Cell.of(e));
                logger.trace("Row split into {} cells via {}", cells.size(), query);
                return cells;
            }
        }
        List<Cell> pseudo = new ArrayList<>();
        for (String line : Utils.lines(row.text())) pseudo.add(Cell.pseudo(line));
        logger.debug("No cell strategy matched; split row text into {} pseudo-cells", pseudo.size());
        return pseudo;
    }

    /**
     * Reads the value of one cell using nested fallbacks.
     * @return trimmed value, empty when every fallback came up empty
     */
    public String valueOf(Cell cell) {
        if (cell.isPseudo()) return cell.text.trim();
        ElementHandle element = cell.element;

        String direct = element.text();
        if (direct != null && !direct.isBlank()) return direct.trim();

        for (String attr : VALUE_ATTRIBUTES) {
            String v = element.attribute(attr);
            if (v != null && !v.isBlank()) return v.trim();
        }

        QuerySpec descendants = catalog.spec(LocatorTarget.CELL_TEXT_DESCENDANT);
        for (Query query : descendants.strategies()) {
            for (ElementHandle child : chain.runQuery(descendants, query, element)) {
                String t = child.text();
                if (t != null && !t.isBlank()) return t.trim();
            }
        }

        try {
            Object content = chain.page().evaluate(PageScripts.TEXT_CONTENT, element);
            if (content != null && !content.toString().isBlank()) return content.toString().trim();
        } catch (StaleHandleException | PageUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("Script text extraction failed: {}", e.getMessage());
        }
        return "";
    }

    /**
     * Segments a row and reads every cell value.
     */
    public List<String> cellTexts(ElementHandle row) {
        List<String> out = new ArrayList<>();
        for (Cell cell : cells(row)) out.add(valueOf(cell));
        return out;
    }
}
