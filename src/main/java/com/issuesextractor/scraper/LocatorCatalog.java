package com.issuesextractor.scraper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Central registry of {@link QuerySpec}s, one per {@link LocatorTarget}.
 * <p>
 * The built-in table lives in the {@code locators.json} classpath resource. An override file may
 * replace the strategies of individual targets, so a new UI variant is supported by appending
 * strategies to the data rather than adding code paths.
 *
 * @author Issues Extractor Team
 * @since 1.0
 */
public final class LocatorCatalog {
    private static final Logger logger = LoggerFactory.getLogger(LocatorCatalog.class);
    private static final String DEFAULT_RESOURCE = "/locators.json";
    private static final TypeReference<Map<LocatorTarget, List<Query>>> CATALOG_TYPE = new TypeReference<>() {};

    private final Map<LocatorTarget, QuerySpec> specs;

    private LocatorCatalog(Map<LocatorTarget, List<Query>> table) {
        Map<LocatorTarget, QuerySpec> built = new EnumMap<>(LocatorTarget.class);
        for (Map.Entry<LocatorTarget, List<Query>> entry : table.entrySet()) {
            built.put(entry.getKey(), new QuerySpec(entry.getKey().name(), entry.getValue()));
        }
        this.specs = Collections.unmodifiableMap(built);
    }

    /**
     * Builds a catalog from an in-memory table.
     */
    public static LocatorCatalog of(Map<LocatorTarget, List<Query>> table) {
        return new LocatorCatalog(table == null ? Map.of() : table);
    }

    /**
     * Loads the built-in catalog from the classpath.
     * @return catalog with every shipped strategy
     */
    public static LocatorCatalog loadDefault() {
        try (InputStream in = LocatorCatalog.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Locator catalog resource missing: " + DEFAULT_RESOURCE);
            }
            Map<LocatorTarget, List<Query>> table = new ObjectMapper().readValue(in, CATALOG_TYPE);
            logger.debug("Loaded {} locator targets from {}", table.size(), DEFAULT_RESOURCE);
            return new LocatorCatalog(table);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read locator catalog " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Loads the built-in catalog and replaces the targets present in the override file.
     * @param overrideFile JSON file with the same shape as the built-in resource, may be null
     */
    public static LocatorCatalog load(Path overrideFile) {
        LocatorCatalog defaults = loadDefault();
        if (overrideFile == null) return defaults;
        if (!Files.exists(overrideFile)) {
            logger.warn("Locator override file {} does not exist; using built-in locators.", overrideFile);
            return defaults;
        }
        try (InputStream in = Files.newInputStream(overrideFile)) {
            Map<LocatorTarget, List<Query>> overrides = new ObjectMapper().readValue(in, CATALOG_TYPE);
            Map<LocatorTarget, List<Query>> merged = new EnumMap<>(LocatorTarget.class);
            defaults.specs.forEach((target, spec) -> merged.put(target, spec.strategies()));
            merged.putAll(overrides);
            logger.info("Applied {} locator overrides from {}", overrides.size(), overrideFile);
            return new LocatorCatalog(merged);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read locator override file " + overrideFile, e);
        }
    }

    /**
     * Returns the QuerySpec for a target; a target without strategies yields an empty spec.
     */
    public QuerySpec spec(LocatorTarget target) {
        QuerySpec spec = specs.get(target);
        return spec != null ? spec : new QuerySpec(target.name(), List.of());
    }
}
