package com.libragraph.boxes.core.config;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

import java.util.Objects;

/**
 * Tunables of the box algebra, read through MicroProfile Config.
 *
 * <p>Defaults ship in {@code META-INF/microprofile-config.properties}; system properties
 * and environment variables override them as usual ({@code BOXES_CANONICAL_MAX_DEPTH}).
 *
 * @param maxDepth         deepest label nesting a box may contain
 * @param cacheMaxEntries  memoized Sum/Product results kept; 0 disables the cache
 * @param maxRenderedAtoms largest atom count the text writer will expand
 */
public record BoxesConfig(int maxDepth, int cacheMaxEntries, int maxRenderedAtoms) {

    private static final Logger log = Logger.getLogger(BoxesConfig.class);

    public static final String MAX_DEPTH = "boxes.canonical.max-depth";
    public static final String CACHE_MAX_ENTRIES = "boxes.cache.max-entries";
    public static final String MAX_RENDERED_ATOMS = "boxes.text.max-rendered-atoms";

    public static final int DEFAULT_MAX_DEPTH = 256;
    public static final int DEFAULT_CACHE_MAX_ENTRIES = 4096;
    public static final int DEFAULT_MAX_RENDERED_ATOMS = 100_000;

    public BoxesConfig {
        if (maxDepth < 1) {
            throw new IllegalArgumentException(MAX_DEPTH + " must be >= 1, got: " + maxDepth);
        }
        if (cacheMaxEntries < 0) {
            throw new IllegalArgumentException(CACHE_MAX_ENTRIES + " must be >= 0, got: " + cacheMaxEntries);
        }
        if (maxRenderedAtoms < 1) {
            throw new IllegalArgumentException(
                    MAX_RENDERED_ATOMS + " must be >= 1, got: " + maxRenderedAtoms);
        }
    }

    public static BoxesConfig defaults() {
        return new BoxesConfig(DEFAULT_MAX_DEPTH, DEFAULT_CACHE_MAX_ENTRIES, DEFAULT_MAX_RENDERED_ATOMS);
    }

    /**
     * Reads the configuration visible to the current class loader.
     */
    public static BoxesConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static BoxesConfig from(Config config) {
        Objects.requireNonNull(config, "config cannot be null");
        BoxesConfig loaded = new BoxesConfig(
                config.getOptionalValue(MAX_DEPTH, Integer.class).orElse(DEFAULT_MAX_DEPTH),
                config.getOptionalValue(CACHE_MAX_ENTRIES, Integer.class).orElse(DEFAULT_CACHE_MAX_ENTRIES),
                config.getOptionalValue(MAX_RENDERED_ATOMS, Integer.class).orElse(DEFAULT_MAX_RENDERED_ATOMS));
        log.infof("Boxes configuration: maxDepth=%d cacheMaxEntries=%d maxRenderedAtoms=%d",
                loaded.maxDepth(), loaded.cacheMaxEntries(), loaded.maxRenderedAtoms());
        return loaded;
    }
}
