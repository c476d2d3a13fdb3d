package com.toolpack.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

/**
 * A loaded tool: its implementation class and parsed configuration.
 * <p>
 * The class stays usable as long as its class loader is open. {@link #close()} releases the loader
 * and, for tools loaded from a package, deletes the scratch directory the package was materialized
 * into. Hosts that keep the tool for the life of the process need not close it.
 */
public final class LoadedTool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LoadedTool.class);

    private final Class<?> toolClass;
    private final Map<String, Object> config;
    private final ToolClassLoader classLoader;
    private final Path scratchDir;

    LoadedTool(Class<?> toolClass, Map<String, Object> config, ToolClassLoader classLoader, Path scratchDir) {
        this.toolClass = toolClass;
        this.config = Collections.unmodifiableMap(config);
        this.classLoader = classLoader;
        this.scratchDir = scratchDir;
    }

    public Class<?> getToolClass() {
        return toolClass;
    }

    /** Parsed {@code config.json} (nested objects as maps). */
    public Map<String, Object> getConfig() {
        return config;
    }

    /**
     * Returns the implementation class as a subtype of {@code type}.
     *
     * @throws ClassCastException if the tool class does not implement {@code type}
     */
    public <T> Class<? extends T> getToolClass(Class<T> type) {
        return toolClass.asSubclass(type);
    }

    /** Scratch directory of a package load; null for local directory loads. */
    public Path getScratchDir() {
        return scratchDir;
    }

    @Override
    public void close() {
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("Failed to close class loader of {}: {}", toolClass.getName(), e.getMessage());
        }
        if (scratchDir != null) {
            ScratchDirectories.deleteQuietly(scratchDir);
        }
    }
}
