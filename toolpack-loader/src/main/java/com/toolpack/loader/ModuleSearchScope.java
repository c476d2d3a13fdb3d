package com.toolpack.loader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide ordered list of locations searched for tool classes, most recent first.
 * Every tool class loader is built over the scope as it stands when the load starts.
 * <p>
 * Shared mutable state: concurrent loads would see each other's temporary entries, so loads
 * must be serialized by the caller. Mutate only through {@link SearchScopeGuard}.
 */
public final class ModuleSearchScope {

    private static final ModuleSearchScope INSTANCE = new ModuleSearchScope();

    private final List<Path> locations = new ArrayList<>();

    public static ModuleSearchScope getInstance() {
        return INSTANCE;
    }

    private ModuleSearchScope() {
    }

    /** Copy of the current locations, most recent first. */
    public synchronized List<Path> snapshot() {
        return List.copyOf(locations);
    }

    public synchronized boolean contains(Path location) {
        return locations.contains(location);
    }

    public synchronized int size() {
        return locations.size();
    }

    /** Inserts {@code location} at the front. */
    synchronized void push(Path location) {
        locations.add(0, location);
    }

    /**
     * Removes the first occurrence of {@code location}.
     *
     * @return false if it was not present
     */
    synchronized boolean pop(Path location) {
        return locations.remove(location);
    }
}
