package com.toolpack.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Scoped module-search context for one tool load. {@link #enter} pushes the working directory
 * (when not already present) and the tool directory onto the {@link ModuleSearchScope};
 * {@link #close()} removes exactly those entries, in reverse order, and unregisters every module
 * registered through this guard. Use with try-with-resources so restoration happens on every exit path.
 */
public final class SearchScopeGuard implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SearchScopeGuard.class);

    private final ModuleSearchScope scope;
    private final ModuleRegistry registry;
    private final Deque<Path> pushed = new ArrayDeque<>();
    private final List<String> registeredModules = new ArrayList<>();
    private boolean closed;

    private SearchScopeGuard(ModuleSearchScope scope, ModuleRegistry registry) {
        this.scope = scope;
        this.registry = registry;
    }

    /**
     * @param toolDir    tool root, always pushed (ends up first)
     * @param workingDir pushed before {@code toolDir} only if the scope does not contain it; may be null
     */
    public static SearchScopeGuard enter(ModuleSearchScope scope, ModuleRegistry registry, Path toolDir, Path workingDir) {
        SearchScopeGuard guard = new SearchScopeGuard(scope, registry);
        try {
            if (workingDir != null && !scope.contains(workingDir)) {
                guard.push(workingDir);
            }
            guard.push(toolDir);
        } catch (RuntimeException e) {
            guard.close();
            throw e;
        }
        return guard;
    }

    private void push(Path location) {
        scope.push(location);
        pushed.push(location);
    }

    /** Registers a module for the lifetime of this guard. */
    public void registerModule(String moduleName, ClassLoader loader) {
        registry.register(moduleName, loader);
        registeredModules.add(moduleName);
    }

    /** Locations pushed by this guard, most recent first. */
    List<Path> pushedLocations() {
        return List.copyOf(pushed);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (String moduleName : registeredModules) {
            registry.unregister(moduleName);
        }
        registeredModules.clear();
        while (!pushed.isEmpty()) {
            Path location = pushed.pop();
            if (!scope.pop(location)) {
                log.warn("Search location {} was already removed from the module search scope", location);
            }
        }
    }
}
