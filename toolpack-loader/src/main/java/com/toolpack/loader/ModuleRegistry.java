package com.toolpack.loader;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of tool modules currently being loaded, by unique module name.
 * An entry lives only for the duration of one load; {@link SearchScopeGuard} removes it on every exit path.
 */
public final class ModuleRegistry {

    private static final ModuleRegistry INSTANCE = new ModuleRegistry();

    /** module name → class loader of the module */
    private final Map<String, ClassLoader> modules = new ConcurrentHashMap<>();

    public static ModuleRegistry getInstance() {
        return INSTANCE;
    }

    private ModuleRegistry() {
    }

    /**
     * @throws IllegalStateException if a module with the same name is already registered
     */
    void register(String moduleName, ClassLoader loader) {
        if (modules.putIfAbsent(moduleName, loader) != null) {
            throw new IllegalStateException("Module already registered: " + moduleName);
        }
    }

    void unregister(String moduleName) {
        modules.remove(moduleName);
    }

    public Optional<ClassLoader> lookup(String moduleName) {
        return Optional.ofNullable(modules.get(moduleName));
    }

    public boolean contains(String moduleName) {
        return modules.containsKey(moduleName);
    }

    public Set<String> moduleNames() {
        return Set.copyOf(modules.keySet());
    }

    public int size() {
        return modules.size();
    }
}
