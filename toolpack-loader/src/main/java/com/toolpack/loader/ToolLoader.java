package com.toolpack.loader;

import com.toolpack.error.ToolConfigException;
import com.toolpack.error.ToolLoadException;
import com.toolpack.error.ToolNotFoundException;
import com.toolpack.model.ToolConfig;
import com.toolpack.model.ToolJson;
import com.toolpack.model.ToolMetadata;
import com.toolpack.model.ToolPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Loads a tool's implementation class and configuration, from a local tool directory or from a
 * {@link ToolPackage}.
 * <p>
 * Each load runs inside a {@link SearchScopeGuard}: the tool directory (and the working directory,
 * when absent) is pushed onto the process-wide {@link ModuleSearchScope}, a fresh
 * {@link ToolClassLoader} over the entry and the scope is registered in the {@link ModuleRegistry}
 * under a unique module name, and the class named by {@code build.module} is resolved and initialized.
 * Scope and registry are restored before the method returns or throws.
 * <p>
 * <b>Threading:</b> scope and registry are process-wide; callers must serialize loads.
 * <p>
 * Entry: a JAR or a class directory relative to the tool root. JARs under {@code <tool>/lib/}
 * are added to the tool's class path.
 */
public final class ToolLoader {

    private static final Logger log = LoggerFactory.getLogger(ToolLoader.class);

    static final String LIB_DIR = "lib";
    private static final String MODULE_PREFIX = "toolpack.module.";

    private final ModuleLoader moduleLoader;
    private final ModuleSearchScope scope;
    private final ModuleRegistry registry;
    private final ClassLoader parent;
    private final Collection<String> hostApiPackages;
    private final Path scratchRoot;

    /**
     * Loader using the process-wide scope and registry, {@link ReflectiveModuleLoader}, this class's
     * loader as parent, and the system temp directory for package scratch directories.
     */
    public ToolLoader() {
        this(new ReflectiveModuleLoader(), ToolLoader.class.getClassLoader(), List.of(), null);
    }

    /**
     * @param moduleLoader    resolves the implementation class
     * @param parent          host class loader for shared and fallback classes
     * @param hostApiPackages package prefixes always loaded from {@code parent}
     * @param scratchRoot     parent of package scratch directories; null = system temp dir
     */
    public ToolLoader(ModuleLoader moduleLoader, ClassLoader parent, Collection<String> hostApiPackages, Path scratchRoot) {
        this.moduleLoader = moduleLoader;
        this.scope = ModuleSearchScope.getInstance();
        this.registry = ModuleRegistry.getInstance();
        this.parent = parent;
        this.hostApiPackages = List.copyOf(hostApiPackages);
        this.scratchRoot = scratchRoot;
    }

    /**
     * Loads {@code rootDir/name}.
     *
     * @throws ToolNotFoundException if the tool directory, its {@code config.json} or its entry is missing
     * @throws ToolConfigException   if {@code config.json} is invalid or lacks {@code build.entry}/{@code build.module}
     * @throws ToolLoadException     if the class is missing or fails to initialize
     */
    public LoadedTool loadFromLocalDir(Path rootDir, String name) {
        Path toolDir = rootDir.resolve(name).toAbsolutePath().normalize();
        Map<String, Object> config = readLocalConfig(rootDir, name);
        ToolConfig.Build build = buildSection(config, name);
        String entry = require(build.getEntry(), "build.entry", name);
        String module = require(build.getModule(), "build.module", name);
        return load(name, toolDir, entry, module, config, null);
    }

    /**
     * Loads a package by materializing its files into a scratch directory. Config comes from the
     * package's {@code config.json} when present, otherwise from its metadata; entry and module come
     * from the metadata. The scratch directory is deleted on failure or when the result is closed.
     *
     * @throws ToolNotFoundException if the entry is not among the package files
     * @throws ToolConfigException   if the packaged {@code config.json} is invalid
     * @throws ToolLoadException     if the class is missing or fails to initialize
     */
    public LoadedTool loadFromPackage(ToolPackage pkg) {
        ToolMetadata metadata = pkg.getMetadata();
        Map<String, Object> config = packageConfig(pkg);
        String name = metadata.getName() != null ? metadata.getName() : "tool";
        Path scratch = ScratchDirectories.materialize(pkg, scratchRoot);
        boolean loaded = false;
        try {
            LoadedTool tool = load(name, scratch.toAbsolutePath().normalize(), metadata.getEntry(),
                    metadata.getModule(), config, scratch);
            loaded = true;
            return tool;
        } finally {
            if (!loaded) {
                ScratchDirectories.deleteQuietly(scratch);
            }
        }
    }

    /**
     * Reads {@code rootDir/name/config.json} without loading any code.
     *
     * @throws ToolNotFoundException if the tool directory or its config is missing
     * @throws ToolConfigException   if the config is not a JSON object
     */
    public Map<String, Object> readLocalConfig(Path rootDir, String name) {
        Path toolDir = rootDir.resolve(name);
        if (!Files.isDirectory(toolDir)) {
            throw new ToolNotFoundException("Local tool not found", toolDir);
        }
        Path configPath = toolDir.resolve(ToolPackage.CONFIG_FILE);
        if (!Files.isRegularFile(configPath)) {
            throw new ToolNotFoundException("Config file not found for tool " + name, configPath);
        }
        try {
            return parseConfig(Files.readAllBytes(configPath), configPath.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + configPath, e);
        }
    }

    private LoadedTool load(String name, Path toolDir, String entry, String module,
                            Map<String, Object> config, Path scratchDir) {
        Path entryPath = resolveEntry(toolDir, entry, name);
        String moduleName = MODULE_PREFIX + name + "." + UUID.randomUUID();
        ToolClassLoader classLoader = null;
        boolean loaded = false;
        try (SearchScopeGuard guard = SearchScopeGuard.enter(scope, registry, toolDir, workingDir())) {
            classLoader = new ToolClassLoader(moduleName, classPath(entryPath, toolDir, scope.snapshot()),
                    parent, hostApiPackages);
            guard.registerModule(moduleName, classLoader);
            Class<?> toolClass = moduleLoader.loadSymbol(classLoader, module);
            loaded = true;
            log.info("Loaded tool {} class {} from {}", name, toolClass.getName(), entryPath);
            return new LoadedTool(toolClass, config, classLoader, scratchDir);
        } catch (ToolLoadException e) {
            log.warn("Failed to load tool {} (module {}) from {}: {}", name, module, entryPath, e.getMessage());
            throw e;
        } finally {
            if (!loaded && classLoader != null) {
                closeQuietly(classLoader);
            }
        }
    }

    private static Map<String, Object> packageConfig(ToolPackage pkg) {
        byte[] configBytes = pkg.getFile(ToolPackage.CONFIG_FILE).orElse(null);
        if (configBytes == null) {
            return ToolJson.toMap(ToolConfig.of(pkg.getMetadata()));
        }
        return parseConfig(configBytes, pkg.getMetadata() + " " + ToolPackage.CONFIG_FILE);
    }

    private static Map<String, Object> parseConfig(byte[] json, String source) {
        try {
            return ToolJson.toMap(json);
        } catch (UncheckedIOException e) {
            throw new ToolConfigException("Invalid tool config " + source + ": " + e.getCause().getMessage(), e);
        }
    }

    private static ToolConfig.Build buildSection(Map<String, Object> config, String toolName) {
        try {
            return ToolJson.mapper().convertValue(config, ToolConfig.class).getBuild();
        } catch (IllegalArgumentException e) {
            throw new ToolConfigException("Tool " + toolName + " config does not match the config schema", e);
        }
    }

    private static String require(String value, String key, String toolName) {
        if (value == null || value.isBlank()) {
            throw new ToolConfigException("Tool " + toolName + " config is missing " + key);
        }
        return value;
    }

    private static Path resolveEntry(Path toolDir, String entry, String toolName) {
        Path entryPath = toolDir.resolve(entry).normalize();
        if (!entryPath.startsWith(toolDir)) {
            throw new ToolConfigException("Entry of tool " + toolName + " is outside the tool directory: " + entry);
        }
        if (!Files.exists(entryPath)) {
            throw new ToolNotFoundException("Entry not found for tool " + toolName, entryPath);
        }
        return entryPath;
    }

    /** Entry, bundled {@code lib/*.jar}, then search scope locations. */
    static URL[] classPath(Path entryPath, Path toolDir, List<Path> searchLocations) {
        List<URL> urls = new ArrayList<>();
        try {
            urls.add(entryPath.toUri().toURL());
            Path libDir = toolDir.resolve(LIB_DIR);
            if (Files.isDirectory(libDir)) {
                try (DirectoryStream<Path> jars = Files.newDirectoryStream(libDir, "*.jar")) {
                    for (Path jar : jars) {
                        urls.add(jar.toUri().toURL());
                    }
                }
            }
            for (Path location : searchLocations) {
                urls.add(location.toUri().toURL());
            }
        } catch (MalformedURLException e) {
            throw new ToolLoadException("Invalid class path location: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + toolDir.resolve(LIB_DIR), e);
        }
        return urls.toArray(new URL[0]);
    }

    private static Path workingDir() {
        return Path.of("").toAbsolutePath().normalize();
    }

    private static void closeQuietly(ToolClassLoader classLoader) {
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("Failed to close tool class loader {}: {}", classLoader.getName(), e.getMessage());
        }
    }
}
