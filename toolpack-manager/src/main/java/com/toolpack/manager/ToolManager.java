package com.toolpack.manager;

import com.toolpack.builder.PackageBuilder;
import com.toolpack.cache.CacheStore;
import com.toolpack.cache.PackageCodec;
import com.toolpack.config.ToolpackConfig;
import com.toolpack.dependencies.DependencyInstaller;
import com.toolpack.dependencies.PipPackageInstaller;
import com.toolpack.error.CorruptPackageException;
import com.toolpack.error.ToolpackException;
import com.toolpack.loader.LoadedTool;
import com.toolpack.loader.ReflectiveModuleLoader;
import com.toolpack.loader.ToolLoader;
import com.toolpack.model.ToolCoordinates;
import com.toolpack.model.ToolListing;
import com.toolpack.model.ToolPackage;
import com.toolpack.model.ToolPayload;
import com.toolpack.registry.HttpRegistryClient;
import com.toolpack.registry.RegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entry point for hosts: packages tool folders, uploads and downloads packages, keeps the local
 * cache, and loads tools from the local tools directory or from the cache.
 * <p>
 * Loads mutate process-wide state (module search scope and module registry), so every load made
 * through any manager in the process runs under one lock.
 */
public final class ToolManager {

    private static final Logger log = LoggerFactory.getLogger(ToolManager.class);

    private static final Object LOAD_LOCK = new Object();
    static final String SCRATCH_DIR = ".scratch";

    private final Path localToolsDir;
    private final CacheStore cacheStore;
    private final PackageBuilder packageBuilder;
    private final ToolLoader toolLoader;
    private final DependencyInstaller dependencyInstaller;
    private final RegistryClient registryClient;

    /**
     * Wires the default components from configuration and creates the cache directory.
     */
    public ToolManager(ToolpackConfig config) {
        this(config.getLocalToolsDir(),
                new CacheStore(config.getCacheDir(), config.getPackageExtension()),
                new PackageBuilder(),
                new ToolLoader(new ReflectiveModuleLoader(), ToolManager.class.getClassLoader(), config.getHostApiPackages(),
                        config.getCacheDir().resolve(SCRATCH_DIR)),
                new DependencyInstaller(new PipPackageInstaller(config.getPython()), config.getCacheDir(),
                        config.getRequirementsFile()),
                new HttpRegistryClient(config.getRegistryUrl(), Duration.ofSeconds(config.getHttpTimeoutSeconds())));
    }

    public ToolManager(Path localToolsDir, CacheStore cacheStore, PackageBuilder packageBuilder, ToolLoader toolLoader,
                       DependencyInstaller dependencyInstaller, RegistryClient registryClient) {
        this.localToolsDir = localToolsDir;
        this.cacheStore = cacheStore;
        this.packageBuilder = packageBuilder;
        this.toolLoader = toolLoader;
        this.dependencyInstaller = dependencyInstaller;
        this.registryClient = registryClient;
        try {
            Files.createDirectories(cacheStore.getRoot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create cache directory " + cacheStore.getRoot(), e);
        }
        log.info("Initialized ToolManager with cache {} and local tools directory {}", cacheStore.getRoot(), localToolsDir);
    }

    /** Packages a tool folder into a transportable payload. */
    public ToolPayload packageTool(Path folder) {
        return packageBuilder.build(folder);
    }

    /** Uploads a payload to the registry. */
    public void uploadTool(ToolPayload payload) {
        registryClient.upload(payload);
    }

    /**
     * Makes the tool available in the cache. With a null version the newest cached version is used;
     * if none is cached the registry serves its latest. A cache hit returns without a network call.
     * After a download the package's dependencies are installed when not already satisfied.
     *
     * @return coordinates with the concrete cached version
     * @throws CorruptPackageException if neither the request nor the served package names a version
     */
    public ToolCoordinates downloadTool(String author, String name, String version) {
        String resolved = cacheStore.resolveVersion(author, name, version);
        if (resolved != null && cacheStore.isCached(author, name, resolved)) {
            log.info("Using cached version of tool {}/{} (v{})", author, name, resolved);
            return new ToolCoordinates(author, name, resolved);
        }
        ToolPayload payload = registryClient.download(author, name, resolved);
        String actualVersion = payload.getVersion() != null ? payload.getVersion() : resolved;
        if (actualVersion == null) {
            throw new CorruptPackageException("Registry served " + author + "/" + name + " without a version");
        }
        ToolPackage pkg = PackageCodec.fromPayload(payload.withVersion(actualVersion));
        PackageCodec.save(pkg, cacheStore.cachePath(author, name, actualVersion));
        log.info("Tool {}/{} (v{}) downloaded and cached successfully.", author, name, actualVersion);
        if (!dependencyInstaller.isSatisfied(pkg)) {
            dependencyInstaller.install(pkg);
        }
        return new ToolCoordinates(author, name, actualVersion);
    }

    /**
     * Loads a tool. With {@code local} the tool is read from {@code <localToolsDir>/<name>} and
     * author/version are ignored; otherwise it is loaded from the cache, downloading it first on a miss.
     */
    public LoadedTool loadTool(String author, String name, String version, boolean local) {
        try {
            if (local) {
                synchronized (LOAD_LOCK) {
                    return toolLoader.loadFromLocalDir(localToolsDir, name);
                }
            }
            String resolved = cacheStore.resolveVersion(author, name, version);
            if (resolved == null || !cacheStore.isCached(author, name, resolved)) {
                log.info("Tool {}/{} (v{}) not found in cache. Downloading...", author, name, resolved);
                resolved = downloadTool(author, name, resolved).getVersion();
            }
            ToolPackage pkg = PackageCodec.load(cacheStore.cachePath(author, name, resolved));
            synchronized (LOAD_LOCK) {
                return toolLoader.loadFromPackage(pkg);
            }
        } catch (ToolpackException e) {
            log.error("Error loading tool {}/{} (v{}): {}", author, name, version, e.getMessage());
            throw e;
        }
    }

    /** Loads {@code <localToolsDir>/<name>}. */
    public LoadedTool loadLocalTool(String name) {
        return loadTool(null, name, null, true);
    }

    /** Reads a local tool's {@code config.json} without loading its code. */
    public Map<String, Object> loadLocalConfig(String name) {
        try {
            return toolLoader.readLocalConfig(localToolsDir, name);
        } catch (ToolpackException e) {
            log.error("Error loading local tool {}: {}", name, e.getMessage());
            throw e;
        }
    }

    /** Tools published in the registry. */
    public List<ToolListing> listAvailableTools() {
        return registryClient.list();
    }

    /** Whether the registry has a newer version than {@code currentVersion}. */
    public boolean checkToolUpdates(String author, String name, String currentVersion) {
        return registryClient.checkUpdates(author, name, currentVersion);
    }

    public CacheStore getCacheStore() {
        return cacheStore;
    }

    public Path getLocalToolsDir() {
        return localToolsDir;
    }
}
