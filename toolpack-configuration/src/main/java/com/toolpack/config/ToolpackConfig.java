package com.toolpack.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Configuration loaded from environment variables for the tool manager.
 * <p>
 * Registry: TOOLPACK_REGISTRY_URL, TOOLPACK_HTTP_TIMEOUT_SECONDS.
 * Cache: TOOLPACK_CACHE_DIR, TOOLPACK_PACKAGE_EXTENSION. Local tools: TOOLPACK_LOCAL_TOOLS_DIR.
 * Dependencies: TOOLPACK_PYTHON, TOOLPACK_REQUIREMENTS_FILE.
 * Loading: TOOLPACK_HOST_API_PACKAGES (comma-separated package prefixes shared with tools).
 */
public final class ToolpackConfig {

    private static final String ENV_REGISTRY_URL = "TOOLPACK_REGISTRY_URL";
    private static final String ENV_HTTP_TIMEOUT_SECONDS = "TOOLPACK_HTTP_TIMEOUT_SECONDS";
    private static final String ENV_CACHE_DIR = "TOOLPACK_CACHE_DIR";
    private static final String ENV_PACKAGE_EXTENSION = "TOOLPACK_PACKAGE_EXTENSION";
    private static final String ENV_LOCAL_TOOLS_DIR = "TOOLPACK_LOCAL_TOOLS_DIR";
    private static final String ENV_PYTHON = "TOOLPACK_PYTHON";
    private static final String ENV_REQUIREMENTS_FILE = "TOOLPACK_REQUIREMENTS_FILE";
    private static final String ENV_HOST_API_PACKAGES = "TOOLPACK_HOST_API_PACKAGES";
    private static final String ENV_XDG_CACHE_HOME = "XDG_CACHE_HOME";

    private static final String DEFAULT_REGISTRY_URL = "http://localhost:8000";
    private static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 60;
    private static final String CACHE_APP_DIR = "toolpack_tools";
    private static final String DEFAULT_PACKAGE_EXTENSION = "tool";
    private static final String DEFAULT_LOCAL_TOOLS_DIR = "tools";
    private static final String DEFAULT_PYTHON = "python3";
    private static final String DEFAULT_REQUIREMENTS_FILE = "requirements.txt";

    private final String registryUrl;
    private final int httpTimeoutSeconds;
    private final Path cacheDir;
    private final String packageExtension;
    private final Path localToolsDir;
    private final String python;
    private final String requirementsFile;
    private final List<String> hostApiPackages;

    private ToolpackConfig(Builder b) {
        this.registryUrl = stripTrailingSlash(b.registryUrl);
        this.httpTimeoutSeconds = b.httpTimeoutSeconds;
        this.cacheDir = b.cacheDir;
        this.packageExtension = b.packageExtension;
        this.localToolsDir = b.localToolsDir;
        this.python = b.python;
        this.requirementsFile = b.requirementsFile;
        this.hostApiPackages = List.copyOf(b.hostApiPackages);
    }

    /** Registry base URL without trailing slash (e.g. http://localhost:8000). */
    public String getRegistryUrl() {
        return registryUrl;
    }

    public int getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    /** Root of the package cache: {@code <cacheDir>/<author>/<name>/<version>.<ext>}. */
    public Path getCacheDir() {
        return cacheDir;
    }

    /** Cache entry file extension without the dot. */
    public String getPackageExtension() {
        return packageExtension;
    }

    /** Root of unpackaged local tools: {@code <localToolsDir>/<name>/config.json}. */
    public Path getLocalToolsDir() {
        return localToolsDir;
    }

    /** Python executable used to run {@code -m pip}. */
    public String getPython() {
        return python;
    }

    /** Dependency manifest file name inside a package. */
    public String getRequirementsFile() {
        return requirementsFile;
    }

    /**
     * Package prefixes (e.g. {@code com.example.host.}) that tool class loaders always take from the
     * host, so tools that bundle a copy of the host API still implement the host's types.
     */
    public List<String> getHostApiPackages() {
        return hostApiPackages;
    }

    /**
     * Builds config from the process environment.
     */
    public static ToolpackConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds config from the given environment map; unset or blank values use defaults.
     * Invalid numbers fall back to defaults.
     */
    public static ToolpackConfig fromEnvironment(Map<String, String> env) {
        Builder b = builder();
        String registryUrl = trimToNull(env.get(ENV_REGISTRY_URL));
        if (registryUrl != null) b.registryUrl(registryUrl);
        b.httpTimeoutSeconds(parsePositiveInt(env.get(ENV_HTTP_TIMEOUT_SECONDS), DEFAULT_HTTP_TIMEOUT_SECONDS));
        String cacheDir = trimToNull(env.get(ENV_CACHE_DIR));
        b.cacheDir(cacheDir != null ? Path.of(cacheDir) : defaultCacheDir(env));
        String ext = trimToNull(env.get(ENV_PACKAGE_EXTENSION));
        if (ext != null) b.packageExtension(ext.startsWith(".") ? ext.substring(1) : ext);
        String localTools = trimToNull(env.get(ENV_LOCAL_TOOLS_DIR));
        if (localTools != null) b.localToolsDir(Path.of(localTools));
        String python = trimToNull(env.get(ENV_PYTHON));
        if (python != null) b.python(python);
        String requirements = trimToNull(env.get(ENV_REQUIREMENTS_FILE));
        if (requirements != null) b.requirementsFile(requirements);
        b.hostApiPackages(parsePackagePrefixes(env.get(ENV_HOST_API_PACKAGES)));
        return b.build();
    }

    /** Per-user cache directory: {@code $XDG_CACHE_HOME/toolpack_tools}, else {@code ~/.cache/toolpack_tools}. */
    static Path defaultCacheDir(Map<String, String> env) {
        String xdg = trimToNull(env.get(ENV_XDG_CACHE_HOME));
        Path base = xdg != null ? Path.of(xdg) : Path.of(System.getProperty("user.home"), ".cache");
        return base.resolve(CACHE_APP_DIR);
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        String v = trimToNull(value);
        if (v == null) return defaultValue;
        try {
            int n = Integer.parseInt(v);
            return n > 0 ? n : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /** Comma-separated prefixes, each normalized to end with a dot. */
    static List<String> parsePackagePrefixes(String value) {
        List<String> prefixes = new ArrayList<>();
        String v = trimToNull(value);
        if (v == null) return prefixes;
        for (String part : v.split(",")) {
            String prefix = part.trim();
            if (prefix.isEmpty()) continue;
            prefixes.add(prefix.endsWith(".") ? prefix : prefix + ".");
        }
        return prefixes;
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) return null;
        return value.trim();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return null;
        String u = url;
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String registryUrl = DEFAULT_REGISTRY_URL;
        private int httpTimeoutSeconds = DEFAULT_HTTP_TIMEOUT_SECONDS;
        private Path cacheDir = defaultCacheDir(Map.of());
        private String packageExtension = DEFAULT_PACKAGE_EXTENSION;
        private Path localToolsDir = Path.of(DEFAULT_LOCAL_TOOLS_DIR);
        private String python = DEFAULT_PYTHON;
        private String requirementsFile = DEFAULT_REQUIREMENTS_FILE;
        private List<String> hostApiPackages = List.of();

        public Builder registryUrl(String registryUrl) {
            this.registryUrl = registryUrl;
            return this;
        }

        public Builder httpTimeoutSeconds(int httpTimeoutSeconds) {
            this.httpTimeoutSeconds = httpTimeoutSeconds;
            return this;
        }

        public Builder cacheDir(Path cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder packageExtension(String packageExtension) {
            this.packageExtension = packageExtension;
            return this;
        }

        public Builder localToolsDir(Path localToolsDir) {
            this.localToolsDir = localToolsDir;
            return this;
        }

        public Builder python(String python) {
            this.python = python;
            return this;
        }

        public Builder requirementsFile(String requirementsFile) {
            this.requirementsFile = requirementsFile;
            return this;
        }

        public Builder hostApiPackages(Collection<String> hostApiPackages) {
            this.hostApiPackages = hostApiPackages != null ? List.copyOf(hostApiPackages) : List.of();
            return this;
        }

        public ToolpackConfig build() {
            return new ToolpackConfig(this);
        }
    }
}
