package com.toolpack.dependencies;

import com.toolpack.error.DependencyInstallException;
import com.toolpack.model.ToolPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a package's dependency manifest against installed packages and installs missing ones.
 * <p>
 * <b>Operational:</b> installation is best-effort. Installer failures are logged and the call
 * returns normally; the tool may still be usable or the caller may retry.
 */
public final class DependencyInstaller {

    private static final Logger log = LoggerFactory.getLogger(DependencyInstaller.class);

    public static final String DEFAULT_MANIFEST = "requirements.txt";

    private final PackageInstaller installer;
    private final Path scratchDir;
    private final String manifestName;

    /**
     * @param installer    external installer
     * @param scratchDir   directory for the temporary manifest copy (e.g. the cache root)
     * @param manifestName manifest path inside the package (e.g. "requirements.txt")
     */
    public DependencyInstaller(PackageInstaller installer, Path scratchDir, String manifestName) {
        this.installer = installer;
        this.scratchDir = scratchDir;
        this.manifestName = manifestName != null ? manifestName : DEFAULT_MANIFEST;
    }

    /**
     * True when the package has no manifest, or every declared name (case-insensitive) is installed.
     * Versions are not compared. False when the installed set cannot be queried.
     */
    public boolean isSatisfied(ToolPackage pkg) {
        byte[] manifest = pkg.getFile(manifestName).orElse(null);
        if (manifest == null || manifest.length == 0) {
            return true;
        }
        List<String> required = RequirementsManifest.parseNames(manifest);
        Set<String> installed;
        try {
            installed = installer.listInstalled().stream()
                    .map(n -> n.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
        } catch (DependencyInstallException e) {
            log.warn("Error checking requirements of {}: {}", pkg.getMetadata(), e.getMessage());
            return false;
        }
        boolean satisfied = installed.containsAll(required);
        if (!satisfied && log.isDebugEnabled()) {
            log.debug("Missing requirements for {}: {}", pkg.getMetadata(),
                    required.stream().filter(r -> !installed.contains(r)).collect(Collectors.toList()));
        }
        return satisfied;
    }

    /**
     * Installs the package's manifest through the external installer. Never throws for installer
     * failures; the temporary manifest copy is removed on every path.
     *
     * @return true if the installer ran and exited with 0; false if there was nothing to install or it failed
     */
    public boolean install(ToolPackage pkg) {
        byte[] manifest = pkg.getFile(manifestName).orElse(null);
        if (manifest == null || manifest.length == 0) {
            log.info("No {} found for {}. Skipping dependency installation.", manifestName, pkg.getMetadata());
            return false;
        }
        Path tempManifest = null;
        try {
            Files.createDirectories(scratchDir);
            tempManifest = Files.createTempFile(scratchDir, "requirements-", ".txt");
            Files.write(tempManifest, manifest);
            int exit = installer.install(tempManifest);
            if (exit != 0) {
                log.error("Error installing requirements for {}: installer exited with code {}", pkg.getMetadata(), exit);
                return false;
            }
            log.info("Requirements of {} installed successfully.", pkg.getMetadata());
            return true;
        } catch (DependencyInstallException e) {
            log.error("Error installing requirements for {}: {}", pkg.getMetadata(), e.getMessage(), e);
            return false;
        } catch (IOException e) {
            log.error("Error writing requirements manifest for {}: {}", pkg.getMetadata(), e.getMessage(), e);
            return false;
        } finally {
            if (tempManifest != null) {
                try {
                    Files.deleteIfExists(tempManifest);
                } catch (IOException e) {
                    log.warn("Failed to delete temporary manifest {}: {}", tempManifest, e.getMessage());
                }
            }
        }
    }
}
