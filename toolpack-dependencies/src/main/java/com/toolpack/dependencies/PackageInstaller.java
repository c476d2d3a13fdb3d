package com.toolpack.dependencies;

import com.toolpack.error.DependencyInstallException;

import java.nio.file.Path;
import java.util.Set;

/**
 * External package installer invoked as a subprocess.
 */
public interface PackageInstaller {

    /**
     * Names of the currently installed packages, as reported by the installer (versions stripped).
     *
     * @throws DependencyInstallException if the installer cannot be run or exits non-zero
     */
    Set<String> listInstalled();

    /**
     * Installs every dependency declared in the manifest file. Blocks until the installer exits.
     *
     * @return installer exit code; 0 means success
     * @throws DependencyInstallException if the installer cannot be started or is interrupted
     */
    int install(Path manifest);
}
