package com.toolpack.dependencies;

import com.toolpack.error.DependencyInstallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link PackageInstaller} running pip through the configured Python executable:
 * {@code <python> -m pip list --format=freeze} and {@code <python> -m pip install -r <manifest>}.
 * Install output goes to the parent process's stdout/stderr.
 */
public final class PipPackageInstaller implements PackageInstaller {

    private static final Logger log = LoggerFactory.getLogger(PipPackageInstaller.class);

    private final String python;

    /**
     * @param python Python executable (e.g. "python3" or an absolute venv path)
     */
    public PipPackageInstaller(String python) {
        this.python = python != null && !python.isBlank() ? python.trim() : "python3";
    }

    @Override
    public Set<String> listInstalled() {
        List<String> command = List.of(python, "-m", "pip", "list", "--format=freeze");
        Process process = start(new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD), command);
        String stdout;
        try (InputStream in = process.getInputStream()) {
            stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            process.destroy();
            throw new DependencyInstallException("Failed to read output of " + String.join(" ", command), e);
        }
        int exit = waitFor(process, command);
        if (exit != 0) {
            throw new DependencyInstallException(String.join(" ", command) + " exited with code " + exit, exit);
        }
        return parseFreeze(stdout);
    }

    @Override
    public int install(Path manifest) {
        List<String> command = List.of(python, "-m", "pip", "install", "-r", manifest.toString());
        log.info("Running {}", String.join(" ", command));
        Process process = start(new ProcessBuilder(command).inheritIO(), command);
        return waitFor(process, command);
    }

    /** Package names from {@code name==version} lines. */
    static Set<String> parseFreeze(String output) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : output.split("\\R")) {
            String name = line.split("==", 2)[0].trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    private static Process start(ProcessBuilder builder, List<String> command) {
        try {
            return builder.start();
        } catch (IOException e) {
            throw new DependencyInstallException("Failed to start " + String.join(" ", command), e);
        }
    }

    private static int waitFor(Process process, List<String> command) {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new DependencyInstallException("Interrupted while waiting for " + String.join(" ", command), e);
        }
    }
}
