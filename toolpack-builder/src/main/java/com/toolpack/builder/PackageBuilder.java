package com.toolpack.builder;

import com.toolpack.error.ToolConfigException;
import com.toolpack.error.ToolNotFoundException;
import com.toolpack.model.PackageFile;
import com.toolpack.model.ToolConfig;
import com.toolpack.model.ToolJson;
import com.toolpack.model.ToolMetadata;
import com.toolpack.model.ToolPackage;
import com.toolpack.model.ToolPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Packages a tool source folder into a transportable {@link ToolPayload}.
 * <p>
 * Metadata comes from {@code config.json}: {@code author}/{@code version} from {@code meta},
 * {@code entry}/{@code module} from {@code build}, {@code name}/{@code license} from the top level.
 * Missing values use the {@link ToolMetadata} defaults; nothing is required, so draft packages build.
 * Every regular file under the folder (including {@code config.json}) is included, in sorted path order.
 */
public final class PackageBuilder {

    private static final Logger log = LoggerFactory.getLogger(PackageBuilder.class);

    /**
     * @param folder tool source folder
     * @return payload with base64 file contents and paths relative to {@code folder}
     * @throws ToolNotFoundException if the folder does not exist
     * @throws ToolConfigException   if {@code config.json} exists but is not valid JSON
     */
    public ToolPayload build(Path folder) {
        if (!Files.isDirectory(folder)) {
            throw new ToolNotFoundException("Tool folder not found", folder);
        }
        ToolMetadata metadata = readConfig(folder).toMetadata();
        List<PackageFile> files = collectFiles(folder);
        log.info("Packaged tool {} from {} ({} file(s))", metadata, folder, files.size());
        return new ToolPayload(metadata.getAuthor(), metadata.getName(), metadata.getVersion(),
                metadata.getLicense(), files, metadata.getEntry(), metadata.getModule());
    }

    /** Reads {@code config.json}; an absent file yields an empty config. */
    static ToolConfig readConfig(Path folder) {
        Path configPath = folder.resolve(ToolPackage.CONFIG_FILE);
        if (!Files.isRegularFile(configPath)) {
            log.debug("No {} in {}; using defaults", ToolPackage.CONFIG_FILE, folder);
            return ToolConfig.empty();
        }
        try {
            ToolConfig config = ToolJson.fromJson(Files.readAllBytes(configPath), ToolConfig.class);
            return config != null ? config : ToolConfig.empty();
        } catch (IOException | UncheckedIOException e) {
            throw new ToolConfigException("Invalid " + ToolPackage.CONFIG_FILE + " in " + folder, e);
        }
    }

    private static List<PackageFile> collectFiles(Path folder) {
        Base64.Encoder encoder = Base64.getEncoder();
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(folder)) {
            paths = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk tool folder " + folder, e);
        }
        List<PackageFile> files = new ArrayList<>(paths.size());
        for (Path file : paths) {
            String relative = toPackagePath(folder.relativize(file));
            try {
                files.add(new PackageFile(relative, encoder.encodeToString(Files.readAllBytes(file))));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + file, e);
            }
        }
        return files;
    }

    /** Joins path segments with {@code /} regardless of the platform separator. */
    static String toPackagePath(Path relative) {
        StringBuilder sb = new StringBuilder();
        for (Path segment : relative) {
            if (sb.length() > 0) sb.append('/');
            sb.append(segment.toString());
        }
        return sb.toString();
    }
}
