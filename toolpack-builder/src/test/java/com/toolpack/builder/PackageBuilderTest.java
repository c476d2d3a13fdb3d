package com.toolpack.builder;

import com.toolpack.error.ToolConfigException;
import com.toolpack.error.ToolNotFoundException;
import com.toolpack.model.PackageFile;
import com.toolpack.model.ToolPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PackageBuilderTest {

    @TempDir
    Path tempDir;

    private final PackageBuilder builder = new PackageBuilder();

    @Test
    void build_readsMetadataFromConfigAndIncludesEveryFile() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("weather"));
        Files.writeString(folder.resolve("config.json"), """
                {"name": "weather", "license": "MIT",
                 "meta": {"author": "alice", "version": "1.0.0"},
                 "build": {"entry": "main.py", "module": "Tool"}}
                """);
        Files.writeString(folder.resolve("main.py"), "class Tool: pass\n");
        Files.writeString(folder.resolve("requirements.txt"), "requests==2.31.0\n");
        Files.createDirectories(folder.resolve("lib"));
        Files.write(folder.resolve("lib/helper.jar"), new byte[] {0, (byte) 0xff, 7});

        ToolPayload payload = builder.build(folder);

        assertEquals("alice", payload.getAuthor());
        assertEquals("weather", payload.getName());
        assertEquals("1.0.0", payload.getVersion());
        assertEquals("MIT", payload.getLicense());
        assertEquals("main.py", payload.getEntry());
        assertEquals("Tool", payload.getModule());
        assertEquals(List.of("config.json", "lib/helper.jar", "main.py", "requirements.txt"),
                payload.getFiles().stream().map(PackageFile::getPath).collect(Collectors.toList()));
        assertArrayEquals(new byte[] {0, (byte) 0xff, 7},
                Base64.getDecoder().decode(payload.getFiles().get(1).getContent()));
        assertEquals("class Tool: pass\n", new String(
                Base64.getDecoder().decode(payload.getFiles().get(2).getContent()), StandardCharsets.UTF_8));
    }

    @Test
    void build_withoutConfigUsesDefaults() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("draft"));
        Files.writeString(folder.resolve("notes.txt"), "wip");

        ToolPayload payload = builder.build(folder);

        assertNull(payload.getAuthor());
        assertNull(payload.getName());
        assertNull(payload.getVersion());
        assertEquals("Unknown", payload.getLicense());
        assertEquals("tool.jar", payload.getEntry());
        assertEquals("Tool", payload.getModule());
        assertEquals(1, payload.getFiles().size());
    }

    @Test
    void build_missingFolderIsNotFound() {
        assertThrows(ToolNotFoundException.class, () -> builder.build(tempDir.resolve("absent")));
    }

    @Test
    void build_invalidConfigIsConfigError() throws IOException {
        Path folder = Files.createDirectories(tempDir.resolve("broken"));
        Files.writeString(folder.resolve("config.json"), "{ not json");

        assertThrows(ToolConfigException.class, () -> builder.build(folder));
    }

    @Test
    void toPackagePath_usesForwardSlashes() {
        assertEquals("a/b/c.txt", PackageBuilder.toPackagePath(Path.of("a", "b", "c.txt")));
    }
}
