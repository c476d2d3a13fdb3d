package com.toolpack.loader;

import com.toolpack.error.ToolConfigException;
import com.toolpack.error.ToolLoadException;
import com.toolpack.error.ToolNotFoundException;
import com.toolpack.loader.fixture.ErroringTool;
import com.toolpack.loader.fixture.ExplodingTool;
import com.toolpack.loader.fixture.GreetingTool;
import com.toolpack.loader.fixture.api.Greeter;
import com.toolpack.model.ToolMetadata;
import com.toolpack.model.ToolPackage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolLoaderTest {

    private static final String HOST_API = "com.toolpack.loader.fixture.api.";

    @TempDir
    Path tempDir;

    private Path toolsRoot;
    private Path scratchRoot;
    private ToolLoader loader;
    private List<Path> scopeBefore;
    private int registrySizeBefore;

    @BeforeEach
    void setUp() {
        toolsRoot = tempDir.resolve("tools");
        scratchRoot = tempDir.resolve("scratch");
        loader = new ToolLoader(new ReflectiveModuleLoader(), ToolLoaderTest.class.getClassLoader(),
                List.of(HOST_API), scratchRoot);
        scopeBefore = ModuleSearchScope.getInstance().snapshot();
        registrySizeBefore = ModuleRegistry.getInstance().size();
    }

    @AfterEach
    void scopeAndRegistryAreRestored() {
        assertEquals(scopeBefore, ModuleSearchScope.getInstance().snapshot());
        assertEquals(registrySizeBefore, ModuleRegistry.getInstance().size());
    }

    private Path writeLocalTool(String name, String configJson, Class<?>... classes) throws IOException {
        Path toolDir = Files.createDirectories(toolsRoot.resolve(name));
        Files.writeString(toolDir.resolve("config.json"), configJson);
        if (classes.length > 0) {
            ToolJars.write(toolDir.resolve("tool.jar"), classes);
        }
        return toolDir;
    }

    private static String config(String module) {
        return "{\"name\":\"greeter\",\"meta\":{\"author\":\"alice\",\"version\":\"1.0.0\"},"
                + "\"build\":{\"entry\":\"tool.jar\",\"module\":\"" + module + "\"},"
                + "\"parameters\":{\"who\":\"string\"}}";
    }

    @Test
    void loadFromLocalDir_loadsClassInItsOwnNamespace() throws Exception {
        writeLocalTool("greeter", config(GreetingTool.class.getName()), GreetingTool.class);

        try (LoadedTool tool = loader.loadFromLocalDir(toolsRoot, "greeter")) {
            Class<?> toolClass = tool.getToolClass();

            assertEquals(GreetingTool.class.getName(), toolClass.getName());
            assertNotSame(GreetingTool.class, toolClass);
            assertInstanceOf(ToolClassLoader.class, toolClass.getClassLoader());
            Greeter greeter = tool.getToolClass(Greeter.class).getDeclaredConstructor().newInstance();
            assertEquals("Hello, Bob", greeter.greet("Bob"));
            assertEquals("greeter", tool.getConfig().get("name"));
            assertEquals(Map.of("who", "string"), tool.getConfig().get("parameters"));
            assertNull(tool.getScratchDir());
        }
    }

    @Test
    void loadFromLocalDir_twoLoadsAreIndependent() throws Exception {
        writeLocalTool("greeter", config(GreetingTool.class.getName()), GreetingTool.class);

        try (LoadedTool first = loader.loadFromLocalDir(toolsRoot, "greeter");
             LoadedTool second = loader.loadFromLocalDir(toolsRoot, "greeter")) {
            assertNotSame(first.getToolClass(), second.getToolClass());
        }
    }

    @Test
    void loadFromLocalDir_exposesToolDirectoryAndRegistersModuleDuringLoad() throws IOException {
        Path toolDir = writeLocalTool("greeter", config(GreetingTool.class.getName()), GreetingTool.class);
        List<List<Path>> scopes = new ArrayList<>();
        List<Set<String>> modules = new ArrayList<>();
        ModuleLoader recording = (module, symbol) -> {
            scopes.add(ModuleSearchScope.getInstance().snapshot());
            modules.add(ModuleRegistry.getInstance().moduleNames());
            return new ReflectiveModuleLoader().loadSymbol(module, symbol);
        };
        ToolLoader recordingLoader = new ToolLoader(recording, ToolLoaderTest.class.getClassLoader(), List.of(), scratchRoot);

        recordingLoader.loadFromLocalDir(toolsRoot, "greeter").close();

        assertEquals(toolDir.toAbsolutePath().normalize(), scopes.get(0).get(0));
        assertTrue(scopes.get(0).contains(Path.of("").toAbsolutePath().normalize()));
        assertEquals(1, modules.get(0).size() - registrySizeBefore);
        assertTrue(modules.get(0).stream().anyMatch(name -> name.startsWith("toolpack.module.greeter.")));
    }

    @Test
    void loadFromLocalDir_missingSymbolRestoresScope() throws IOException {
        writeLocalTool("greeter", config("com.toolpack.loader.fixture.DoesNotExist"), GreetingTool.class);

        ToolLoadException e = assertThrows(ToolLoadException.class, () -> loader.loadFromLocalDir(toolsRoot, "greeter"));

        assertTrue(e.getMessage().contains("symbol not found"), e.getMessage());
    }

    @Test
    void loadFromLocalDir_failingInitializerIsLoadError() throws IOException {
        writeLocalTool("exploding", config(ExplodingTool.class.getName()), ExplodingTool.class);

        ToolLoadException e = assertThrows(ToolLoadException.class, () -> loader.loadFromLocalDir(toolsRoot, "exploding"));

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void loadFromLocalDir_errorFromInitializerIsLoadError() throws IOException {
        writeLocalTool("erroring", config(ErroringTool.class.getName()), ErroringTool.class);

        ToolLoadException e = assertThrows(ToolLoadException.class, () -> loader.loadFromLocalDir(toolsRoot, "erroring"));

        assertInstanceOf(AssertionError.class, e.getCause());
        assertTrue(e.getMessage().contains(ErroringTool.class.getName()), e.getMessage());
    }

    @Test
    void loadFromLocalDir_missingDirectoryOrConfigIsNotFound() throws IOException {
        assertThrows(ToolNotFoundException.class, () -> loader.loadFromLocalDir(toolsRoot, "ghost"));

        Files.createDirectories(toolsRoot.resolve("bare"));
        ToolNotFoundException e = assertThrows(ToolNotFoundException.class, () -> loader.loadFromLocalDir(toolsRoot, "bare"));
        assertTrue(e.getMessage().contains("Config file not found"), e.getMessage());
    }

    @Test
    void loadFromLocalDir_missingEntryIsNotFound() throws IOException {
        writeLocalTool("greeter", config(GreetingTool.class.getName()));

        assertThrows(ToolNotFoundException.class, () -> loader.loadFromLocalDir(toolsRoot, "greeter"));
    }

    @Test
    void loadFromLocalDir_incompleteOrInvalidConfigIsConfigError() throws IOException {
        writeLocalTool("nomodule", "{\"name\":\"nomodule\",\"build\":{\"entry\":\"tool.jar\"}}", GreetingTool.class);
        writeLocalTool("broken", "{ not json", GreetingTool.class);
        writeLocalTool("escaping", "{\"build\":{\"entry\":\"../../outside.jar\",\"module\":\"X\"}}", GreetingTool.class);

        assertThrows(ToolConfigException.class, () -> loader.loadFromLocalDir(toolsRoot, "nomodule"));
        assertThrows(ToolConfigException.class, () -> loader.loadFromLocalDir(toolsRoot, "broken"));
        assertThrows(ToolConfigException.class, () -> loader.loadFromLocalDir(toolsRoot, "escaping"));
    }

    @Test
    void readLocalConfig_returnsParsedConfigWithoutLoadingCode() throws IOException {
        writeLocalTool("greeter", config("com.toolpack.loader.fixture.DoesNotExist"));

        Map<String, Object> config = loader.readLocalConfig(toolsRoot, "greeter");

        assertEquals("greeter", config.get("name"));
        assertEquals(Map.of("author", "alice", "version", "1.0.0"), config.get("meta"));
    }

    private ToolPackage greetingPackage(String module, boolean withConfig) throws IOException {
        Path jar = ToolJars.write(tempDir.resolve("build/greeter.jar"), GreetingTool.class);
        Map<String, byte[]> files = new LinkedHashMap<>();
        if (withConfig) {
            files.put("config.json", config(module).getBytes(StandardCharsets.UTF_8));
        }
        files.put("greeter.jar", ToolJars.read(jar));
        return new ToolPackage(new ToolMetadata("alice", "greeter", "1.0.0", null, "greeter.jar", module), files);
    }

    @Test
    void loadFromPackage_materializesFilesAndDeletesThemOnClose() throws Exception {
        LoadedTool tool = loader.loadFromPackage(greetingPackage(GreetingTool.class.getName(), true));
        Path scratch = tool.getScratchDir();

        assertTrue(Files.isRegularFile(scratch.resolve("greeter.jar")));
        assertTrue(scratch.startsWith(scratchRoot));
        Greeter greeter = tool.getToolClass(Greeter.class).getDeclaredConstructor().newInstance();
        assertEquals("Hello, Ann", greeter.greet("Ann"));
        assertEquals(Map.of("who", "string"), tool.getConfig().get("parameters"));

        tool.close();

        assertFalse(Files.exists(scratch));
    }

    @Test
    void loadFromPackage_withoutConfigUsesMetadata() throws IOException {
        try (LoadedTool tool = loader.loadFromPackage(greetingPackage(GreetingTool.class.getName(), false))) {
            assertEquals("greeter", tool.getConfig().get("name"));
            assertEquals(Map.of("entry", "greeter.jar", "module", GreetingTool.class.getName()),
                    tool.getConfig().get("build"));
        }
    }

    @Test
    void loadFromPackage_failureRemovesScratchDirectory() throws IOException {
        ToolPackage pkg = greetingPackage("com.toolpack.loader.fixture.DoesNotExist", true);

        assertThrows(ToolLoadException.class, () -> loader.loadFromPackage(pkg));

        try (Stream<Path> left = Files.list(scratchRoot)) {
            assertEquals(0, left.count());
        }
    }

    @Test
    void sharedHostApiComesFromParent() throws IOException {
        writeLocalTool("greeter", config(GreetingTool.class.getName()), GreetingTool.class);

        try (LoadedTool tool = loader.loadFromLocalDir(toolsRoot, "greeter")) {
            assertSame(Greeter.class, tool.getToolClass().getInterfaces()[0]);
        }
    }
}
