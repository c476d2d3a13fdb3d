package com.toolpack.loader;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchScopeGuardTest {

    private final ModuleSearchScope scope = ModuleSearchScope.getInstance();
    private final ModuleRegistry registry = ModuleRegistry.getInstance();

    private static final Path WORK = Path.of("/work/guard-test");
    private static final Path TOOL_A = Path.of("/tools/a");
    private static final Path TOOL_B = Path.of("/tools/b");

    @Test
    void enter_pushesWorkingDirThenToolDirAndCloseRestores() {
        List<Path> before = scope.snapshot();

        try (SearchScopeGuard guard = SearchScopeGuard.enter(scope, registry, TOOL_A, WORK)) {
            List<Path> during = scope.snapshot();
            assertEquals(TOOL_A, during.get(0));
            assertEquals(WORK, during.get(1));
            assertEquals(before.size() + 2, during.size());
            assertEquals(List.of(TOOL_A, WORK), guard.pushedLocations());
        }

        assertEquals(before, scope.snapshot());
    }

    @Test
    void enter_skipsWorkingDirAlreadyInScope() {
        List<Path> before = scope.snapshot();

        try (SearchScopeGuard outer = SearchScopeGuard.enter(scope, registry, TOOL_A, WORK)) {
            List<Path> afterOuter = scope.snapshot();
            try (SearchScopeGuard inner = SearchScopeGuard.enter(scope, registry, TOOL_B, WORK)) {
                assertEquals(List.of(TOOL_B), inner.pushedLocations());
                assertEquals(TOOL_B, scope.snapshot().get(0));
            }
            assertEquals(afterOuter, scope.snapshot());
        }

        assertEquals(before, scope.snapshot());
    }

    @Test
    void registeredModulesLiveOnlyWhileGuardIsOpen() {
        ClassLoader loader = getClass().getClassLoader();
        SearchScopeGuard guard = SearchScopeGuard.enter(scope, registry, TOOL_A, null);
        guard.registerModule("toolpack.module.guard-test", loader);

        assertSame(loader, registry.lookup("toolpack.module.guard-test").orElseThrow());
        assertThrows(IllegalStateException.class, () -> guard.registerModule("toolpack.module.guard-test", loader));

        guard.close();
        guard.close();

        assertFalse(registry.contains("toolpack.module.guard-test"));
        assertFalse(scope.contains(TOOL_A));
    }

    @Test
    void restoresScopeWhenBodyThrows() {
        List<Path> before = scope.snapshot();

        assertThrows(IllegalStateException.class, () -> {
            try (SearchScopeGuard guard = SearchScopeGuard.enter(scope, registry, TOOL_A, WORK)) {
                assertTrue(scope.contains(TOOL_A));
                throw new IllegalStateException("load failed");
            }
        });

        assertEquals(before, scope.snapshot());
    }
}
