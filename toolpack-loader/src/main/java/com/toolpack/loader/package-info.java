/**
 * Dynamic loading of tool implementation classes.
 * <ul>
 *   <li>{@link com.toolpack.loader.ToolLoader} – local directory and package loads</li>
 *   <li>{@link com.toolpack.loader.ModuleSearchScope} – process-wide search locations</li>
 *   <li>{@link com.toolpack.loader.ModuleRegistry} – process-wide registry of modules being loaded</li>
 *   <li>{@link com.toolpack.loader.SearchScopeGuard} – push on entry, pop and unregister on every exit</li>
 *   <li>{@link com.toolpack.loader.ToolClassLoader} – child-first, per-load namespace</li>
 *   <li>{@link com.toolpack.loader.ModuleLoader} – resolves the implementation class by name</li>
 * </ul>
 */
package com.toolpack.loader;
