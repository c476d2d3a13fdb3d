/**
 * Error taxonomy shared by all toolpack modules.
 * <ul>
 *   <li>{@link com.toolpack.error.ToolNotFoundException} – missing local tool, config or cache entry</li>
 *   <li>{@link com.toolpack.error.ToolConfigException} – malformed or incomplete {@code config.json}</li>
 *   <li>{@link com.toolpack.error.CorruptPackageException} – unreadable cache entry or payload</li>
 *   <li>{@link com.toolpack.error.VersionFormatException} – non-numeric version component</li>
 *   <li>{@link com.toolpack.error.ToolLoadException} – class resolution or initialization failure</li>
 *   <li>{@link com.toolpack.error.DependencyInstallException} – installer failure; logged, never propagated</li>
 * </ul>
 */
package com.toolpack.error;
