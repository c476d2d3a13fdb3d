/**
 * Tool package data model.
 * <ul>
 *   <li>{@link com.toolpack.model.ToolMetadata} – author, name, version, license, entry, module</li>
 *   <li>{@link com.toolpack.model.ToolPackage} – metadata plus raw file bytes by relative path</li>
 *   <li>{@link com.toolpack.model.ToolPayload} – transport form with base64 file contents</li>
 *   <li>{@link com.toolpack.model.ToolConfig} – typed view of {@code config.json}</li>
 *   <li>{@link com.toolpack.model.ToolJson} – shared Jackson mapping</li>
 * </ul>
 */
package com.toolpack.model;
