package com.toolpack.registry;

import com.toolpack.model.ToolListing;
import com.toolpack.model.ToolPayload;

import java.util.List;

/**
 * Client of the tool registry service. Calls are synchronous and block the calling thread.
 * All methods throw {@link RegistryException} on failure.
 */
public interface RegistryClient {

    /** {@code POST /tools/upload}. */
    void upload(ToolPayload payload);

    /**
     * {@code GET /tools/download?author&name&version?}.
     *
     * @param version null for the registry's latest version
     * @return payload whose {@code version} is the concrete version served
     */
    ToolPayload download(String author, String name, String version);

    /** {@code GET /tools/list}. */
    List<ToolListing> list();

    /** {@code GET /tools/check_updates?author&name&current_version}. */
    boolean checkUpdates(String author, String name, String currentVersion);
}
