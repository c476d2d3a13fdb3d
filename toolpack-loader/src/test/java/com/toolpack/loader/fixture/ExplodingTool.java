package com.toolpack.loader.fixture;

/** Tool whose static initializer fails, as a broken entry module would. */
public class ExplodingTool {

    static {
        if (Boolean.parseBoolean("true")) {
            throw new IllegalStateException("tool failed to initialize");
        }
    }
}
