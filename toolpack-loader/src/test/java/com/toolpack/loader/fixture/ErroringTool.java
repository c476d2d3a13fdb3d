package com.toolpack.loader.fixture;

/** Tool whose static initializer throws an {@link Error}, which the JVM does not wrap. */
public class ErroringTool {

    static {
        if (Boolean.parseBoolean("true")) {
            throw new AssertionError("tool asserted during initialization");
        }
    }
}
