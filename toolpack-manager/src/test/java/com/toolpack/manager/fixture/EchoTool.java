package com.toolpack.manager.fixture;

import com.toolpack.manager.fixture.api.Echo;

/** Packaged into a JAR by the manager tests. */
public class EchoTool implements Echo {

    @Override
    public String run(String input) {
        return "echo: " + input;
    }
}
