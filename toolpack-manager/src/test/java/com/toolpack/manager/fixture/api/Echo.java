package com.toolpack.manager.fixture.api;

/** Host-side API implemented by the echo fixture tool. */
public interface Echo {

    String run(String input);
}
