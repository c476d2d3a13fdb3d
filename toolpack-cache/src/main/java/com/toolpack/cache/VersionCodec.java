package com.toolpack.cache;

/**
 * Reversible mapping between a version string and a filesystem-safe path segment:
 * {@code 1.2.0 ↔ 1-2-0}. A null version encodes to {@value #LATEST}.
 * Versions that already contain {@code -} do not survive the round trip.
 */
public final class VersionCodec {

    public static final String LATEST = "latest";

    private VersionCodec() {
    }

    public static String encode(String version) {
        if (version == null) {
            return LATEST;
        }
        return version.replace('.', '-');
    }

    public static String decode(String pathSegment) {
        return pathSegment.replace('-', '.');
    }
}
