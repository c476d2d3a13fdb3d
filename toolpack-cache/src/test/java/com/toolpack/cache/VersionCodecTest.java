package com.toolpack.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VersionCodecTest {

    @Test
    void encode_replacesDotsWithDashes() {
        assertEquals("1-2-0", VersionCodec.encode("1.2.0"));
        assertEquals("10", VersionCodec.encode("10"));
    }

    @Test
    void encode_nullIsLatest() {
        assertEquals("latest", VersionCodec.encode(null));
    }

    @Test
    void decode_reversesEncode() {
        for (String version : new String[] {"1.2.0", "0.0.1", "2024.10.17", "3"}) {
            assertEquals(version, VersionCodec.decode(VersionCodec.encode(version)));
        }
    }
}
