package com.toolpack.cache;

import com.toolpack.error.VersionFormatException;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Orders dot-separated integer versions component by component ({@code 1.9.0 < 1.10.0}).
 * A shorter version that is a prefix of a longer one sorts first ({@code 1.0 < 1.0.0}).
 */
final class VersionComparator implements Comparator<String> {

    static final VersionComparator INSTANCE = new VersionComparator();

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private VersionComparator() {
    }

    @Override
    public int compare(String a, String b) {
        BigInteger[] left = parse(a);
        BigInteger[] right = parse(b);
        int n = Math.min(left.length, right.length);
        for (int i = 0; i < n; i++) {
            int c = left[i].compareTo(right[i]);
            if (c != 0) return c;
        }
        return Integer.compare(left.length, right.length);
    }

    /**
     * Components may have any number of digits.
     *
     * @throws VersionFormatException if any component is not a non-negative integer
     */
    static BigInteger[] parse(String version) {
        if (version == null) {
            throw new VersionFormatException(null, null);
        }
        String[] parts = version.split("\\.", -1);
        BigInteger[] out = new BigInteger[parts.length];
        for (int i = 0; i < parts.length; i++) {
            if (!DIGITS.matcher(parts[i]).matches()) {
                throw new VersionFormatException(version, null);
            }
            out[i] = new BigInteger(parts[i]);
        }
        return out;
    }
}
