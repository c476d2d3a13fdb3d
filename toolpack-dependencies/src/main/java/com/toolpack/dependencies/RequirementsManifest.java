package com.toolpack.dependencies;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parser for {@code requirements.txt}-style manifests: one {@code name[==version]} per line,
 * blank lines and {@code #} comment lines ignored. Names are lower-cased; versions dropped.
 */
final class RequirementsManifest {

    private RequirementsManifest() {
    }

    static List<String> parseNames(byte[] manifest) {
        List<String> names = new ArrayList<>();
        String text = new String(manifest, StandardCharsets.UTF_8);
        for (String line : text.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            names.add(trimmed.split("==", 2)[0].strip().toLowerCase(Locale.ROOT));
        }
        return names;
    }
}
