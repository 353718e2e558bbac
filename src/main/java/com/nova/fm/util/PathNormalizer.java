package com.nova.fm.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Canonical forms of paths used as lookup keys.
 */
public final class PathNormalizer {

    private static final boolean CASE_INSENSITIVE =
            System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

    private PathNormalizer() {
    }

    /** Absolute path with {@code .} and {@code ..} resolved. */
    public static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * String key for {@code path}: normalized, OS-native separators, lower-cased
     * where the file system ignores case.
     */
    public static String key(Path path) {
        String key = normalize(path).toString();
        return CASE_INSENSITIVE ? key.toLowerCase(Locale.ROOT) : key;
    }
}
