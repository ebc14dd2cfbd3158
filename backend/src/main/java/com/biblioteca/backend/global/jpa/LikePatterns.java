package com.biblioteca.backend.global.jpa;

import java.util.Locale;

/**
 * Builds lower-cased {@code like} patterns for JPQL queries declaring {@code escape '\'}.
 */
public final class LikePatterns {

    private LikePatterns() {
    }

    public static String containing(String raw) {
        String escaped = raw.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
