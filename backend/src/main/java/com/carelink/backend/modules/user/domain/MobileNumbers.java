package com.carelink.backend.modules.user.domain;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Australian mobile numbers: {@code 04xxxxxxxx} or {@code 614xxxxxxxx}, optionally written with a leading {@code +}.
 */
public final class MobileNumbers {

    private static final Pattern LOCAL = Pattern.compile("^04\\d{8}$");
    private static final Pattern INTERNATIONAL = Pattern.compile("^614\\d{8}$");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-()]");

    private MobileNumbers() {
    }

    /**
     * Strips separators and validates. Returns the digits (with {@code +} kept for the international form).
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String compact = SEPARATORS.matcher(raw.trim()).replaceAll("");
        boolean plus = compact.startsWith("+");
        String digits = plus ? compact.substring(1) : compact;
        if (LOCAL.matcher(digits).matches() && !plus) {
            return Optional.of(digits);
        }
        if (INTERNATIONAL.matcher(digits).matches()) {
            return Optional.of(plus ? "+" + digits : digits);
        }
        return Optional.empty();
    }
}
