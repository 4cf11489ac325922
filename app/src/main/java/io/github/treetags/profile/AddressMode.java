package io.github.treetags.profile;

import java.util.Locale;
import java.util.Optional;

public enum AddressMode {
    PATTERN,
    LINE;

    /** Accepts the ex command names {@code pattern} and {@code number} as well as {@code line}. */
    public static Optional<AddressMode> parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "pattern" -> Optional.of(PATTERN);
            case "number", "line" -> Optional.of(LINE);
            default -> Optional.empty();
        };
    }
}
