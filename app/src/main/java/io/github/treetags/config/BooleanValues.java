package io.github.treetags.config;

import java.util.Locale;
import java.util.Optional;

/** Boolean option values in the spellings ctags front ends pass around. */
public final class BooleanValues {
    private BooleanValues() {}

    public static Optional<Boolean> parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "yes", "on", "true", "1" -> Optional.of(Boolean.TRUE);
            case "no", "off", "false", "0" -> Optional.of(Boolean.FALSE);
            default -> Optional.empty();
        };
    }
}
