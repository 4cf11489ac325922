package io.github.treetags.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Shared parser for the ctags letter-set options ({@code --fields}, {@code --extras}). A value without {@code +} or
 * {@code -} replaces the defaults; otherwise each {@code +x} or {@code -x} edits them. Letters may also be spelled
 * as long names, either in braces ({@code +{line}}) or comma separated ({@code line,scope}).
 */
final class LetterFlags {
    private static final Logger logger = LogManager.getLogger(LetterFlags.class);

    private LetterFlags() {}

    static Set<Character> parse(String option, String value, Set<Character> defaults, Map<String, Character> longNames) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return new LinkedHashSet<>(defaults);
        }
        boolean modifierMode = trimmed.charAt(0) == '+' || trimmed.charAt(0) == '-';
        var result = new LinkedHashSet<Character>(modifierMode ? defaults : Set.of());
        for (var token : tokens(trimmed)) {
            Character letter = resolve(option, token.name(), longNames);
            if (letter == null) {
                continue;
            }
            if (token.remove()) {
                result.remove(letter);
            } else {
                result.add(letter);
            }
        }
        return result;
    }

    private record Token(String name, boolean remove) {}

    private static List<Token> tokens(String value) {
        var tokens = new ArrayList<Token>();
        if (value.indexOf(',') >= 0) {
            for (String part : value.split(",")) {
                String p = part.trim();
                if (p.isEmpty()) continue;
                boolean remove = p.charAt(0) == '-';
                if (p.charAt(0) == '+' || p.charAt(0) == '-') {
                    p = p.substring(1).trim();
                }
                tokens.add(new Token(stripBraces(p), remove));
            }
            return tokens;
        }
        boolean remove = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '+' || c == '-') {
                remove = c == '-';
            } else if (c == '{') {
                int close = value.indexOf('}', i);
                if (close < 0) {
                    close = value.length();
                }
                tokens.add(new Token(value.substring(i + 1, close), remove));
                i = close;
            } else if (!Character.isWhitespace(c)) {
                tokens.add(new Token(String.valueOf(c), remove));
            }
        }
        return tokens;
    }

    private static String stripBraces(String s) {
        if (s.startsWith("{") && s.endsWith("}")) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    private static Character resolve(String option, String name, Map<String, Character> longNames) {
        if (name.length() == 1 && longNames.containsValue(name.charAt(0))) {
            return name.charAt(0);
        }
        Character letter = longNames.get(name);
        if (letter == null) {
            logger.warn("Ignoring unknown {} entry '{}'", option, name);
        }
        return letter;
    }
}
