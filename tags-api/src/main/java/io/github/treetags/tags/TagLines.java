package io.github.treetags.tags;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Codec for single lines of an extended-format tag file:
 *
 * <pre>name&lt;TAB&gt;file&lt;TAB&gt;address;"&lt;TAB&gt;kind&lt;TAB&gt;key:value...</pre>
 */
public final class TagLines {
    /** Upper bound on the rendered length of a pattern address, delimiters included. */
    public static final int MAX_ADDRESS_LENGTH = 128;

    public static final String ADDRESS_TERMINATOR = ";\"";
    public static final String KIND_KEY = "kind";
    public static final String LINE_KEY = "line";

    private static final String PATTERN_OPEN = "/^";
    private static final String PATTERN_CLOSE = "/";

    private TagLines() {}

    public static String format(Tag tag, KindStyle kindStyle) {
        if (tag.originalLine() != null) {
            return tag.originalLine();
        }
        var sb = new StringBuilder();
        sb.append(tag.name()).append('\t').append(tag.file()).append('\t');
        sb.append(formatAddress(tag.address())).append(ADDRESS_TERMINATOR);

        String kindColumn = kindColumn(tag, kindStyle);
        if (kindColumn != null) {
            sb.append('\t').append(kindColumn);
        }

        String line = tag.fields().get(LINE_KEY);
        if (line != null) {
            appendField(sb, LINE_KEY, line);
        }
        if (tag.scope() != null) {
            appendField(sb, tag.scope().kindName(), tag.scope().name());
        }
        for (var e : tag.fields().entrySet()) {
            if (!e.getKey().equals(LINE_KEY)) {
                appendField(sb, e.getKey(), e.getValue());
            }
        }
        return sb.toString();
    }

    private static @Nullable String kindColumn(Tag tag, KindStyle style) {
        if (tag.kind() == null) {
            return null;
        }
        String longName = tag.kindName() != null ? tag.kindName() : tag.kind();
        return switch (style) {
            case NONE -> null;
            case LETTER -> tag.kind();
            case LETTER_WITH_KEY -> KIND_KEY + ":" + tag.kind();
            case LONG_NAME -> longName;
            case LONG_NAME_WITH_KEY -> KIND_KEY + ":" + longName;
        };
    }

    private static void appendField(StringBuilder sb, String key, String value) {
        sb.append('\t').append(key).append(':').append(escapeFieldValue(value));
    }

    static String escapeFieldValue(String value) {
        var sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\t' -> sb.append("\\t");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String formatAddress(TagAddress address) {
        if (address instanceof TagAddress.LineNumber n) {
            return Integer.toString(n.line());
        }
        if (address instanceof TagAddress.ExCommand ex) {
            return ex.text();
        }
        var pattern = (TagAddress.Pattern) address;
        String escaped = escapePattern(pattern.sourceLine());
        String full = PATTERN_OPEN + escaped + (pattern.anchoredEnd() ? "$" : "") + PATTERN_CLOSE;
        if (full.length() <= MAX_ADDRESS_LENGTH) {
            return full;
        }
        return PATTERN_OPEN + truncateEscaped(escaped, MAX_ADDRESS_LENGTH - PATTERN_OPEN.length() - PATTERN_CLOSE.length())
                + PATTERN_CLOSE;
    }

    /** Escapes backslash and the pattern delimiter. */
    public static String escapePattern(String sourceLine) {
        var sb = new StringBuilder(sourceLine.length() + 8);
        for (int i = 0; i < sourceLine.length(); i++) {
            char c = sourceLine.charAt(i);
            if (c == '\\' || c == '/') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /** Inverse of {@link #escapePattern}. A backslash before any other character is kept literally. */
    public static String unescapePattern(String escaped) {
        var sb = new StringBuilder(escaped.length());
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (c == '\\' && i + 1 < escaped.length()) {
                char next = escaped.charAt(i + 1);
                if (next == '\\' || next == '/') {
                    sb.append(next);
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    // never ends in the middle of an escape pair or a surrogate pair
    private static String truncateEscaped(String escaped, int budget) {
        int end = 0;
        while (end < escaped.length()) {
            int step = 1;
            char c = escaped.charAt(end);
            if (c == '\\' && end + 1 < escaped.length()) {
                step = 2;
            } else if (Character.isHighSurrogate(c)
                    && end + 1 < escaped.length()
                    && Character.isLowSurrogate(escaped.charAt(end + 1))) {
                step = 2;
            }
            if (end + step > budget) {
                break;
            }
            end += step;
        }
        return escaped.substring(0, end);
    }

    /**
     * Parses one tag line. Returns empty for lines that do not carry a name, a file and an address. The returned tag
     * remembers {@code line} verbatim.
     */
    public static Optional<Tag> parse(String line) {
        int firstTab = line.indexOf('\t');
        if (firstTab <= 0) {
            return Optional.empty();
        }
        int secondTab = line.indexOf('\t', firstTab + 1);
        if (secondTab < 0 || secondTab == firstTab + 1 || secondTab + 1 >= line.length()) {
            return Optional.empty();
        }
        String name = line.substring(0, firstTab);
        String file = line.substring(firstTab + 1, secondTab);

        int addrStart = secondTab + 1;
        int addrEnd = addressEnd(line, addrStart);
        String addressText = line.substring(addrStart, addrEnd);
        if (addressText.isEmpty()) {
            return Optional.empty();
        }

        int rest = addrEnd;
        if (line.startsWith(ADDRESS_TERMINATOR, rest)) {
            rest += ADDRESS_TERMINATOR.length();
        }

        String kind = null;
        Map<String, String> fields = new LinkedHashMap<>();
        if (rest < line.length() && line.charAt(rest) == '\t') {
            for (String field : line.substring(rest + 1).split("\t", -1)) {
                if (field.isEmpty()) {
                    continue;
                }
                int colon = field.indexOf(':');
                if (colon < 0) {
                    if (kind == null) {
                        kind = field;
                    }
                } else if (field.substring(0, colon).equals(KIND_KEY)) {
                    kind = field.substring(colon + 1);
                } else {
                    fields.putIfAbsent(field.substring(0, colon), field.substring(colon + 1));
                }
            }
        }

        return Optional.of(
                new Tag(name, file, parseAddress(addressText), kind, null, null, ImmutableMap.copyOf(fields), line));
    }

    private static int addressEnd(String line, int start) {
        if (line.charAt(start) == '/' || line.charAt(start) == '?') {
            char delimiter = line.charAt(start);
            int i = start + 1;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (c == '\\') {
                    i += 2;
                } else if (c == delimiter) {
                    return i + 1;
                } else {
                    i++;
                }
            }
            return line.length();
        }
        int terminator = line.indexOf(ADDRESS_TERMINATOR, start);
        int tab = line.indexOf('\t', start);
        if (terminator < 0) {
            return tab < 0 ? line.length() : tab;
        }
        return tab < 0 ? terminator : Math.min(terminator, tab);
    }

    public static TagAddress parseAddress(String text) {
        if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
            try {
                int n = Integer.parseInt(text);
                if (n >= 1) {
                    return new TagAddress.LineNumber(n);
                }
            } catch (NumberFormatException e) {
                return new TagAddress.ExCommand(text);
            }
        }
        if (text.length() >= 3 && text.startsWith(PATTERN_OPEN) && text.endsWith(PATTERN_CLOSE)) {
            String body = text.substring(PATTERN_OPEN.length(), text.length() - PATTERN_CLOSE.length());
            boolean anchoredEnd = body.endsWith("$");
            if (anchoredEnd) {
                body = body.substring(0, body.length() - 1);
            }
            return new TagAddress.Pattern(unescapePattern(body), anchoredEnd);
        }
        return new TagAddress.ExCommand(text);
    }
}
