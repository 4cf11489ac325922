package io.github.treetags.tags;

/**
 * Where a tag points inside its file: either a 1-based line number or an ex search pattern built from the literal
 * source line. Anything else found in an existing tag file is preserved as a raw ex command.
 */
public sealed interface TagAddress {

    /** Builds a search pattern address, cutting the line at the first embedded line terminator. */
    static TagAddress searchPattern(String sourceLine) {
        for (int i = 0; i < sourceLine.length(); i++) {
            char c = sourceLine.charAt(i);
            if (c == '\n' || c == '\r') {
                return new Pattern(sourceLine.substring(0, i), false);
            }
        }
        return new Pattern(sourceLine, true);
    }

    record LineNumber(int line) implements TagAddress {
        public LineNumber {
            if (line < 1) {
                throw new IllegalArgumentException("line numbers are 1-based, got " + line);
            }
        }
    }

    /**
     * An anchored forward search for {@code sourceLine}. {@code anchoredEnd} is false when the pattern only matches a
     * prefix of the line (no trailing {@code $}).
     */
    record Pattern(String sourceLine, boolean anchoredEnd) implements TagAddress {
        public Pattern {
            if (sourceLine.indexOf('\n') >= 0 || sourceLine.indexOf('\r') >= 0) {
                throw new IllegalArgumentException("pattern must not contain a line terminator");
            }
        }
    }

    /** Address text read back from disk that is neither a plain number nor a slash pattern. */
    record ExCommand(String text) implements TagAddress {}
}
