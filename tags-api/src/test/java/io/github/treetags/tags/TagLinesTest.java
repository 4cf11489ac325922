package io.github.treetags.tags;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TagLinesTest {

    private static Tag tag(String name, TagAddress address) {
        return new Tag(name, "src/a.c", address, "f", "function", null, Map.of());
    }

    @Test
    void formatsPatternAddressWithKindAndFields() {
        var t = new Tag(
                "bar",
                "Foo.cpp",
                TagAddress.searchPattern("  int bar;"),
                "m",
                "member",
                new TagScope("c", "class", "Foo"),
                Map.of("line", "3"));
        assertEquals("bar\tFoo.cpp\t/^  int bar;$/;\"\tm\tline:3\tclass:Foo", TagLines.format(t, KindStyle.LETTER));
        assertEquals(
                "bar\tFoo.cpp\t/^  int bar;$/;\"\tkind:member\tline:3\tclass:Foo",
                TagLines.format(t, KindStyle.LONG_NAME_WITH_KEY));
    }

    @Test
    void escapesBackslashAndSlash() {
        String source = "char *s = \"a\\\\b\"; // c/d";
        String address = TagLines.formatAddress(TagAddress.searchPattern(source));
        assertEquals("/^char *s = \"a\\\\\\\\b\"; \\/\\/ c\\/d$/", address);
        assertTrue(address.contains("\\\\"));
    }

    @Test
    void escapeRoundTripReproducesSourceLine() {
        for (String source : new String[] {"a\\b", "x / y", "\\/", "ends with \\", "//", "plain", "$weird^"}) {
            var line = TagLines.format(tag("x", TagAddress.searchPattern(source)), KindStyle.LETTER);
            var parsed = TagLines.parse(line).orElseThrow();
            var pattern = assertInstanceOf(TagAddress.Pattern.class, parsed.address());
            assertEquals(source, pattern.sourceLine(), "round trip of " + source);
            assertTrue(pattern.anchoredEnd());
        }
    }

    @Test
    void truncatesLongPatternsToBound() {
        String source = "x".repeat(500);
        String address = TagLines.formatAddress(TagAddress.searchPattern(source));
        assertEquals(TagLines.MAX_ADDRESS_LENGTH, address.length());
        assertTrue(address.startsWith("/^xxx"));
        assertFalse(address.endsWith("$/"), "truncated pattern drops the end anchor");
    }

    @Test
    void patternExactlyAtBoundIsKeptWhole() {
        // "/^" + body + "$/" == 128
        String source = "y".repeat(TagLines.MAX_ADDRESS_LENGTH - 4);
        String address = TagLines.formatAddress(TagAddress.searchPattern(source));
        assertEquals(TagLines.MAX_ADDRESS_LENGTH, address.length());
        assertTrue(address.endsWith("$/"));

        String oneMore = TagLines.formatAddress(TagAddress.searchPattern(source + "y"));
        assertTrue(oneMore.length() <= TagLines.MAX_ADDRESS_LENGTH);
        assertFalse(oneMore.endsWith("$/"));
    }

    @Test
    void truncationNeverSplitsAnEscape() {
        String source = "/".repeat(300);
        String address = TagLines.formatAddress(TagAddress.searchPattern(source));
        assertTrue(address.length() <= TagLines.MAX_ADDRESS_LENGTH);
        String body = address.substring(2, address.length() - 1);
        assertEquals(0, body.length() % 2);
        assertEquals("/".repeat(body.length() / 2), TagLines.unescapePattern(body));
    }

    @Test
    void truncationNeverSplitsASurrogatePair() {
        String source = "a" + "😀".repeat(100);
        String address = TagLines.formatAddress(TagAddress.searchPattern(source));
        assertTrue(address.length() <= TagLines.MAX_ADDRESS_LENGTH);
        char last = address.charAt(address.length() - 2);
        assertTrue(Character.isLowSurrogate(last), "ends on a complete code point");
    }

    @Test
    void lineTerminatorInsideSourceLineIsCut() {
        var address = TagAddress.searchPattern("int a;\rint b;");
        assertEquals("/^int a;/", TagLines.formatAddress(address));
        assertThrows(IllegalArgumentException.class, () -> new TagAddress.Pattern("a\nb", true));
    }

    @Test
    void lineNumberAddress() {
        var line = TagLines.format(tag("main", new TagAddress.LineNumber(12)), KindStyle.LETTER);
        assertEquals("main\tsrc/a.c\t12;\"\tf", line);
        assertEquals(new TagAddress.LineNumber(12), TagLines.parse(line).orElseThrow().address());
    }

    @Test
    void parseKeepsOriginalLineAndReadsKindAndFields() {
        String line = "Foo\tsrc/foo.go\t/^type Foo struct {$/;\"\ts\tline:3\tpackage:main";
        var parsed = TagLines.parse(line).orElseThrow();
        assertEquals("Foo", parsed.name());
        assertEquals("src/foo.go", parsed.file());
        assertEquals("s", parsed.kind());
        assertEquals(Map.of("line", "3", "package", "main"), parsed.fields());
        assertEquals(line, parsed.originalLine());
        assertEquals(line, TagLines.format(parsed, KindStyle.LONG_NAME));
    }

    @Test
    void parseHandlesTabInsidePattern() {
        String line = "f\ta.c\t/^void\tf(void)$/;\"\tkind:f";
        var parsed = TagLines.parse(line).orElseThrow();
        assertEquals("f", parsed.kind());
        assertEquals(new TagAddress.Pattern("void\tf(void)", true), parsed.address());
    }

    @Test
    void parseRejectsShortLines() {
        assertTrue(TagLines.parse("onlyname").isEmpty());
        assertTrue(TagLines.parse("name\tfile").isEmpty());
        assertTrue(TagLines.parse("name\t\t12").isEmpty());
    }

    @Test
    void fieldValuesAreEscaped() {
        var t = new Tag("f", "a.c", new TagAddress.LineNumber(1), "f", null, null, Map.of("signature", "(a\tb)"));
        assertEquals("f\ta.c\t1;\"\tf\tsignature:(a\\tb)", TagLines.format(t, KindStyle.LETTER));
    }
}
