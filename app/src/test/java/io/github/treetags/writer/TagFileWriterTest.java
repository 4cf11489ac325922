package io.github.treetags.writer;

import static org.junit.jupiter.api.Assertions.*;

import io.github.treetags.tags.KindStyle;
import io.github.treetags.tags.Tag;
import io.github.treetags.tags.TagAddress;
import io.github.treetags.tags.TagLines;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TagFileWriterTest {

    @TempDir
    Path tempDir;

    private static Tag tag(String name, String file, String line) {
        return new Tag(name, file, TagAddress.searchPattern(line), "f", "function", null, Map.of());
    }

    @Test
    void headerDeclaresSortState() {
        var sorted = new TagFileWriter(true, KindStyle.LETTER).header();
        assertEquals(3, sorted.size());
        assertTrue(sorted.get(0).startsWith("!_TAG_FILE_FORMAT\t2\t"));
        assertTrue(sorted.get(1).startsWith("!_TAG_FILE_SORTED\t1\t"));
        assertEquals("!_TAG_PROGRAM_NAME\ttreetags\t//", sorted.get(2));

        var unsorted = new TagFileWriter(false, KindStyle.LETTER).header();
        assertTrue(unsorted.get(1).startsWith("!_TAG_FILE_SORTED\t0\t"));
    }

    @Test
    void sortsByNameThenFileBytewise() {
        var tags = List.of(
                tag("beta", "b.c", "int beta(void) {"),
                tag("Zeta", "a.c", "int Zeta(void) {"),
                tag("beta", "a.c", "int beta(void) {"),
                tag("éclair", "a.c", "int éclair;"),
                tag("alpha", "z.c", "int alpha;"));

        var lines = new TagFileWriter(true, KindStyle.LETTER).lines(tags);

        var keys = lines.stream().map(l -> l.substring(0, l.indexOf('\t', l.indexOf('\t') + 1))).toList();
        assertEquals(List.of("Zeta\ta.c", "alpha\tz.c", "beta\ta.c", "beta\tb.c", "éclair\ta.c"), keys);
    }

    @Test
    void unsortedOutputKeepsMergeOrder() {
        var tags = List.of(tag("b", "x.c", "b"), tag("a", "x.c", "a"));
        var lines = new TagFileWriter(false, KindStyle.LETTER).lines(tags);
        assertTrue(lines.get(0).startsWith("b\t"));
        assertTrue(lines.get(1).startsWith("a\t"));
    }

    @Test
    void longLinesStayWithinTheAddressBound() {
        String longLine = "static const char *table[] = {" + " \"a/b\\\\c\",".repeat(40) + "};";
        var line = new TagFileWriter(true, KindStyle.LETTER).lines(List.of(tag("table", "t.c", longLine))).get(0);

        String address = line.split("\t")[2];
        address = address.substring(0, address.length() - TagLines.ADDRESS_TERMINATOR.length());
        assertTrue(address.length() <= TagLines.MAX_ADDRESS_LENGTH, address);
        assertTrue(address.startsWith("/^static const char"));
        assertFalse(address.endsWith("$/"));
    }

    @Test
    void writesFileAtomically() throws Exception {
        Path target = tempDir.resolve("tags");
        Files.writeString(target, "old content\n");

        new TagFileWriter(true, KindStyle.LETTER).write(List.of(tag("main", "m.c", "int main() {")), target);

        var content = Files.readString(target);
        assertTrue(content.startsWith("!_TAG_FILE_FORMAT"));
        assertTrue(content.endsWith("main\tm.c\t/^int main() {$/;\"\tf\n"));
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertEquals(List.of(target), entries.toList());
        }
    }

    @Test
    void writesToStream() throws Exception {
        var out = new ByteArrayOutputStream();
        var writer = new TagFileWriter(false, KindStyle.LONG_NAME);
        writer.write(List.of(tag("main", "m.c", "int main() {")), out);

        String text = out.toString(StandardCharsets.UTF_8);
        assertEquals(writer.render(List.of(tag("main", "m.c", "int main() {"))), text);
        assertTrue(text.contains("\tfunction\n"));
    }
}
