package io.github.treetags.tags;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TagOrderTest {

    @Test
    void comparesUtf8BytesNotUtf16Units() {
        // U+FF21 sorts before U+1F600 in UTF-8, the opposite of String.compareTo
        String fullwidth = "Ａ";
        String emoji = "😀";
        assertTrue(fullwidth.compareTo(emoji) > 0);
        assertTrue(TagOrder.compareBytewise(fullwidth, emoji) < 0);
    }

    @Test
    void upperCaseSortsBeforeLowerCase() {
        assertTrue(TagOrder.compareBytewise("Zeta", "alpha") < 0);
    }

    @Test
    void sortKeyOrderIsTotalAndIndependentOfInputOrder() {
        var tags = new ArrayList<Tag>();
        tags.add(new Tag("run", "b.go", new TagAddress.LineNumber(4), "f", null, null, Map.of()));
        tags.add(new Tag("run", "a.go", new TagAddress.LineNumber(9), "f", null, null, Map.of()));
        tags.add(new Tag("run", "a.go", new TagAddress.LineNumber(2), "f", null, null, Map.of()));
        tags.add(new Tag("Run", "c.go", new TagAddress.LineNumber(1), "f", null, null, Map.of()));

        List<String> first = sorted(tags);
        Collections.reverse(tags);
        assertEquals(first, sorted(tags));
        assertEquals(
                List.of(
                        "Run\tc.go\t1;\"\tf",
                        "run\ta.go\t2;\"\tf",
                        "run\ta.go\t9;\"\tf",
                        "run\tb.go\t4;\"\tf"),
                first);
    }

    private static List<String> sorted(List<Tag> tags) {
        record Keyed(TagOrder.SortKey key, String line) {}
        return tags.stream()
                .map(t -> {
                    String line = TagLines.format(t, KindStyle.LETTER);
                    return new Keyed(TagOrder.SortKey.of(t, line), line);
                })
                .sorted((a, b) -> a.key().compareTo(b.key()))
                .map(Keyed::line)
                .toList();
    }
}
