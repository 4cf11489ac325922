package io.github.treetags.tags;

import com.google.common.primitives.UnsignedBytes;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;

/**
 * Byte-wise ordering of tags, as consumers binary-searching a sorted tag file expect it. Comparing UTF-8 bytes
 * differs from {@link String#compareTo} for characters outside the BMP.
 */
public final class TagOrder {
    private static final Comparator<byte[]> BYTES = UnsignedBytes.lexicographicalComparator();

    private TagOrder() {}

    public static int compareBytewise(String a, String b) {
        return BYTES.compare(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    /** Orders by name, then file. Ties are left to the caller. */
    public static Comparator<Tag> byNameAndFile() {
        return (a, b) -> {
            int c = compareBytewise(a.name(), b.name());
            return c != 0 ? c : compareBytewise(a.file(), b.file());
        };
    }

    /**
     * Precomputed sort key: name, file, address text and finally the whole rendered line, so that the order is total
     * and output does not depend on arrival order.
     */
    public static final class SortKey implements Comparable<SortKey> {
        private final byte[] name;
        private final byte[] file;
        private final byte[] address;
        private final byte[] line;

        private SortKey(byte[] name, byte[] file, byte[] address, byte[] line) {
            this.name = name;
            this.file = file;
            this.address = address;
            this.line = line;
        }

        public static SortKey of(Tag tag, String renderedLine) {
            return new SortKey(
                    tag.name().getBytes(StandardCharsets.UTF_8),
                    tag.file().getBytes(StandardCharsets.UTF_8),
                    TagLines.formatAddress(tag.address()).getBytes(StandardCharsets.UTF_8),
                    renderedLine.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public int compareTo(SortKey o) {
            int c = BYTES.compare(name, o.name);
            if (c != 0) return c;
            c = BYTES.compare(file, o.file);
            if (c != 0) return c;
            c = BYTES.compare(address, o.address);
            if (c != 0) return c;
            return BYTES.compare(line, o.line);
        }
    }
}
