package io.github.treetags.tags;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;

/**
 * Pseudo-tag header of a tag file.
 *
 * @param format value of {@code !_TAG_FILE_FORMAT}
 * @param sorted value of {@code !_TAG_FILE_SORTED}, null when the header does not declare it
 * @param pseudoTagLines every {@code !_} line as read, in file order
 */
public record TagFileHeader(int format, @Nullable Integer sorted, ImmutableList<String> pseudoTagLines) {
    public static final int EXTENDED_FORMAT = 2;

    public boolean isSorted() {
        return sorted != null && sorted == 1;
    }
}
