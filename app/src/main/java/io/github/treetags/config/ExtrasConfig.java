package io.github.treetags.config;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** Extra tag entries: {@code q} qualified names of scoped definitions, {@code f} one entry per input file. */
public record ExtrasConfig(boolean qualified, boolean fileEntries) {
    private static final ImmutableMap<String, Character> LONG_NAMES =
            ImmutableMap.of("qualified", 'q', "inputFile", 'f');

    public static ExtrasConfig none() {
        return new ExtrasConfig(false, false);
    }

    public static ExtrasConfig parse(String value) {
        Set<Character> letters = LetterFlags.parse("--extras", value, ImmutableSet.of(), LONG_NAMES);
        return new ExtrasConfig(letters.contains('q'), letters.contains('f'));
    }
}
