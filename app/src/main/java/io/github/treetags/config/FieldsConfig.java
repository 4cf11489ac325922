package io.github.treetags.config;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.github.treetags.profile.FieldRule;
import io.github.treetags.tags.KindStyle;
import java.util.Set;

/**
 * Which parts of a tag line are written. Letters follow ctags: {@code n} line, {@code k} kind letter, {@code K} kind
 * long name, {@code z} {@code kind:} key, {@code s} scope, {@code S} signature, {@code a} access, {@code e} end,
 * {@code t} typeref.
 */
public final class FieldsConfig {
    static final ImmutableMap<String, Character> LONG_NAMES = ImmutableMap.<String, Character>builder()
            .put(FieldRule.LINE, 'n')
            .put("kind", 'k')
            .put("kindLong", 'K')
            .put("kindKey", 'z')
            .put("scope", 's')
            .put(FieldRule.SIGNATURE, 'S')
            .put(FieldRule.ACCESS, 'a')
            .put(FieldRule.END, 'e')
            .put(FieldRule.TYPEREF, 't')
            .build();

    public static final ImmutableSet<Character> DEFAULT_LETTERS = ImmutableSet.of('k', 's', 't');

    private final ImmutableSet<Character> enabled;

    private FieldsConfig(Set<Character> enabled) {
        this.enabled = ImmutableSet.copyOf(enabled);
    }

    public static FieldsConfig defaults() {
        return new FieldsConfig(DEFAULT_LETTERS);
    }

    public static FieldsConfig parse(String value) {
        return new FieldsConfig(LetterFlags.parse("--fields", value, DEFAULT_LETTERS, LONG_NAMES));
    }

    public static FieldsConfig of(Character... letters) {
        return new FieldsConfig(Set.of(letters));
    }

    public boolean isEnabled(char letter) {
        return enabled.contains(letter);
    }

    /** Whether an extension field produced by a {@link FieldRule} is written. */
    public boolean isFieldEnabled(String fieldKey) {
        Character letter = LONG_NAMES.get(fieldKey);
        return letter != null && enabled.contains(letter);
    }

    public boolean scopeEnabled() {
        return enabled.contains('s');
    }

    public KindStyle kindStyle() {
        boolean key = enabled.contains('z');
        if (enabled.contains('K')) {
            return key ? KindStyle.LONG_NAME_WITH_KEY : KindStyle.LONG_NAME;
        }
        if (enabled.contains('k')) {
            return key ? KindStyle.LETTER_WITH_KEY : KindStyle.LETTER;
        }
        return KindStyle.NONE;
    }

    public Set<Character> letters() {
        return enabled;
    }

    @Override
    public String toString() {
        return "FieldsConfig" + enabled;
    }
}
