package io.github.treetags.tags;

/** How the kind of a tag is rendered in the fourth column. */
public enum KindStyle {
    /** Kind column omitted. */
    NONE,
    /** {@code c} */
    LETTER,
    /** {@code kind:c} */
    LETTER_WITH_KEY,
    /** {@code class} */
    LONG_NAME,
    /** {@code kind:class} */
    LONG_NAME_WITH_KEY
}
