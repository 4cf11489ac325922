package io.github.treetags.tags;

/**
 * The lexically enclosing definition of a tag.
 *
 * @param kindCode single-character kind of the enclosing definition, e.g. {@code c}
 * @param kindName long kind name written as the field key, e.g. {@code class}
 * @param name qualified name of the enclosing definition, joined with the language's scope separator
 */
public record TagScope(String kindCode, String kindName, String name) {
    public TagScope {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("scope name must not be empty");
        }
    }
}
