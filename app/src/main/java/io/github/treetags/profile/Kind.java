package io.github.treetags.profile;

import org.jetbrains.annotations.Nullable;

/**
 * One entry of a language's kind table.
 *
 * @param code single-character code written to the tag file
 * @param name long name, also used as the scope field key
 * @param enabledByDefault whether tags of this kind are emitted without an explicit kind filter
 * @param role scope behaviour
 * @param memberKindCode kind to use instead when the innermost enclosing scope has role {@link TagRole#TYPE}
 */
public record Kind(String code, String name, boolean enabledByDefault, TagRole role, @Nullable String memberKindCode) {
    public Kind {
        if (code.isEmpty() || name.isEmpty()) {
            throw new IllegalArgumentException("kind code and name must not be empty");
        }
    }

    public Kind(String code, String name, TagRole role) {
        this(code, name, true, role, null);
    }
}
