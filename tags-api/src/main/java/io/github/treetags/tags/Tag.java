package io.github.treetags.tags;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * One navigable definition in a tag file.
 *
 * <p>{@code originalLine} is only set for tags read back from an existing tag file; writers emit it verbatim so that
 * tags of untouched files survive an append run byte for byte.
 */
public record Tag(
        String name,
        String file,
        TagAddress address,
        @Nullable String kind,
        @Nullable String kindName,
        @Nullable TagScope scope,
        ImmutableMap<String, String> fields,
        @Nullable String originalLine) {

    public Tag {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("tag name must not be empty");
        }
        if (file.isEmpty()) {
            throw new IllegalArgumentException("tag file must not be empty");
        }
    }

    public Tag(
            String name,
            String file,
            TagAddress address,
            @Nullable String kind,
            @Nullable String kindName,
            @Nullable TagScope scope,
            Map<String, String> fields) {
        this(name, file, address, kind, kindName, scope, ImmutableMap.copyOf(fields), null);
    }

    public boolean isFromDisk() {
        return originalLine != null;
    }

    public Tag withOriginalLine(String line) {
        return new Tag(name, file, address, kind, kindName, scope, fields, line);
    }

    public Tag withName(String newName) {
        return new Tag(newName, file, address, kind, kindName, scope, fields, null);
    }
}
