package io.github.treetags.profile;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered mapping from capture name to {@link Kind}. Declaration order is significant: when two definition captures
 * land on the same syntax node, the one declared first wins.
 */
public final class KindTable {
    private final ImmutableList<Map.Entry<String, Kind>> entries;
    private final Map<String, Integer> indexByCapture;
    private final Map<String, Kind> kindsByCode;

    private KindTable(List<Map.Entry<String, Kind>> entries) {
        this.entries = ImmutableList.copyOf(entries);
        var index = new LinkedHashMap<String, Integer>();
        var byCode = new LinkedHashMap<String, Kind>();
        for (int i = 0; i < entries.size(); i++) {
            var e = entries.get(i);
            if (index.putIfAbsent(e.getKey(), i) != null) {
                throw new IllegalArgumentException("capture mapped twice: " + e.getKey());
            }
            var previous = byCode.putIfAbsent(e.getValue().code(), e.getValue());
            if (previous != null && !previous.equals(e.getValue())) {
                throw new IllegalArgumentException("kind code " + e.getValue().code() + " declared with different definitions");
            }
        }
        this.indexByCapture = Map.copyOf(index);
        this.kindsByCode = byCode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Kind> lookup(String captureName) {
        Integer i = indexByCapture.get(captureName);
        return i == null ? Optional.empty() : Optional.of(entries.get(i).getValue());
    }

    /** Lower is preferred; unmapped captures rank last. */
    public int priority(String captureName) {
        return indexByCapture.getOrDefault(captureName, Integer.MAX_VALUE);
    }

    public Optional<Kind> byCode(String code) {
        return Optional.ofNullable(kindsByCode.get(code));
    }

    public Optional<Kind> byName(String name) {
        return kindsByCode.values().stream().filter(k -> k.name().equals(name)).findFirst();
    }

    /** Distinct kinds in declaration order. */
    public List<Kind> kinds() {
        return List.copyOf(kindsByCode.values());
    }

    public List<String> captureNames() {
        return entries.stream().map(Map.Entry::getKey).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Kinds for grammars registered without an explicit table, following the capture names common to tree-sitter tag
     * queries.
     */
    public static KindTable generic() {
        return builder()
                .add("definition.module", new Kind("n", "module", TagRole.NAMESPACE))
                .add("definition.namespace", new Kind("n", "module", TagRole.NAMESPACE))
                .add("definition.class", new Kind("c", "class", TagRole.TYPE))
                .add("definition.interface", new Kind("i", "interface", TagRole.TYPE))
                .add("definition.struct", new Kind("s", "struct", TagRole.TYPE))
                .add("definition.enum", new Kind("g", "enum", TagRole.TYPE))
                .add("definition.method", new Kind("m", "method", TagRole.CALLABLE))
                .add("definition.function", new Kind("f", "function", TagRole.CALLABLE))
                .add("definition.macro", new Kind("d", "macro", TagRole.MEMBER))
                .add("definition.constant", new Kind("C", "constant", TagRole.MEMBER))
                .add("definition.type", new Kind("t", "type", TagRole.MEMBER))
                .add("definition.variable", new Kind("v", "variable", TagRole.MEMBER))
                .build();
    }

    public static final class Builder {
        private final List<Map.Entry<String, Kind>> entries = new ArrayList<>();

        private Builder() {}

        public Builder add(String captureName, Kind kind) {
            entries.add(Map.entry(captureName, kind));
            return this;
        }

        public KindTable build() {
            return new KindTable(entries);
        }
    }
}
