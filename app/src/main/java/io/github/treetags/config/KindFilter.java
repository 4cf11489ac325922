package io.github.treetags.config;

import com.google.common.collect.ImmutableSet;
import io.github.treetags.profile.Kind;
import io.github.treetags.profile.KindTable;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Kinds enabled for one language. Parsed from a {@code --kinds} value against that language's kind table:
 *
 * <ul>
 *   <li>{@code fsm} or {@code f,struct,m} enables exactly those kinds
 *   <li>{@code +m-c} or {@code +member, -class} edits the default set
 *   <li>{@code *} enables every kind, an empty value keeps the defaults
 * </ul>
 */
public final class KindFilter {
    private static final Logger logger = LogManager.getLogger(KindFilter.class);

    private final ImmutableSet<String> enabledCodes;

    private KindFilter(Set<String> enabledCodes) {
        this.enabledCodes = ImmutableSet.copyOf(enabledCodes);
    }

    public static KindFilter defaults(KindTable table) {
        var codes = new LinkedHashSet<String>();
        for (Kind k : table.kinds()) {
            if (k.enabledByDefault()) {
                codes.add(k.code());
            }
        }
        return new KindFilter(codes);
    }

    public static KindFilter parse(String value, KindTable table) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return defaults(table);
        }
        if (trimmed.equals("*")) {
            return new KindFilter(
                    table.kinds().stream().map(Kind::code).collect(Collectors.toCollection(LinkedHashSet::new)));
        }

        boolean modifierMode = trimmed.charAt(0) == '+' || trimmed.charAt(0) == '-';
        var codes = modifierMode ? new LinkedHashSet<>(defaults(table).enabledCodes) : new LinkedHashSet<String>();

        if (trimmed.indexOf(',') >= 0) {
            for (String part : trimmed.split(",")) {
                String p = part.trim();
                if (p.isEmpty()) continue;
                boolean remove = p.charAt(0) == '-';
                if (p.charAt(0) == '+' || p.charAt(0) == '-') {
                    p = p.substring(1).trim();
                }
                lookup(p, table).ifPresent(k -> apply(codes, k, remove));
            }
        } else {
            boolean remove = false;
            for (int i = 0; i < trimmed.length(); i++) {
                char c = trimmed.charAt(i);
                if (c == '+' || c == '-') {
                    remove = c == '-';
                } else if (!Character.isWhitespace(c)) {
                    final boolean r = remove;
                    lookup(String.valueOf(c), table).ifPresent(k -> apply(codes, k, r));
                }
            }
        }
        return new KindFilter(codes);
    }

    private static void apply(Set<String> codes, Kind kind, boolean remove) {
        if (remove) {
            codes.remove(kind.code());
        } else {
            codes.add(kind.code());
        }
    }

    private static Optional<Kind> lookup(String codeOrName, KindTable table) {
        var kind = table.byCode(codeOrName).or(() -> table.byName(codeOrName));
        if (kind.isEmpty()) {
            logger.warn("Ignoring unknown kind '{}'", codeOrName);
        }
        return kind;
    }

    public boolean isEnabled(Kind kind) {
        return enabledCodes.contains(kind.code());
    }

    public Set<String> enabledCodes() {
        return enabledCodes;
    }
}
