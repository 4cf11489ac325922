package io.github.treetags.profile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.treetags.config.UserGrammar;
import io.github.treetags.config.UserGrammarsConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Turns user grammar registrations into profile definitions. Settings a registration leaves out are taken from the
 * built-in profile of the same language when there is one.
 */
public final class UserProfiles {

    public record Result(List<ProfileDefinition> definitions, List<ProfileError> errors) {}

    private UserProfiles() {}

    public static Result from(UserGrammarsConfig config) {
        var definitions = new ArrayList<ProfileDefinition>();
        var errors = new ArrayList<ProfileError>();
        for (UserGrammar grammar : config.userGrammars()) {
            String language = grammar.languageName() == null ? "" : grammar.languageName().trim();
            if (language.isEmpty()) {
                var missing = new ProfileLoadException("<unnamed>", "language_name is required");
                errors.add(new ProfileError("<unnamed>", missing));
                continue;
            }
            try {
                definitions.add(toDefinition(language, grammar, config));
            } catch (ProfileLoadException e) {
                errors.add(new ProfileError(language, e));
            }
        }
        return new Result(List.copyOf(definitions), List.copyOf(errors));
    }

    private static ProfileDefinition toDefinition(String language, UserGrammar grammar, UserGrammarsConfig config)
            throws ProfileLoadException {
        var builtIn = BuiltInProfiles.forLanguage(language).orElse(null);

        Path jar = grammar.grammarLibPath() == null ? null : config.resolve(grammar.grammarLibPath());
        String className = grammar.grammarClass() != null
                ? grammar.grammarClass()
                : GrammarSource.defaultClassName(language);
        GrammarSource grammarSource = grammar.grammarClass() == null && jar == null && builtIn != null
                ? builtIn.grammar()
                : GrammarSource.fromClass(className, jar);

        QuerySource query;
        if (grammar.queryFilePath() != null) {
            query = QuerySource.file(config.resolve(grammar.queryFilePath()));
        } else if (builtIn != null) {
            query = builtIn.query();
        } else {
            throw new ProfileLoadException(
                    language, "query_file_path is required for a language without a built-in query");
        }

        ImmutableSet<String> extensions;
        if (grammar.extensions() != null && !grammar.extensions().isEmpty()) {
            extensions = grammar.extensions().stream()
                    .map(e -> e.startsWith(".") ? e.substring(1) : e)
                    .collect(ImmutableSet.toImmutableSet());
        } else if (builtIn != null) {
            extensions = builtIn.extensions();
        } else {
            throw new ProfileLoadException(
                    language, "extensions are required for a language without a built-in profile");
        }

        KindTable kinds;
        if (grammar.kinds() != null && !grammar.kinds().isEmpty()) {
            kinds = parseKinds(language, grammar.kinds());
        } else if (builtIn != null) {
            kinds = builtIn.kinds();
        } else {
            kinds = KindTable.generic();
        }

        AddressMode addressMode = AddressMode.PATTERN;
        if (grammar.address() != null) {
            addressMode = AddressMode.parse(grammar.address())
                    .orElseThrow(() -> new ProfileLoadException(language, "unknown address mode " + grammar.address()));
        } else if (builtIn != null) {
            addressMode = builtIn.addressMode();
        }

        ImmutableList<FieldRule> rules = builtIn != null ? builtIn.fieldRules() : ImmutableList.of();
        String separator = builtIn != null ? builtIn.scopeSeparator() : ".";
        return new ProfileDefinition(
                builtIn != null ? builtIn.language() : language.toLowerCase(Locale.ROOT),
                grammarSource,
                query,
                extensions,
                kinds,
                rules,
                separator,
                addressMode,
                true);
    }

    /** Entries map capture names to {@code code:name}, e.g. {@code "definition.class" = "c:class"}. */
    static KindTable parseKinds(String language, Map<String, String> entries) throws ProfileLoadException {
        var builder = KindTable.builder();
        for (var e : entries.entrySet()) {
            String value = e.getValue().trim();
            int colon = value.indexOf(':');
            String code = colon < 0 ? value : value.substring(0, colon).trim();
            String name = colon < 0 ? roleName(e.getKey()) : value.substring(colon + 1).trim();
            if (code.isEmpty() || name.isEmpty()) {
                throw new ProfileLoadException(language, "bad kind entry " + e.getKey() + " = " + value);
            }
            builder.add(e.getKey(), new Kind(code, name, roleFor(e.getKey())));
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new ProfileLoadException(language, ex.getMessage(), ex);
        }
    }

    private static String roleName(String captureName) {
        String[] parts = captureName.split("\\.");
        return parts[parts.length - 1];
    }

    static TagRole roleFor(@Nullable String captureName) {
        if (captureName == null) {
            return TagRole.MEMBER;
        }
        String[] parts = captureName.split("\\.");
        String kind = parts[parts.length - 1];
        return switch (kind) {
            case "module", "namespace", "package" -> TagRole.NAMESPACE;
            case "class", "interface", "struct", "enum", "trait", "implementation", "union", "record", "object" ->
                    TagRole.TYPE;
            case "function", "method", "constructor" -> TagRole.CALLABLE;
            default -> TagRole.MEMBER;
        };
    }
}
