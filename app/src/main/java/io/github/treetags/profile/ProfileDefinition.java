package io.github.treetags.profile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSQuery;
import org.treesitter.TSQueryException;

/** Uncompiled description of a language profile. {@link #compile()} turns it into a {@link LanguageProfile}. */
public record ProfileDefinition(
        String language,
        GrammarSource grammar,
        QuerySource query,
        ImmutableSet<String> extensions,
        KindTable kinds,
        ImmutableList<FieldRule> fieldRules,
        String scopeSeparator,
        AddressMode addressMode,
        boolean userDefined) {

    public ProfileDefinition {
        if (language.isBlank()) {
            throw new IllegalArgumentException("language name must not be blank");
        }
    }

    public ProfileDefinition withGrammar(GrammarSource newGrammar) {
        return new ProfileDefinition(
                language, newGrammar, query, extensions, kinds, fieldRules, scopeSeparator, addressMode, userDefined);
    }

    public ProfileDefinition withQuery(QuerySource newQuery) {
        return new ProfileDefinition(
                language, grammar, newQuery, extensions, kinds, fieldRules, scopeSeparator, addressMode, userDefined);
    }

    public ProfileDefinition withExtensions(ImmutableSet<String> newExtensions) {
        return new ProfileDefinition(
                language, grammar, query, newExtensions, kinds, fieldRules, scopeSeparator, addressMode, userDefined);
    }

    public ProfileDefinition withKinds(KindTable newKinds) {
        return new ProfileDefinition(
                language, grammar, query, extensions, newKinds, fieldRules, scopeSeparator, addressMode, userDefined);
    }

    public ProfileDefinition withAddressMode(AddressMode newMode) {
        return new ProfileDefinition(
                language, grammar, query, extensions, kinds, fieldRules, scopeSeparator, newMode, userDefined);
    }

    public ProfileDefinition asUserDefined() {
        return new ProfileDefinition(
                language, grammar, query, extensions, kinds, fieldRules, scopeSeparator, addressMode, true);
    }

    public LanguageProfile compile() throws ProfileLoadException {
        if (extensions.isEmpty()) {
            throw new ProfileLoadException(language, "no file extensions registered");
        }
        TSLanguage tsLanguage = grammar.load(language);
        try {
            var probe = new TSParser();
            if (!probe.setLanguage(tsLanguage)) {
                throw new ProfileLoadException(language, "grammar is incompatible with the tree-sitter runtime");
            }
        } catch (LinkageError e) {
            throw new ProfileLoadException(language, "tree-sitter runtime failed to load: " + e, e);
        }

        String source = query.load(language);
        TSQuery tsQuery;
        try {
            tsQuery = new TSQuery(tsLanguage, source);
        } catch (TSQueryException e) {
            throw new ProfileLoadException(language, "tag query failed to compile: " + e.getMessage(), e);
        }
        return new LanguageProfile(
                language,
                extensions,
                tsLanguage,
                tsQuery,
                kinds,
                fieldRules,
                scopeSeparator,
                addressMode,
                userDefined);
    }
}
