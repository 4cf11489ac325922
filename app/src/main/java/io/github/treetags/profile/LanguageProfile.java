package io.github.treetags.profile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.treesitter.TSLanguage;
import org.treesitter.TSQuery;

/**
 * Everything needed to tag files of one language. Instances are immutable once built and shared by all workers;
 * the compiled query is only ever read, each worker runs it with its own cursor.
 */
public final class LanguageProfile {
    private final String language;
    private final ImmutableSet<String> extensions;
    private final TSLanguage grammar;
    private final TSQuery query;
    private final KindTable kinds;
    private final ImmutableList<FieldRule> fieldRules;
    private final String scopeSeparator;
    private final AddressMode addressMode;
    private final boolean userDefined;

    LanguageProfile(
            String language,
            ImmutableSet<String> extensions,
            TSLanguage grammar,
            TSQuery query,
            KindTable kinds,
            ImmutableList<FieldRule> fieldRules,
            String scopeSeparator,
            AddressMode addressMode,
            boolean userDefined) {
        this.language = language;
        this.extensions = extensions;
        this.grammar = grammar;
        this.query = query;
        this.kinds = kinds;
        this.fieldRules = fieldRules;
        this.scopeSeparator = scopeSeparator;
        this.addressMode = addressMode;
        this.userDefined = userDefined;
    }

    public String language() {
        return language;
    }

    public ImmutableSet<String> extensions() {
        return extensions;
    }

    public TSLanguage grammar() {
        return grammar;
    }

    public TSQuery query() {
        return query;
    }

    public KindTable kinds() {
        return kinds;
    }

    public ImmutableList<FieldRule> fieldRules() {
        return fieldRules;
    }

    public String scopeSeparator() {
        return scopeSeparator;
    }

    public AddressMode addressMode() {
        return addressMode;
    }

    public boolean isUserDefined() {
        return userDefined;
    }

    @Override
    public String toString() {
        return "LanguageProfile[" + language + (userDefined ? ", user" : "") + ", " + extensions + "]";
    }
}
