package io.github.treetags.profile;

import static io.github.treetags.profile.TagRole.CALLABLE;
import static io.github.treetags.profile.TagRole.MEMBER;
import static io.github.treetags.profile.TagRole.NAMESPACE;
import static io.github.treetags.profile.TagRole.TYPE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterCSharp;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRust;
import org.treesitter.TreeSitterTypescript;

/** Profiles for the grammars bundled with treetags. Queries live under {@code treesitter/tags/} on the classpath. */
public final class BuiltInProfiles {
    public static final String JAVA = "java";
    public static final String GO = "go";
    public static final String PYTHON = "python";
    public static final String JAVASCRIPT = "javascript";
    public static final String RUST = "rust";
    public static final String CPP = "cpp";
    public static final String CSHARP = "csharp";
    public static final String C = "c";
    public static final String TYPESCRIPT = "typescript";

    private static final String QUERY_ROOT = "treesitter/tags/";

    private BuiltInProfiles() {}

    public static List<ProfileDefinition> all() {
        return List.of(java(), go(), python(), javascript(), rust(), cpp(), csharp(), c(), typescript());
    }

    public static Optional<ProfileDefinition> forLanguage(String language) {
        String key = language.toLowerCase(Locale.ROOT);
        return all().stream()
                .filter(d -> d.language().equals(key) || aliases(d.language()).contains(key))
                .findFirst();
    }

    private static Set<String> aliases(String language) {
        return switch (language) {
            case CPP -> Set.of("c++");
            case CSHARP -> Set.of("c#", "c-sharp", "c_sharp");
            case JAVASCRIPT -> Set.of("js");
            case TYPESCRIPT -> Set.of("ts");
            default -> Set.of();
        };
    }

    static ProfileDefinition java() {
        var kinds = KindTable.builder()
                .add("definition.class", new Kind("c", "class", TYPE))
                .add("definition.interface", new Kind("i", "interface", TYPE))
                .add("definition.enum", new Kind("g", "enum", TYPE))
                .add("definition.record", new Kind("r", "record", TYPE))
                .add("definition.annotation", new Kind("a", "annotation", TYPE))
                .add("definition.enum.constant", new Kind("e", "enumConstant", MEMBER))
                .add("definition.method", new Kind("m", "method", CALLABLE))
                .add("definition.class.field", new Kind("f", "field", MEMBER))
                .build();
        Set<String> declarations = Set.of(
                "definition.class",
                "definition.interface",
                "definition.enum",
                "definition.record",
                "definition.annotation",
                "definition.method");
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature("parameters", null, "", Set.of("definition.method")),
                new FieldRule.AccessFromModifiers("", Set.of("modifiers"), declarations),
                new FieldRule.AccessFromModifiers("..", Set.of("modifiers"), Set.of("definition.class.field")),
                new FieldRule.EndLine(Set.of()),
                new FieldRule.TypeRef("type", Set.of("definition.method")),
                new FieldRule.TypeRef("../type", Set.of("definition.class.field")));
        return definition(JAVA, TreeSitterJava::new, Set.of("java"), kinds, rules, ".");
    }

    static ProfileDefinition go() {
        // struct and interface precede the plain type entry so they win on the same type_spec
        var kinds = KindTable.builder()
                .add("definition.package", new Kind("p", "package", NAMESPACE))
                .add("definition.struct", new Kind("s", "struct", TYPE))
                .add("definition.interface", new Kind("i", "interface", TYPE))
                .add("definition.type", new Kind("t", "type", MEMBER))
                .add("definition.function", new Kind("f", "func", CALLABLE))
                .add("definition.method", new Kind("f", "func", CALLABLE))
                .add("definition.constant", new Kind("c", "const", MEMBER))
                .add("definition.variable", new Kind("v", "var", MEMBER))
                .add("definition.member", new Kind("m", "member", MEMBER))
                .build();
        var callables = Set.of("definition.function", "definition.method", "definition.member");
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature("parameters", "result", " ", callables),
                new FieldRule.EndLine(Set.of()),
                new FieldRule.TypeRef("result", Set.of("definition.function", "definition.method")),
                new FieldRule.TypeRef(
                        "../type", Set.of("definition.constant", "definition.variable", "definition.member")));
        return definition(GO, TreeSitterGo::new, Set.of("go"), kinds, rules, ".");
    }

    static ProfileDefinition python() {
        var kinds = KindTable.builder()
                .add("definition.class", new Kind("c", "class", TYPE))
                .add("definition.function", new Kind("f", "function", true, CALLABLE, "m"))
                .add("definition.method", new Kind("m", "member", CALLABLE))
                .add("definition.variable", new Kind("v", "variable", MEMBER))
                .build();
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature("parameters", "return_type", " -> ", Set.of("definition.function")),
                new FieldRule.AccessFromNameConvention(Set.of()),
                new FieldRule.EndLine(Set.of()));
        return definition(PYTHON, TreeSitterPython::new, Set.of("py", "pyw"), kinds, rules, ".");
    }

    static ProfileDefinition javascript() {
        var kinds = KindTable.builder()
                .add("definition.class", new Kind("c", "class", TYPE))
                .add("definition.function", new Kind("f", "function", CALLABLE))
                .add("definition.generator", new Kind("g", "generator", CALLABLE))
                .add("definition.method", new Kind("m", "method", CALLABLE))
                .add("definition.property", new Kind("p", "property", MEMBER))
                .add("definition.variable", new Kind("v", "variable", MEMBER))
                .build();
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature(
                        "parameters",
                        null,
                        "",
                        Set.of("definition.function", "definition.generator", "definition.method")),
                new FieldRule.Signature("value/parameters", null, "", Set.of("definition.function")),
                new FieldRule.EndLine(Set.of()));
        var extensions = Set.of("js", "jsx", "mjs", "cjs");
        return definition(JAVASCRIPT, TreeSitterJavascript::new, extensions, kinds, rules, ".");
    }

    static ProfileDefinition rust() {
        var kinds = KindTable.builder()
                .add("definition.module", new Kind("n", "module", NAMESPACE))
                .add("definition.struct", new Kind("s", "struct", TYPE))
                .add("definition.enum", new Kind("g", "enum", TYPE))
                .add("definition.union", new Kind("u", "union", TYPE))
                .add("definition.interface", new Kind("i", "interface", TYPE))
                .add("definition.implementation", new Kind("c", "implementation", TYPE))
                .add("definition.function", new Kind("f", "function", true, CALLABLE, "P"))
                .add("definition.method", new Kind("P", "method", CALLABLE))
                .add("definition.field", new Kind("m", "field", MEMBER))
                .add("definition.variant", new Kind("e", "enumerator", MEMBER))
                .add("definition.constant", new Kind("C", "constant", MEMBER))
                .add("definition.static", new Kind("v", "variable", MEMBER))
                .add("definition.type", new Kind("t", "typedef", MEMBER))
                .add("definition.macro", new Kind("M", "macro", MEMBER))
                .build();
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature("parameters", "return_type", " -> ", Set.of("definition.function")),
                new FieldRule.AccessFromModifiers("", Set.of("visibility_modifier"), Set.of()),
                new FieldRule.EndLine(Set.of()),
                new FieldRule.TypeRef("type", Set.of("definition.field", "definition.constant", "definition.static")));
        return definition(RUST, TreeSitterRust::new, Set.of("rs"), kinds, rules, "::");
    }

    static ProfileDefinition cpp() {
        var kinds = KindTable.builder()
                .add("definition.namespace", new Kind("n", "namespace", NAMESPACE))
                .add("definition.class", new Kind("c", "class", TYPE))
                .add("definition.struct", new Kind("s", "struct", TYPE))
                .add("definition.union", new Kind("u", "union", TYPE))
                .add("definition.enum", new Kind("g", "enum", TYPE))
                .add("definition.enumerator", new Kind("e", "enumerator", MEMBER))
                .add("definition.function", new Kind("f", "function", CALLABLE))
                .add("definition.prototype", new Kind("p", "prototype", false, MEMBER, null))
                .add("definition.member", new Kind("m", "member", MEMBER))
                .add("definition.typedef", new Kind("t", "typedef", MEMBER))
                .add("definition.macro", new Kind("d", "macro", MEMBER))
                .build();
        var functions = Set.of("definition.function", "definition.prototype");
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature("declarator/parameters", null, "", functions),
                new FieldRule.EndLine(Set.of()),
                new FieldRule.TypeRef("type", functions),
                new FieldRule.TypeRef("../type", Set.of("definition.member")));
        var extensions = Set.of(
                "cc", "cpp", "CPP", "cxx", "c++", "cp", "C", "cppm", "ixx", "ii", "H", "hh", "hpp", "HPP", "hxx",
                "h++", "tcc");
        return definition(CPP, TreeSitterCpp::new, extensions, kinds, rules, "::");
    }

    static ProfileDefinition csharp() {
        var kinds = KindTable.builder()
                .add("definition.namespace", new Kind("n", "namespace", NAMESPACE))
                .add("definition.class", new Kind("c", "class", TYPE))
                .add("definition.interface", new Kind("i", "interface", TYPE))
                .add("definition.struct", new Kind("s", "struct", TYPE))
                .add("definition.enum", new Kind("g", "enum", TYPE))
                .add("definition.record", new Kind("r", "record", TYPE))
                .add("definition.enumerator", new Kind("e", "enumerator", MEMBER))
                .add("definition.method", new Kind("m", "method", CALLABLE))
                .add("definition.property", new Kind("p", "property", MEMBER))
                .build();
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature("parameters", null, "", Set.of("definition.method")),
                new FieldRule.AccessFromModifiers("", Set.of("modifier"), Set.of()),
                new FieldRule.EndLine(Set.of()));
        return definition(CSHARP, TreeSitterCSharp::new, Set.of("cs"), kinds, rules, ".");
    }

    /** C shares the C++ grammar, which is built on the C one; only the query and kind table differ. */
    static ProfileDefinition c() {
        var kinds = KindTable.builder()
                .add("definition.struct", new Kind("s", "struct", TYPE))
                .add("definition.union", new Kind("u", "union", TYPE))
                .add("definition.enum", new Kind("g", "enum", TYPE))
                .add("definition.enumerator", new Kind("e", "enumerator", MEMBER))
                .add("definition.function", new Kind("f", "function", CALLABLE))
                .add("definition.prototype", new Kind("p", "prototype", false, MEMBER, null))
                .add("definition.member", new Kind("m", "member", MEMBER))
                .add("definition.typedef", new Kind("t", "typedef", MEMBER))
                .add("definition.variable", new Kind("v", "variable", MEMBER))
                .add("definition.macro", new Kind("d", "macro", MEMBER))
                .build();
        var functions = Set.of("definition.function", "definition.prototype");
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature("declarator/parameters", null, "", functions),
                new FieldRule.EndLine(Set.of()),
                new FieldRule.TypeRef("type", functions),
                new FieldRule.TypeRef("../type", Set.of("definition.member", "definition.variable")));
        return definition(C, TreeSitterCpp::new, Set.of("c", "h", "i"), kinds, rules, "::");
    }

    static ProfileDefinition typescript() {
        // function precedes constant and variable so an arrow function bound to a const stays a function
        var kinds = KindTable.builder()
                .add("definition.namespace", new Kind("n", "namespace", NAMESPACE))
                .add("definition.class", new Kind("c", "class", TYPE))
                .add("definition.interface", new Kind("i", "interface", TYPE))
                .add("definition.enum", new Kind("g", "enum", TYPE))
                .add("definition.enumerator", new Kind("e", "enumerator", MEMBER))
                .add("definition.alias", new Kind("a", "alias", MEMBER))
                .add("definition.function", new Kind("f", "function", CALLABLE))
                .add("definition.generator", new Kind("G", "generator", CALLABLE))
                .add("definition.method", new Kind("m", "method", CALLABLE))
                .add("definition.property", new Kind("p", "property", MEMBER))
                .add("definition.constant", new Kind("C", "constant", MEMBER))
                .add("definition.variable", new Kind("v", "variable", MEMBER))
                .build();
        var callables = Set.of("definition.function", "definition.generator", "definition.method");
        var rules = ImmutableList.<FieldRule>of(
                new FieldRule.LineNumber(Set.of()),
                new FieldRule.Signature("parameters", "return_type", "", callables),
                new FieldRule.Signature("value/parameters", "value/return_type", "", Set.of("definition.function")),
                new FieldRule.AccessFromModifiers(
                        "", Set.of("accessibility_modifier"), Set.of("definition.method", "definition.property")),
                new FieldRule.EndLine(Set.of()));
        return definition(TYPESCRIPT, TreeSitterTypescript::new, Set.of("ts", "tsx", "mts", "cts"), kinds, rules, ".");
    }

    private static ProfileDefinition definition(
            String language,
            Supplier<TSLanguage> grammar,
            Set<String> extensions,
            KindTable kinds,
            ImmutableList<FieldRule> rules,
            String separator) {
        return new ProfileDefinition(
                language,
                GrammarSource.bundled(grammar),
                QuerySource.classpath(QUERY_ROOT + language + ".scm"),
                ImmutableSet.copyOf(extensions),
                kinds,
                rules,
                separator,
                AddressMode.PATTERN,
                false);
    }
}
