package io.github.treetags.profile;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableSet;
import io.github.treetags.testutil.TestProfiles;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LanguageProfileRegistryTest {

    @Test
    void everyBuiltInProfileCompiles() {
        var registry = LanguageProfileRegistry.load(BuiltInProfiles.all(), List.of());

        assertTrue(registry.errors().isEmpty(), () -> registry.errors().toString());
        assertEquals(
                List.of("java", "go", "python", "javascript", "rust", "cpp", "csharp", "c", "typescript"),
                registry.profiles().stream().map(LanguageProfile::language).toList());
    }

    @Test
    void resolvesByCaseSensitiveExtension() {
        var registry = TestProfiles.builtIns();

        assertEquals("cpp", registry.resolve(Path.of("src/a.C")).orElseThrow().language());
        assertEquals("cpp", registry.resolve(Path.of("include/a.hpp")).orElseThrow().language());
        assertEquals("python", registry.resolve(Path.of("tool.pyw")).orElseThrow().language());
        assertEquals("javascript", registry.resolve(Path.of("index.mjs")).orElseThrow().language());
        assertEquals("c", registry.resolve(Path.of("include/a.h")).orElseThrow().language());
        assertEquals("c", registry.resolve(Path.of("main.c")).orElseThrow().language());
        assertEquals("typescript", registry.resolve(Path.of("view.tsx")).orElseThrow().language());
        assertTrue(registry.resolve(Path.of("README")).isEmpty());
        assertTrue(registry.resolve(Path.of("notes.txt")).isEmpty());
        assertTrue(registry.resolve(Path.of("Main.JAVA")).isEmpty());
    }

    @Test
    void extensionRules() {
        assertEquals(Optional.of("go"), LanguageProfileRegistry.extensionOf(Path.of("a.b.go")));
        assertEquals(Optional.empty(), LanguageProfileRegistry.extensionOf(Path.of(".gitignore")));
        assertEquals(Optional.empty(), LanguageProfileRegistry.extensionOf(Path.of("trailing.")));
    }

    @Test
    void userProfileTakesOverExtensions() {
        var user = BuiltInProfiles.python()
                .withExtensions(ImmutableSet.of("py", "star"))
                .withAddressMode(AddressMode.LINE);

        var registry = LanguageProfileRegistry.load(BuiltInProfiles.all(), List.of(user));

        var resolved = registry.resolve(Path.of("BUILD.star")).orElseThrow();
        assertTrue(resolved.isUserDefined());
        assertEquals(AddressMode.LINE, resolved.addressMode());
        assertSame(resolved, registry.resolve(Path.of("x.py")).orElseThrow());
        assertFalse(registry.resolve(Path.of("x.pyw")).orElseThrow().isUserDefined());
        assertSame(resolved, registry.forLanguage("python").orElseThrow());
    }

    @Test
    void brokenUserQueryKeepsBuiltInProfile() {
        var broken = BuiltInProfiles.go().withQuery(QuerySource.literal("(function_declaration name: @name"));

        var registry = LanguageProfileRegistry.load(BuiltInProfiles.all(), List.of(broken));

        assertEquals(1, registry.errors().size());
        var error = registry.errors().get(0);
        assertEquals("go", error.language());
        assertInstanceOf(ProfileLoadException.class, error.cause());
        assertTrue(error.describe().startsWith("language go disabled"));
        assertFalse(registry.resolve(Path.of("main.go")).orElseThrow().isUserDefined());
    }

    @Test
    void unknownNodeTypeInQueryIsAProfileError() {
        var bad = BuiltInProfiles.rust().withQuery(QuerySource.literal("(no_such_node) @definition.thing"));
        var registry = LanguageProfileRegistry.load(List.of(bad), List.of());

        assertEquals(1, registry.errors().size());
        assertTrue(registry.resolve(Path.of("lib.rs")).isEmpty());
    }

    @Test
    void grammarThatFailsToLoadIsAProfileError() {
        var missing = BuiltInProfiles.java()
                .withGrammar(GrammarSource.fromClass("org.treesitter.TreeSitterNoSuchLanguage", null));
        var registry = LanguageProfileRegistry.load(List.of(missing), List.of());

        assertEquals(1, registry.errors().size());
        assertTrue(registry.errors().get(0).describe().contains("grammar class not found"));
        assertTrue(registry.profiles().isEmpty());
    }

    @Test
    void languageAliases() {
        assertEquals("cpp", BuiltInProfiles.forLanguage("C++").orElseThrow().language());
        assertEquals("csharp", BuiltInProfiles.forLanguage("c#").orElseThrow().language());
        assertEquals("c", BuiltInProfiles.forLanguage("C").orElseThrow().language());
        assertEquals("typescript", BuiltInProfiles.forLanguage("ts").orElseThrow().language());
        assertEquals("javascript", BuiltInProfiles.forLanguage("JS").orElseThrow().language());
        assertTrue(BuiltInProfiles.forLanguage("cobol").isEmpty());
    }
}
