package io.github.treetags.profile;

import static org.junit.jupiter.api.Assertions.*;

import io.github.treetags.config.UserGrammar;
import io.github.treetags.config.UserGrammarsConfig;
import io.github.treetags.engine.ParseQueryEngine;
import io.github.treetags.normalize.NormalizeOptions;
import io.github.treetags.normalize.TagNormalizer;
import io.github.treetags.tags.Tag;
import io.github.treetags.tags.TagAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UserProfilesTest {

    @TempDir
    Path tempDir;

    private static UserGrammar grammar(
            String language, String queryFile, List<String> extensions, String address, Map<String, String> kinds) {
        return new UserGrammar(language, null, null, queryFile, extensions, address, kinds);
    }

    @Test
    void registrationForBuiltInLanguageFillsGapsFromIt() throws Exception {
        Files.writeString(
                tempDir.resolve("funcs.scm"), "(function_definition name: (identifier) @name) @definition.function\n");
        var config = new UserGrammarsConfig(
                List.of(grammar("Python", "funcs.scm", List.of(".star"), "number", null)), tempDir);

        var result = UserProfiles.from(config);

        assertTrue(result.errors().isEmpty(), () -> result.errors().toString());
        var registry = LanguageProfileRegistry.load(BuiltInProfiles.all(), result.definitions());
        var profile = registry.resolve(Path.of("rules.star")).orElseThrow();
        assertEquals("python", profile.language());
        assertEquals(AddressMode.LINE, profile.addressMode());
        assertTrue(profile.isUserDefined());

        byte[] source = "class Skipped:\n    pass\n\ndef build():\n    pass\n".getBytes(StandardCharsets.UTF_8);
        var query = new ParseQueryEngine().parseAndQuery(source, profile);
        List<Tag> tags = new TagNormalizer(NormalizeOptions.defaults()).normalize(query, profile, "rules.star");
        assertEquals(List.of("build"), tags.stream().map(Tag::name).toList());
        assertEquals(new TagAddress.LineNumber(4), tags.get(0).address());
    }

    @Test
    void explicitKindsBuildATable() throws Exception {
        var kinds = new LinkedHashMap<String, String>();
        kinds.put("definition.class", "C:klass");
        kinds.put("definition.function", "F:fun");
        kinds.put("definition.constant", "K");

        var table = UserProfiles.parseKinds("toy", kinds);

        assertEquals(List.of("definition.class", "definition.function", "definition.constant"), table.captureNames());
        var klass = table.lookup("definition.class").orElseThrow();
        assertEquals("klass", klass.name());
        assertEquals(TagRole.TYPE, klass.role());
        assertEquals(TagRole.CALLABLE, table.lookup("definition.function").orElseThrow().role());
        assertEquals("constant", table.byCode("K").orElseThrow().name());
        assertThrows(ProfileLoadException.class, () -> UserProfiles.parseKinds("toy", Map.of("definition.x", ":x")));
    }

    @Test
    void unknownLanguageNeedsQueryAndExtensions() {
        var noQuery = grammar("toy", null, List.of("toy"), null, null);
        var noExtensions = new UserGrammar("toy2", "org.example.Toy", null, "toy.scm", null, null, null);
        var unnamed = grammar(" ", null, null, null, null);

        var result = UserProfiles.from(new UserGrammarsConfig(List.of(noQuery, noExtensions, unnamed), tempDir));

        assertTrue(result.definitions().isEmpty());
        assertEquals(List.of("toy", "toy2", "<unnamed>"),
                result.errors().stream().map(ProfileError::language).toList());
    }

    @Test
    void unknownLanguageWithMissingGrammarFailsAtLoad() throws Exception {
        Files.writeString(tempDir.resolve("toy.scm"), "(identifier) @name\n");
        var toy = grammar("toy", "toy.scm", List.of("toy"), null, null);

        var result = UserProfiles.from(new UserGrammarsConfig(List.of(toy), tempDir));
        assertEquals(1, result.definitions().size());
        assertEquals(KindTable.generic().captureNames(), result.definitions().get(0).kinds().captureNames());

        var registry = LanguageProfileRegistry.load(List.of(), result.definitions());
        assertEquals(1, registry.errors().size());
        assertTrue(registry.errors().get(0).describe().contains("org.treesitter.TreeSitterToy"));
    }

    @Test
    void rolesComeFromTheLastCaptureSegment() {
        assertEquals(TagRole.TYPE, UserProfiles.roleFor("definition.class"));
        assertEquals(TagRole.NAMESPACE, UserProfiles.roleFor("definition.module"));
        assertEquals(TagRole.CALLABLE, UserProfiles.roleFor("definition.method"));
        assertEquals(TagRole.MEMBER, UserProfiles.roleFor("definition.class.field"));
        assertEquals(TagRole.MEMBER, UserProfiles.roleFor(null));
        assertEquals("org.treesitter.TreeSitterCSharp", GrammarSource.defaultClassName("c_sharp"));
    }
}
