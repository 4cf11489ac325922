package io.github.treetags;

import io.github.treetags.config.TagsConfig;
import io.github.treetags.config.UserGrammarsConfig;
import io.github.treetags.dispatch.DispatchResult;
import io.github.treetags.dispatch.ParallelDispatcher;
import io.github.treetags.files.FileFinder;
import io.github.treetags.files.ShellPatterns;
import io.github.treetags.files.SourceFile;
import io.github.treetags.files.TagDestination;
import io.github.treetags.files.TagFileLocator;
import io.github.treetags.normalize.NormalizeOptions;
import io.github.treetags.normalize.TagNormalizer;
import io.github.treetags.profile.BuiltInProfiles;
import io.github.treetags.profile.LanguageProfileRegistry;
import io.github.treetags.profile.ProfileError;
import io.github.treetags.profile.UserProfiles;
import io.github.treetags.store.TagFileException;
import io.github.treetags.store.TagFileReader;
import io.github.treetags.store.TagMerger;
import io.github.treetags.store.TagStore;
import io.github.treetags.tags.TagFile;
import io.github.treetags.writer.TagFileWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * One complete run: locate the tag file, read it back in append mode, discover inputs, tag them in parallel, merge
 * and write.
 *
 * <p>Append-target problems are detected before any file is parsed.
 */
public final class TagGenerator {
    private static final Logger logger = LogManager.getLogger(TagGenerator.class);

    private final Function<TagsConfig, LoadedProfiles> profileLoader;
    private final OutputStream stdout;

    /** Registry plus the user registrations that could not even be turned into definitions. */
    public record LoadedProfiles(LanguageProfileRegistry registry, List<ProfileError> configErrors) {}

    public TagGenerator() {
        this(TagGenerator::loadProfiles, System.out);
    }

    public TagGenerator(Function<TagsConfig, LoadedProfiles> profileLoader, OutputStream stdout) {
        this.profileLoader = profileLoader;
        this.stdout = stdout;
    }

    public RunReport run(TagsConfig config) throws TagFileException, IOException {
        Path cwd = config.workingDirectory();
        TagDestination destination = TagFileLocator.locate(config.tagFile(), cwd, config.append());
        @Nullable TagFile existing = null;
        if (config.append()) {
            existing = TagFileReader.read(((TagDestination.File) destination).path());
        }

        LoadedProfiles profiles = profileLoader.apply(config);
        var registry = profiles.registry();

        var finder = new FileFinder(ShellPatterns.compile(config.excludes(), cwd), cwd);
        List<Path> inputs = config.inputs().stream().map(cwd::resolve).toList();
        @Nullable Path tagPath = destination instanceof TagDestination.File f ? f.path() : null;
        List<SourceFile> files = new ArrayList<>();
        for (Path p : finder.find(inputs, destination.baseDir(), tagPath)) {
            files.add(SourceFile.of(destination.baseDir(), p, cwd));
        }
        logger.debug("Tagging {} files with {} workers", files.size(), config.workers());

        var normalizer = new TagNormalizer(new NormalizeOptions(
                config.fields(), config.extras(), config.kindSpecs(), config.addressOverride()));
        DispatchResult result = new ParallelDispatcher(registry, normalizer, config.workers()).run(files);

        TagStore store;
        if (existing != null) {
            Set<String> regenerated = new LinkedHashSet<>();
            files.forEach(f -> regenerated.add(f.tagPath()));
            store = TagMerger.merge(existing, regenerated, result.tags());
        } else {
            store = new TagStore();
            store.add(result.tags());
        }

        var writer = new TagFileWriter(config.sort(), config.fields().kindStyle());
        if (destination instanceof TagDestination.File f) {
            writer.write(store.tags(), f.path());
        } else {
            writer.write(store.tags(), stdout);
        }

        var profileErrors = new ArrayList<ProfileError>(profiles.configErrors());
        profileErrors.addAll(registry.errors());
        return new RunReport(
                destination,
                store.size(),
                result.processed(),
                result.skipped(),
                result.errors(),
                List.copyOf(profileErrors));
    }

    public static LoadedProfiles loadProfiles(TagsConfig config) {
        Path configPath = config.userConfig() != null
                ? config.workingDirectory().resolve(config.userConfig())
                : UserGrammarsConfig.defaultPath(System.getenv());
        var user = UserProfiles.from(UserGrammarsConfig.load(configPath));
        var registry = LanguageProfileRegistry.load(BuiltInProfiles.all(), user.definitions());
        return new LoadedProfiles(registry, user.errors());
    }
}
