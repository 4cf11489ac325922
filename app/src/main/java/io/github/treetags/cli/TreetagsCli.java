package io.github.treetags.cli;

import io.github.treetags.RunReport;
import io.github.treetags.TagGenerator;
import io.github.treetags.config.BooleanValues;
import io.github.treetags.config.ExtrasConfig;
import io.github.treetags.config.FieldsConfig;
import io.github.treetags.config.TagsConfig;
import io.github.treetags.dispatch.FileError;
import io.github.treetags.dispatch.ParallelDispatcher;
import io.github.treetags.profile.AddressMode;
import io.github.treetags.profile.ProfileError;
import io.github.treetags.store.TagFileException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "treetags",
        mixinStandardHelpOptions = true,
        version = "treetags 0.1.0",
        description = "Generates ctags-compatible tag files from tree-sitter grammars and tag queries.")
public final class TreetagsCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TreetagsCli.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = "-f",
            paramLabel = "FILE",
            description = "Tag file to write, '-' for standard output. Default: ${DEFAULT-VALUE}.")
    private String tagFile = TagsConfig.DEFAULT_TAG_FILE;

    @CommandLine.Option(
            names = {"-a", "--append"},
            arity = "0..1",
            fallbackValue = "yes",
            paramLabel = "yes|no",
            description = "Add to an existing tag file, replacing the tags of the given files.")
    @Nullable
    private String append;

    @CommandLine.Option(
            names = "--sort",
            arity = "0..1",
            fallbackValue = "yes",
            paramLabel = "yes|no",
            description = "Sort tags by name. Default: yes.")
    @Nullable
    private String sort;

    @CommandLine.Option(
            names = {"-j", "--workers"},
            paramLabel = "N",
            description = "Number of files parsed in parallel. Default: ${DEFAULT-VALUE}.")
    private int workers = ParallelDispatcher.DEFAULT_WORKERS;

    @CommandLine.Option(
            names = "--exclude",
            paramLabel = "PATTERN",
            description = "Skip files and directories matching a shell pattern, or listed in @FILE. Can be repeated.")
    private List<String> excludes = new ArrayList<>();

    @CommandLine.Option(
            names = "--fields",
            paramLabel = "SPEC",
            description = "Extension fields to write, e.g. nksSaet or +n-k.")
    @Nullable
    private String fields;

    @CommandLine.Option(names = "--extras", paramLabel = "SPEC", description = "Extra entries: q qualified, f file.")
    @Nullable
    private String extras;

    @CommandLine.Option(
            names = "--kinds",
            paramLabel = "LANG=SPEC",
            description = "Kinds to emit for a language, e.g. go=fs or python=+v. Can be repeated.")
    private Map<String, String> kinds = new LinkedHashMap<>();

    @CommandLine.Option(names = "--excmd", paramLabel = "number|pattern", description = "Address form for every tag.")
    @Nullable
    private String excmd;

    @CommandLine.Option(names = "--config", paramLabel = "FILE", description = "User grammar configuration (TOML).")
    @Nullable
    private Path configPath;

    @CommandLine.Option(names = "--verbose", description = "Log debug output to stderr.")
    private boolean verbose = false;

    // Accepted for editor plugins that pass ctags options blindly
    @CommandLine.Option(names = "--options", hidden = true)
    private List<String> ignoredOptions = new ArrayList<>();

    @CommandLine.Option(names = "--format", hidden = true)
    @Nullable
    private String ignoredFormat;

    @CommandLine.Option(names = "--language-force", hidden = true)
    @Nullable
    private String ignoredLanguage;

    @CommandLine.Parameters(paramLabel = "FILE|DIR", description = "Files and directories to tag.")
    private List<Path> inputs = new ArrayList<>();

    private final Path workingDirectory;
    private final TagGenerator generator;

    public TreetagsCli() {
        this(Path.of("").toAbsolutePath(), new TagGenerator());
    }

    public TreetagsCli(Path workingDirectory, TagGenerator generator) {
        this.workingDirectory = workingDirectory;
        this.generator = generator;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TreetagsCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }
        PrintWriter err = spec.commandLine().getErr();
        TagsConfig config = toConfig();
        logger.debug("Resolved configuration: {}", config);

        RunReport report;
        try {
            report = generator.run(config);
        } catch (TagFileException e) {
            err.println("treetags: " + e.getMessage());
            err.flush();
            return 1;
        } catch (IOException e) {
            logger.error("Tag generation failed", e);
            err.println("treetags: " + e.getMessage());
            err.flush();
            return 1;
        }

        for (ProfileError error : report.profileErrors()) {
            err.println("treetags: warning: " + error.describe());
        }
        for (FileError error : report.fileErrors()) {
            err.println("treetags: warning: " + error.describe());
        }
        err.flush();
        return 0;
    }

    TagsConfig toConfig() {
        if (workers < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--workers must be at least 1");
        }
        var files = new ArrayList<Path>();
        boolean appendFlag = flagValue(append, false, files);
        boolean sortFlag = flagValue(sort, true, files);
        files.addAll(inputs);

        @Nullable AddressMode addressOverride = null;
        if (excmd != null) {
            addressOverride = AddressMode.parse(excmd)
                    .orElseThrow(() -> new CommandLine.ParameterException(
                            spec.commandLine(), "--excmd must be 'number' or 'pattern', got '" + excmd + "'"));
        }
        if (ignoredFormat != null || ignoredLanguage != null || !ignoredOptions.isEmpty()) {
            logger.debug("Ignoring --format, --language-force and --options");
        }

        return TagsConfig.builder(workingDirectory)
                .tagFile(tagFile)
                .append(appendFlag)
                .sort(sortFlag)
                .inputs(files)
                .workers(workers)
                .excludes(excludes)
                .fields(fields == null ? FieldsConfig.defaults() : FieldsConfig.parse(fields))
                .extras(extras == null ? ExtrasConfig.none() : ExtrasConfig.parse(extras))
                .kindSpecs(kinds)
                .addressOverride(addressOverride)
                .userConfig(configPath)
                .build();
    }

    /**
     * Resolves a {@code --flag[=value]} option. A value that is not a boolean is an input file swallowed by the
     * optional argument ({@code --append file.c}), so it goes back to the inputs and the flag is on.
     */
    private static boolean flagValue(@Nullable String value, boolean absent, List<Path> files) {
        if (value == null) {
            return absent;
        }
        Optional<Boolean> parsed = BooleanValues.parse(value);
        if (parsed.isPresent()) {
            return parsed.get();
        }
        files.add(Path.of(value));
        return true;
    }
}
