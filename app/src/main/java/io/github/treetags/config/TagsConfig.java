package io.github.treetags.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.treetags.dispatch.ParallelDispatcher;
import io.github.treetags.profile.AddressMode;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Fully resolved settings of one run. The pipeline never parses arguments itself; front ends build one of these.
 *
 * @param tagFile tag file name or path, {@code -} for standard output
 * @param inputs files and directories to tag; empty means the tag file's directory
 * @param kindSpecs {@code --kinds} values keyed by language name
 * @param addressOverride forces line-number or pattern addresses for every language, null for per-language defaults
 * @param userConfig user grammar configuration file, null for the default location
 * @param workingDirectory directory relative inputs and tag file names are resolved against
 */
public record TagsConfig(
        String tagFile,
        boolean append,
        ImmutableList<Path> inputs,
        int workers,
        boolean sort,
        ImmutableList<String> excludes,
        FieldsConfig fields,
        ExtrasConfig extras,
        ImmutableMap<String, String> kindSpecs,
        @Nullable AddressMode addressOverride,
        @Nullable Path userConfig,
        Path workingDirectory) {

    public static final String DEFAULT_TAG_FILE = "tags";

    public TagsConfig {
        if (tagFile.isEmpty()) {
            throw new IllegalArgumentException("tag file name must not be empty");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("worker count must be >= 1, got " + workers);
        }
    }

    public static Builder builder(Path workingDirectory) {
        return new Builder(workingDirectory);
    }

    public static final class Builder {
        private final Path workingDirectory;
        private String tagFile = DEFAULT_TAG_FILE;
        private boolean append = false;
        private List<Path> inputs = List.of();
        private int workers = ParallelDispatcher.DEFAULT_WORKERS;
        private boolean sort = true;
        private List<String> excludes = List.of();
        private FieldsConfig fields = FieldsConfig.defaults();
        private ExtrasConfig extras = ExtrasConfig.none();
        private Map<String, String> kindSpecs = Map.of();
        private @Nullable AddressMode addressOverride;
        private @Nullable Path userConfig;

        private Builder(Path workingDirectory) {
            this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
        }

        public Builder tagFile(String tagFile) {
            this.tagFile = tagFile;
            return this;
        }

        public Builder append(boolean append) {
            this.append = append;
            return this;
        }

        public Builder inputs(List<Path> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder sort(boolean sort) {
            this.sort = sort;
            return this;
        }

        public Builder excludes(List<String> excludes) {
            this.excludes = excludes;
            return this;
        }

        public Builder fields(FieldsConfig fields) {
            this.fields = fields;
            return this;
        }

        public Builder extras(ExtrasConfig extras) {
            this.extras = extras;
            return this;
        }

        public Builder kindSpecs(Map<String, String> kindSpecs) {
            this.kindSpecs = kindSpecs;
            return this;
        }

        public Builder addressOverride(@Nullable AddressMode addressOverride) {
            this.addressOverride = addressOverride;
            return this;
        }

        public Builder userConfig(@Nullable Path userConfig) {
            this.userConfig = userConfig;
            return this;
        }

        public TagsConfig build() {
            return new TagsConfig(
                    tagFile,
                    append,
                    ImmutableList.copyOf(inputs),
                    workers,
                    sort,
                    ImmutableList.copyOf(excludes),
                    fields,
                    extras,
                    ImmutableMap.copyOf(kindSpecs),
                    addressOverride,
                    userConfig,
                    workingDirectory);
        }
    }
}
