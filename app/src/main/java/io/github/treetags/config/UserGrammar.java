package io.github.treetags.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** One {@code [[user_grammars]]} table of the configuration file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserGrammar(
        @JsonProperty("language_name") @Nullable String languageName,
        @JsonProperty("grammar_class") @Nullable String grammarClass,
        @JsonProperty("grammar_lib_path") @Nullable String grammarLibPath,
        @JsonProperty("query_file_path") @Nullable String queryFilePath,
        @JsonProperty("extensions") @Nullable List<String> extensions,
        @JsonProperty("address") @Nullable String address,
        @JsonProperty("kinds") @Nullable Map<String, String> kinds) {}
