package io.github.treetags.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * User grammar registrations read from {@code config.toml}. Relative paths inside the file are resolved against
 * {@link #baseDir()}.
 */
public record UserGrammarsConfig(List<UserGrammar> userGrammars, Path baseDir) {
    private static final Logger logger = LogManager.getLogger(UserGrammarsConfig.class);

    private static final TomlMapper MAPPER = new TomlMapper();

    public UserGrammarsConfig {
        userGrammars = List.copyOf(userGrammars);
    }

    public static UserGrammarsConfig empty() {
        return new UserGrammarsConfig(List.of(), Path.of("").toAbsolutePath());
    }

    /**
     * {@code $XDG_CONFIG_HOME/treetags/config.toml}, falling back to {@code ~/.config/treetags/config.toml}.
     */
    public static Path defaultPath(Map<String, String> env) {
        String xdg = env.get("XDG_CONFIG_HOME");
        Path base = xdg != null && !xdg.isBlank()
                ? Path.of(xdg)
                : Path.of(System.getProperty("user.home"), ".config");
        return base.resolve("treetags").resolve("config.toml");
    }

    /** A missing file yields no grammars; an unreadable or malformed one is logged and ignored. */
    public static UserGrammarsConfig load(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        Path baseDir = absolute.getParent() == null ? absolute : absolute.getParent();
        if (!Files.isRegularFile(absolute)) {
            logger.debug("No user grammar config at {}", absolute);
            return new UserGrammarsConfig(List.of(), baseDir);
        }
        try {
            var file = MAPPER.readValue(absolute.toFile(), ConfigFile.class);
            var grammars = file.userGrammars() == null ? List.<UserGrammar>of() : file.userGrammars();
            logger.debug("Read {} user grammars from {}", grammars.size(), absolute);
            return new UserGrammarsConfig(grammars, baseDir);
        } catch (IOException e) {
            logger.warn("Ignoring unreadable config {}: {}", absolute, e.getMessage());
            return new UserGrammarsConfig(List.of(), baseDir);
        }
    }

    /** Resolves {@code path} against the config directory unless it is absolute. */
    public Path resolve(String path) {
        Path p = Path.of(path);
        return p.isAbsolute() ? p : baseDir.resolve(p).normalize();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConfigFile(@JsonProperty("user_grammars") @Nullable List<UserGrammar> userGrammars) {}
}
