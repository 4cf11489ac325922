package io.github.treetags.profile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves files to language profiles by extension. Built once before any file is processed and never changed
 * afterwards, so lookups need no synchronization.
 */
public final class LanguageProfileRegistry {
    private static final Logger logger = LogManager.getLogger(LanguageProfileRegistry.class);

    private final ImmutableMap<String, LanguageProfile> byExtension;
    private final ImmutableList<LanguageProfile> profiles;
    private final ImmutableList<ProfileError> errors;

    private LanguageProfileRegistry(
            ImmutableMap<String, LanguageProfile> byExtension,
            ImmutableList<LanguageProfile> profiles,
            ImmutableList<ProfileError> errors) {
        this.byExtension = byExtension;
        this.profiles = profiles;
        this.errors = errors;
    }

    /**
     * Compiles every definition. User definitions take over the extensions they claim; a definition that fails to
     * compile is recorded as a {@link ProfileError} and leaves whatever profile already served its extensions.
     */
    public static LanguageProfileRegistry load(List<ProfileDefinition> builtIns, List<ProfileDefinition> userDefined) {
        var byExtension = new LinkedHashMap<String, LanguageProfile>();
        var loaded = new ArrayList<LanguageProfile>();
        var errors = new ArrayList<ProfileError>();

        for (var definition : builtIns) {
            compileInto(definition, byExtension, loaded, errors);
        }
        for (var definition : userDefined) {
            compileInto(definition.asUserDefined(), byExtension, loaded, errors);
        }

        logger.debug(
                "Loaded {} language profiles covering {} extensions ({} failed)",
                loaded.size(),
                byExtension.size(),
                errors.size());
        return new LanguageProfileRegistry(
                ImmutableMap.copyOf(byExtension), ImmutableList.copyOf(loaded), ImmutableList.copyOf(errors));
    }

    private static void compileInto(
            ProfileDefinition definition,
            Map<String, LanguageProfile> byExtension,
            List<LanguageProfile> loaded,
            List<ProfileError> errors) {
        LanguageProfile profile;
        try {
            profile = definition.compile();
        } catch (ProfileLoadException e) {
            logger.error("Failed to load language profile {}: {}", definition.language(), e.getMessage());
            errors.add(new ProfileError(definition.language(), e));
            return;
        }
        for (String ext : profile.extensions()) {
            var previous = byExtension.put(ext, profile);
            if (previous != null) {
                logger.debug("Extension .{} moves from {} to {}", ext, previous.language(), profile.language());
            }
        }
        loaded.add(profile);
    }

    public Optional<LanguageProfile> resolve(Path file) {
        return extensionOf(file).map(byExtension::get);
    }

    /** Case-sensitive extension after the last dot of the file name; none for dotfiles and extensionless names. */
    static Optional<String> extensionOf(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(name.substring(dot + 1));
    }

    public Optional<LanguageProfile> forLanguage(String language) {
        return profiles.reverse().stream()
                .filter(p -> p.language().equalsIgnoreCase(language))
                .filter(byExtension::containsValue)
                .findFirst();
    }

    public List<LanguageProfile> profiles() {
        return profiles;
    }

    public List<ProfileError> errors() {
        return errors;
    }
}
