package io.github.treetags.profile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Produces the tag query text of a profile. */
@FunctionalInterface
public interface QuerySource {

    String load(String language) throws ProfileLoadException;

    static QuerySource classpath(String resource) {
        return language -> {
            try (InputStream in = QuerySource.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new ProfileLoadException(language, "query resource not found: " + resource);
                }
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ProfileLoadException(language, "failed to read query resource " + resource, e);
            }
        };
    }

    static QuerySource file(Path path) {
        return language -> {
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ProfileLoadException(language, "failed to read query file " + path, e);
            }
        };
    }

    static QuerySource literal(String query) {
        return language -> query;
    }
}
