package io.github.treetags.files;

import io.github.treetags.store.TagFileException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Finds the tag file to write. A bare file name is looked up in the working directory and then in each parent, the
 * way editors look for {@code tags}; a name with a directory part is taken as given. {@code -} means standard
 * output.
 */
public final class TagFileLocator {
    public static final String STDOUT = "-";

    private TagFileLocator() {}

    public static TagDestination locate(String name, Path workingDir, boolean append) throws TagFileException {
        Path cwd = workingDir.toAbsolutePath().normalize();
        if (name.equals(STDOUT)) {
            if (append) {
                throw new TagFileException(Path.of(STDOUT), "cannot append to standard output");
            }
            return new TagDestination.Stdout(cwd);
        }
        Path given = Path.of(name);
        if (given.isAbsolute() || given.getNameCount() > 1) {
            Path path = cwd.resolve(given).normalize();
            boolean exists = Files.isRegularFile(path);
            if (append && !exists) {
                throw new TagFileException(path, "tag file does not exist");
            }
            return new TagDestination.File(path, exists);
        }

        for (Path dir = cwd; dir != null; dir = dir.getParent()) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return new TagDestination.File(candidate, true);
            }
        }
        if (append) {
            throw new TagFileException(cwd.resolve(name), "no tag file named " + name + " in " + cwd + " or its parents");
        }
        return new TagDestination.File(cwd.resolve(name), false);
    }
}
