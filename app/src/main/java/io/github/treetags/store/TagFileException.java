package io.github.treetags.store;

import java.nio.file.Path;

/** The existing tag file an append run would extend is missing or not a tag file. */
public class TagFileException extends Exception {
    private final Path path;

    public TagFileException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public TagFileException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
