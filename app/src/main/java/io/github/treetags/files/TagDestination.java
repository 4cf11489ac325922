package io.github.treetags.files;

import java.nio.file.Path;

/** Where the tag file goes. */
public sealed interface TagDestination {

    /** Directory tag file names are made relative to. */
    Path baseDir();

    record Stdout(Path baseDir) implements TagDestination {}

    record File(Path path, boolean exists) implements TagDestination {
        @Override
        public Path baseDir() {
            Path parent = path.getParent();
            return parent == null ? path : parent;
        }
    }
}
