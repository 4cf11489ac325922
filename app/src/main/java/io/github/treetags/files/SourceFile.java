package io.github.treetags.files;

import java.io.File;
import java.nio.file.Path;

/**
 * An input file together with the name it carries inside the tag file. Names are relative to the tag file's
 * directory with {@code /} separators; files outside that directory keep the path they were given as.
 */
public record SourceFile(Path absPath, String tagPath) {
    public SourceFile {
        if (!absPath.isAbsolute()) {
            throw new IllegalArgumentException("path must be absolute, got " + absPath);
        }
        if (tagPath.isEmpty()) {
            throw new IllegalArgumentException("tag path must not be empty");
        }
    }

    /**
     * @param tagDir directory holding the tag file, absolute and normalized
     * @param given the path as found during discovery, absolute or relative to the working directory
     * @param workingDir the directory relative paths were given against
     */
    public static SourceFile of(Path tagDir, Path given, Path workingDir) {
        Path abs = (given.isAbsolute() ? given : workingDir.resolve(given)).normalize();
        String tagPath;
        if (abs.startsWith(tagDir) && !abs.equals(tagDir)) {
            tagPath = tagDir.relativize(abs).toString();
        } else {
            tagPath = given.toString();
        }
        return new SourceFile(abs, toTagSeparators(tagPath));
    }

    static String toTagSeparators(String path) {
        return File.separatorChar == '/' ? path : path.replace(File.separatorChar, '/');
    }

    public String extension() {
        String name = absPath.getFileName().toString();
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1) : "";
    }
}
