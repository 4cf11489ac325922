package io.github.treetags.files;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Expands input paths into the ordered list of candidate files. Directories are walked recursively in sorted order;
 * excluded directories are not entered. Paths are tested against the exclude patterns relative to the working
 * directory when they lie inside it, with {@code /} separators.
 */
public final class FileFinder {
    private static final Logger logger = LogManager.getLogger(FileFinder.class);

    private final List<Pattern> excludes;
    private final Path workingDir;

    public FileFinder(List<Pattern> excludes, Path workingDir) {
        this.excludes = List.copyOf(excludes);
        this.workingDir = workingDir.toAbsolutePath().normalize();
    }

    /**
     * @param inputs files and directories, absolute
     * @param defaultRoot walked when {@code inputs} is empty
     * @param tagFile never returned as an input
     */
    public List<Path> find(List<Path> inputs, Path defaultRoot, @Nullable Path tagFile) throws IOException {
        List<Path> roots = inputs.isEmpty() ? List.of(defaultRoot) : inputs;
        Set<Path> found = new LinkedHashSet<>();
        for (Path root : roots) {
            Path normalized = root.toAbsolutePath().normalize();
            if (Files.isDirectory(normalized)) {
                found.addAll(walk(normalized));
            } else if (Files.isRegularFile(normalized)) {
                if (!isExcluded(normalized)) {
                    found.add(normalized);
                }
            } else {
                logger.warn("Input {} does not exist, ignoring it", root);
            }
        }
        if (tagFile != null) {
            found.remove(tagFile.toAbsolutePath().normalize());
        }
        logger.debug("Found {} candidate files", found.size());
        return new ArrayList<>(found);
    }

    private List<Path> walk(Path dir) throws IOException {
        var files = new ArrayList<Path>();
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                if (!d.equals(dir) && isExcluded(d)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !isExcluded(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    private boolean isExcluded(Path path) {
        if (excludes.isEmpty()) {
            return false;
        }
        Path shown = path.startsWith(workingDir) && !path.equals(workingDir) ? workingDir.relativize(path) : path;
        return ShellPatterns.matchesAny(excludes, SourceFile.toTagSeparators(shown.toString()));
    }
}
