package io.github.treetags.files;

import static org.junit.jupiter.api.Assertions.*;

import io.github.treetags.store.TagFileException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TagFileLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void dashMeansStandardOutput() throws Exception {
        assertEquals(new TagDestination.Stdout(tempDir), TagFileLocator.locate("-", tempDir, false));
        assertThrows(TagFileException.class, () -> TagFileLocator.locate("-", tempDir, true));
    }

    @Test
    void findsTagFileInAParentDirectory() throws Exception {
        Path nested = Files.createDirectories(tempDir.resolve("a/b"));
        Files.writeString(tempDir.resolve("tags"), "");

        var found = TagFileLocator.locate("tags", nested, true);

        assertEquals(new TagDestination.File(tempDir.resolve("tags"), true), found);
        assertEquals(tempDir, found.baseDir());
    }

    @Test
    void freshRunWithoutExistingFileWritesInWorkingDirectory() throws Exception {
        var found = TagFileLocator.locate("treetags.idx", tempDir, false);
        assertEquals(new TagDestination.File(tempDir.resolve("treetags.idx"), false), found);
    }

    @Test
    void appendWithoutExistingFileIsFatal() {
        var ex = assertThrows(
                TagFileException.class, () -> TagFileLocator.locate("treetags.idx", tempDir, true));
        assertEquals(tempDir.resolve("treetags.idx"), ex.getPath());
    }

    @Test
    void pathsWithDirectoriesAreTakenAsGiven() throws Exception {
        Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(tempDir.resolve("tags"), "");

        var found = TagFileLocator.locate("out/tags", tempDir, false);

        assertEquals(new TagDestination.File(tempDir.resolve("out/tags"), false), found);
        assertEquals(tempDir.resolve("out"), found.baseDir());
        assertThrows(TagFileException.class, () -> TagFileLocator.locate("out/tags", tempDir, true));
    }
}
