package io.github.treetags.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class AtomicWrites {
    /**
     * Replaces the content of a file with the provided bytes.
     *
     * <p>The bytes are written to a temporary file in the same directory as the target, which is then moved over the
     * target in one step. If the filesystem cannot move atomically a plain replacing move is used. Until the move
     * happens the previous content of {@code targetPath} is untouched.
     *
     * @param targetPath the file to overwrite
     * @param content the complete new content
     * @throws IOException if writing or moving fails; the temporary file is removed in that case
     */
    public static void atomicOverwrite(Path targetPath, byte[] content) throws IOException {
        Path dir = targetPath.toAbsolutePath().getParent();
        Path tempFile = Files.createTempFile(dir, "." + targetPath.getFileName() + "-", ".tmp");

        try {
            Files.write(tempFile, content);

            try {
                Files.move(tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }
}
