package io.github.treetags.dispatch;

import io.github.treetags.engine.EngineException;
import java.nio.file.Path;

/** A file that produced no tags because processing it failed. Other files are unaffected. */
public record FileError(Path path, Throwable cause) {
    public String describe() {
        String reason;
        if (cause instanceof EngineException ee && ee.getKind() == EngineException.Kind.DECODE) {
            reason = "invalid encoding: " + cause.getMessage();
        } else {
            reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        return path + ": " + reason;
    }
}
