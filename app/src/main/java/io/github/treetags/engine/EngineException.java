package io.github.treetags.engine;

/** Failure to turn one file into capture matches. Never affects other files. */
public class EngineException extends Exception {
    public enum Kind {
        /** The bytes are not valid UTF-8. */
        DECODE,
        /** The grammar could not be applied or produced no tree. */
        PARSE
    }

    private final Kind kind;

    public EngineException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EngineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
