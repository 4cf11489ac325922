package io.github.treetags.engine;

/** Capture naming convention shared by tag queries. */
public final class CaptureNames {
    public static final String DEFINITION_PREFIX = "definition.";
    public static final String REFERENCE_PREFIX = "reference.";
    public static final String NAME = "name";
    public static final String DOC = "doc";

    private CaptureNames() {}

    public static boolean isDefinition(String captureName) {
        return captureName.startsWith(DEFINITION_PREFIX) && captureName.length() > DEFINITION_PREFIX.length();
    }

    public static boolean isReference(String captureName) {
        return captureName.startsWith(REFERENCE_PREFIX);
    }
}
