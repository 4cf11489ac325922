package io.github.treetags.profile;

import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Extension-field extraction rules a language profile may carry. Each rule applies to the definition captures named
 * in {@link #captures()}, or to every definition capture when that set is empty.
 *
 * <p>Node paths are {@code /}-separated grammar field names, with {@code ..} stepping to the parent node.
 */
public sealed interface FieldRule {
    String LINE = "line";
    String END = "end";
    String SIGNATURE = "signature";
    String ACCESS = "access";
    String TYPEREF = "typeref";

    Set<String> captures();

    /** Field key this rule produces. */
    String key();

    default boolean appliesTo(String captureName) {
        return captures().isEmpty() || captures().contains(captureName);
    }

    /** 1-based line of the definition. */
    record LineNumber(Set<String> captures) implements FieldRule {
        @Override
        public String key() {
            return LINE;
        }
    }

    /** 1-based last line of a definition spanning several lines. */
    record EndLine(Set<String> captures) implements FieldRule {
        @Override
        public String key() {
            return END;
        }
    }

    /**
     * Text of the parameter list, optionally followed by {@code resultSeparator} and the result node, whitespace
     * collapsed.
     */
    record Signature(
            String parametersPath, @Nullable String resultPath, String resultSeparator, Set<String> captures)
            implements FieldRule {
        @Override
        public String key() {
            return SIGNATURE;
        }
    }

    /** First access keyword found in a child of {@code ownerPath} whose node type is one of {@code modifierTypes}. */
    record AccessFromModifiers(String ownerPath, Set<String> modifierTypes, Set<String> captures)
            implements FieldRule {
        @Override
        public String key() {
            return ACCESS;
        }
    }

    /** {@code __x} private, {@code _x} protected, anything else (dunder names included) public. */
    record AccessFromNameConvention(Set<String> captures) implements FieldRule {
        @Override
        public String key() {
            return ACCESS;
        }
    }

    /** {@code typename:<text>} of the node at {@code typePath}. */
    record TypeRef(String typePath, Set<String> captures) implements FieldRule {
        @Override
        public String key() {
            return TYPEREF;
        }
    }
}
