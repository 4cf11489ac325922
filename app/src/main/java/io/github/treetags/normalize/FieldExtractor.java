package io.github.treetags.normalize;

import io.github.treetags.engine.CaptureMatch;
import io.github.treetags.engine.SourceText;
import io.github.treetags.profile.FieldRule;
import io.github.treetags.util.TextCanonicalizer;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Evaluates {@link FieldRule}s against a definition node. A rule whose node is missing yields no value. */
final class FieldExtractor {
    private static final String PARENT = "..";
    private static final String DECLARATOR = "declarator";
    private static final int MAX_DECLARATOR_DEPTH = 8;
    private static final Set<String> ACCESS_KEYWORDS = Set.of("public", "protected", "private", "internal");

    private FieldExtractor() {}

    static @Nullable String extract(FieldRule rule, CaptureMatch capture, String tagName, int nameLine) {
        if (rule instanceof FieldRule.LineNumber) {
            return Integer.toString(nameLine + 1);
        }
        if (rule instanceof FieldRule.EndLine) {
            return capture.endLine() > capture.startLine() ? Integer.toString(capture.endLine() + 1) : null;
        }
        if (rule instanceof FieldRule.Signature s) {
            return signature(s, capture);
        }
        if (rule instanceof FieldRule.AccessFromModifiers a) {
            return accessFromModifiers(a, capture);
        }
        if (rule instanceof FieldRule.AccessFromNameConvention) {
            return accessFromName(tagName);
        }
        var typeRef = (FieldRule.TypeRef) rule;
        TSNode type = navigate(capture.node(), typeRef.typePath());
        if (type == null) {
            return null;
        }
        String text = collapsedText(type, capture.source());
        return text.isEmpty() ? null : "typename:" + text;
    }

    private static @Nullable String signature(FieldRule.Signature rule, CaptureMatch capture) {
        TSNode params = navigate(capture.node(), rule.parametersPath());
        if (params == null) {
            return null;
        }
        String text = collapsedText(params, capture.source());
        if (rule.resultPath() != null) {
            TSNode result = navigate(capture.node(), rule.resultPath());
            if (result != null) {
                text = text + rule.resultSeparator() + collapsedText(result, capture.source());
            }
        }
        return text.isEmpty() ? null : text;
    }

    private static @Nullable String accessFromModifiers(FieldRule.AccessFromModifiers rule, CaptureMatch capture) {
        TSNode owner = navigate(capture.node(), rule.ownerPath());
        if (owner == null) {
            return null;
        }
        for (int i = 0; i < owner.getChildCount(); i++) {
            TSNode child = owner.getChild(i);
            if (child == null || child.isNull() || !rule.modifierTypes().contains(child.getType())) {
                continue;
            }
            for (String word : capture.source().slice(child.getStartByte(), child.getEndByte()).split("[^A-Za-z_]+")) {
                if (ACCESS_KEYWORDS.contains(word)) {
                    return word;
                }
                if (word.equals("pub")) {
                    return "public";
                }
            }
        }
        return null;
    }

    static String accessFromName(String name) {
        if (name.startsWith("__") && name.endsWith("__") && name.length() > 4) {
            return "public";
        }
        if (name.startsWith("__")) {
            return "private";
        }
        if (name.startsWith("_")) {
            return "protected";
        }
        return "public";
    }

    /**
     * Follows a {@code /}-separated path of field names, {@code ..} meaning the parent. When a field is missing the
     * walk retries through nested {@code declarator} fields, which is how C-family grammars wrap function names.
     */
    static @Nullable TSNode navigate(TSNode start, String path) {
        TSNode current = start;
        if (path.isEmpty()) {
            return current;
        }
        for (String segment : path.split("/")) {
            if (segment.equals(PARENT)) {
                current = current.getParent();
                if (isMissing(current)) {
                    return null;
                }
                continue;
            }
            TSNode next = current.getChildByFieldName(segment);
            TSNode probe = current;
            int depth = 0;
            while (isMissing(next) && depth++ < MAX_DECLARATOR_DEPTH) {
                probe = probe.getChildByFieldName(DECLARATOR);
                if (isMissing(probe)) {
                    break;
                }
                next = probe.getChildByFieldName(segment);
            }
            if (isMissing(next)) {
                return null;
            }
            current = next;
        }
        return current;
    }

    private static boolean isMissing(@Nullable TSNode node) {
        return node == null || node.isNull();
    }

    private static String collapsedText(TSNode node, SourceText source) {
        return TextCanonicalizer.collapseWhitespace(source.slice(node.getStartByte(), node.getEndByte()));
    }
}
