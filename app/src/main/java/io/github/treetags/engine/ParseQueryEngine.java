package io.github.treetags.engine;

import io.github.treetags.profile.LanguageProfile;
import java.nio.charset.CharacterCodingException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSQuery;
import org.treesitter.TSQueryCapture;
import org.treesitter.TSQueryCursor;
import org.treesitter.TSQueryMatch;
import org.treesitter.TSTree;

/**
 * Parses a file with its profile's grammar and runs the profile's tag query over the tree.
 *
 * <p>An engine owns a parser and is confined to one thread; the dispatcher gives every worker its own instance. The
 * profile's grammar and compiled query are only read.
 */
public final class ParseQueryEngine {
    private static final Logger logger = LogManager.getLogger(ParseQueryEngine.class);

    // pre-order: outer nodes before the nodes they contain, then query order
    private static final Comparator<Sequenced> PRE_ORDER = Comparator.<Sequenced>comparingInt(
                    s -> s.capture().startByte())
            .thenComparing(Comparator.<Sequenced>comparingInt(s -> s.capture().endByte()).reversed())
            .thenComparingInt(Sequenced::sequence);

    private final TSParser parser = new TSParser();

    private record Sequenced(CaptureMatch capture, int sequence) {}

    public QueryResult parseAndQuery(byte[] bytes, LanguageProfile profile) throws EngineException {
        SourceText source;
        try {
            source = SourceText.decode(bytes);
        } catch (CharacterCodingException e) {
            throw new EngineException(EngineException.Kind.DECODE, "not valid UTF-8: " + e.getMessage(), e);
        }
        return parseAndQuery(source, profile);
    }

    public QueryResult parseAndQuery(SourceText source, LanguageProfile profile) throws EngineException {
        if (!parser.setLanguage(profile.grammar())) {
            throw new EngineException(
                    EngineException.Kind.PARSE, "grammar " + profile.language() + " rejected by the parser");
        }
        TSTree tree = parser.parseString(null, source.text());
        if (tree == null) {
            throw new EngineException(EngineException.Kind.PARSE, "parser produced no tree");
        }
        TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new EngineException(EngineException.Kind.PARSE, "parser produced an empty tree");
        }

        TSQuery query = profile.query();
        TSQueryCursor cursor = new TSQueryCursor();
        cursor.exec(query, root);

        var collected = new ArrayList<Sequenced>();
        TSQueryMatch match = new TSQueryMatch();
        while (cursor.nextMatch(match)) {
            for (TSQueryCapture capture : match.getCaptures()) {
                TSNode node = capture.getNode();
                if (node == null || node.isNull()) {
                    continue;
                }
                String name = query.getCaptureNameForId(capture.getIndex());
                var cm = new CaptureMatch(
                        name,
                        match.getId(),
                        node.getStartByte(),
                        node.getEndByte(),
                        node.getStartPoint().getRow(),
                        node.getStartPoint().getColumn(),
                        node.getEndPoint().getRow(),
                        node,
                        source);
                collected.add(new Sequenced(cm, collected.size()));
                logger.trace("Capture {} -> {}", name, node.getType());
            }
        }

        collected.sort(PRE_ORDER);
        List<CaptureMatch> ordered = collected.stream().map(Sequenced::capture).toList();
        return new QueryResult(source, ordered, tree);
    }
}
