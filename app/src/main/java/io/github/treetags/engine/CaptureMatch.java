package io.github.treetags.engine;

import org.treesitter.TSNode;

/**
 * One capture of a tag query. Lines and columns are 0-based, columns in bytes. The node stays valid as long as the
 * {@link QueryResult} that produced it is reachable.
 */
public record CaptureMatch(
        String name,
        int matchId,
        int startByte,
        int endByte,
        int startLine,
        int startColumn,
        int endLine,
        TSNode node,
        SourceText source) {

    public String text() {
        return source.slice(startByte, endByte);
    }

    public boolean encloses(CaptureMatch other) {
        return startByte <= other.startByte && other.endByte <= endByte;
    }

    public boolean sameRange(CaptureMatch other) {
        return startByte == other.startByte && endByte == other.endByte;
    }

    @Override
    public String toString() {
        return "CaptureMatch[" + name + " #" + matchId + " " + startByte + ".." + endByte + " line " + (startLine + 1)
                + "]";
    }
}
