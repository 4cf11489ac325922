package io.github.treetags.engine;

import io.github.treetags.util.TextCanonicalizer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decoded content of one source file. Offsets are UTF-8 byte offsets and rows count {@code \n} terminated lines, as
 * tree-sitter reports them.
 */
public final class SourceText {
    private final byte[] bytes;
    private final String text;
    private final int[] lineStarts;

    private SourceText(byte[] bytes, String text) {
        this.bytes = bytes;
        this.text = text;
        this.lineStarts = computeLineStarts(bytes);
    }

    /**
     * Decodes {@code raw} as strict UTF-8 after dropping a leading byte order mark.
     *
     * @throws CharacterCodingException if the content is not valid UTF-8
     */
    public static SourceText decode(byte[] raw) throws CharacterCodingException {
        byte[] bytes = TextCanonicalizer.stripUtf8Bom(raw);
        var decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        return new SourceText(bytes, text);
    }

    private static int[] computeLineStarts(byte[] bytes) {
        int count = 1;
        for (byte b : bytes) {
            if (b == '\n') count++;
        }
        int[] starts = new int[count];
        int row = 1;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                starts[row++] = i + 1;
            }
        }
        return starts;
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return bytes.length;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /** Text between two byte offsets, clamped to the content. */
    public String slice(int startByte, int endByte) {
        int start = Math.max(0, Math.min(startByte, bytes.length));
        int end = Math.max(start, Math.min(endByte, bytes.length));
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /** Line {@code row} (0-based) without its terminator; a CR before the LF is dropped too. */
    public String line(int row) {
        if (row < 0 || row >= lineStarts.length) {
            throw new IndexOutOfBoundsException("row " + row + " of " + lineStarts.length);
        }
        int start = lineStarts[row];
        int end = row + 1 < lineStarts.length ? lineStarts[row + 1] - 1 : bytes.length;
        if (end > start && bytes[end - 1] == '\r') {
            end--;
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }
}
