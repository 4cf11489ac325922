package io.github.treetags.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TextCanonicalizerTest {

    @Test
    void stripsOnlyALeadingBom() {
        byte[] withBom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'a'};
        assertArrayEquals(new byte[] {'a'}, TextCanonicalizer.stripUtf8Bom(withBom));

        byte[] plain = {'a', (byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        assertSame(plain, TextCanonicalizer.stripUtf8Bom(plain));
    }

    @Test
    void collapsesWhitespaceRuns() {
        assertEquals("(int a, int b)", TextCanonicalizer.collapseWhitespace("(int a,\n        int  b)"));
        assertEquals("x", TextCanonicalizer.collapseWhitespace("  \tx \r\n"));
        assertEquals("", TextCanonicalizer.collapseWhitespace(" \n "));
    }
}
