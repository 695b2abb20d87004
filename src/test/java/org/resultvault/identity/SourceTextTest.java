package org.resultvault.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceTextTest {
    @Test
    void splitsOnAllLineTerminators() {
        SourceText text = SourceText.of("a\r\nb\rc\nd");

        assertEquals(List.of("a", "b", "c", "d"), text.lines());
        assertEquals(4, text.lineCount());
    }

    @Test
    void lineOutsideRangeIsEmpty() {
        SourceText text = SourceText.of("only\n");

        assertEquals("only", text.line(1));
        assertEquals("", text.line(2));
        assertEquals("", text.line(0));
    }

    @Test
    void honoursByteOrderMarks() {
        byte[] utf8Bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x', '\n'};
        assertEquals("x", SourceText.decode(utf8Bom).line(1));

        byte[] utf16 = "é".getBytes(StandardCharsets.UTF_16BE);
        byte[] utf16Bom = new byte[utf16.length + 2];
        utf16Bom[0] = (byte) 0xFE;
        utf16Bom[1] = (byte) 0xFF;
        System.arraycopy(utf16, 0, utf16Bom, 2, utf16.length);
        assertEquals("é", SourceText.decode(utf16Bom).line(1));
    }

    @Test
    void fallsBackToLatin1ForInvalidUtf8() {
        byte[] latin1 = {'c', 'a', 'f', (byte) 0xE9};

        assertEquals("café", SourceText.decode(latin1).line(1));
    }
}
