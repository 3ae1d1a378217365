package com.libragraph.checkpoint.core.checkpoint;

import com.libragraph.checkpoint.types.FileKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class FileKindSnifferTest {

    @Test
    void plainTextIsText() {
        assertThat(FileKindSniffer.sniff("<html><body>Hi</body></html>".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(FileKind.TEXT);
    }

    @Test
    void multiByteUtf8IsText() {
        assertThat(FileKindSniffer.sniff("Ærøskøbing, 日本語".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(FileKind.TEXT);
    }

    @Test
    void emptyIsText() {
        assertThat(FileKindSniffer.sniff(new byte[0])).isEqualTo(FileKind.TEXT);
    }

    @Test
    void nulByteIsBinary() {
        assertThat(FileKindSniffer.sniff(new byte[]{'a', 'b', 0, 'c'})).isEqualTo(FileKind.BINARY);
    }

    @Test
    void invalidUtf8IsBinary() {
        assertThat(FileKindSniffer.sniff(new byte[]{'a', (byte) 0xC3, 'b'})).isEqualTo(FileKind.BINARY);
    }

    @Test
    void nulAfterWindowIsIgnored() {
        byte[] content = new byte[FileKindSniffer.WINDOW + 10];
        Arrays.fill(content, (byte) 'x');
        content[FileKindSniffer.WINDOW + 5] = 0;

        assertThat(FileKindSniffer.sniff(content)).isEqualTo(FileKind.TEXT);
    }

    @Test
    void multiByteSequenceCutByWindowIsText() {
        byte[] content = new byte[FileKindSniffer.WINDOW + 2];
        Arrays.fill(content, (byte) 'x');
        byte[] euro = "€".getBytes(StandardCharsets.UTF_8);
        System.arraycopy(euro, 0, content, FileKindSniffer.WINDOW - 1, euro.length);

        assertThat(FileKindSniffer.sniff(content)).isEqualTo(FileKind.TEXT);
    }
}
