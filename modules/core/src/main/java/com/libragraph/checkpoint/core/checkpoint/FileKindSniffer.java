package com.libragraph.checkpoint.core.checkpoint;

import com.libragraph.checkpoint.types.FileKind;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decides text vs binary from the first bytes of a file.
 *
 * <p>A NUL byte in the window means binary. Otherwise the window must decode as
 * UTF-8; a multi-byte sequence cut off by the window edge still counts as text.
 */
public final class FileKindSniffer {

    static final int WINDOW = 8 * 1024;

    private FileKindSniffer() {
    }

    public static FileKind sniff(byte[] content) {
        int limit = Math.min(content.length, WINDOW);
        for (int i = 0; i < limit; i++) {
            if (content[i] == 0) {
                return FileKind.BINARY;
            }
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        // Trim a trailing partial sequence when the window cuts through the file
        int end = limit < content.length ? trimPartialSequence(content, limit) : limit;
        try {
            decoder.decode(ByteBuffer.wrap(content, 0, end));
            return FileKind.TEXT;
        } catch (CharacterCodingException e) {
            return FileKind.BINARY;
        }
    }

    private static int trimPartialSequence(byte[] content, int limit) {
        int i = limit;
        // Walk back over at most three continuation bytes to the lead byte
        while (i > 0 && limit - i < 3 && (content[i - 1] & 0xC0) == 0x80) {
            i--;
        }
        if (i > 0 && (content[i - 1] & 0xC0) == 0xC0) {
            return i - 1;
        }
        return limit;
    }
}
