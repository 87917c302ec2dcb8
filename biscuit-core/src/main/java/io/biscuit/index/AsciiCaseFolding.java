package io.biscuit.index;

import java.nio.charset.StandardCharsets;

/**
 * Locale-independent byte-wise lower-casing: {@code A-Z} map to {@code a-z},
 * every other byte (including all UTF-8 multi-byte sequences) is unchanged.
 */
public final class AsciiCaseFolding {

    private AsciiCaseFolding() {
    }

    public static byte[] encode(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    public static int fold(int symbol) {
        if (symbol >= 'A' && symbol <= 'Z') {
            return symbol + ('a' - 'A');
        }
        return symbol;
    }

    public static byte[] fold(byte[] bytes) {
        var folded = bytes.clone();
        for (var i = 0; i < folded.length; i++) {
            folded[i] = (byte) fold(folded[i] & 0xFF);
        }
        return folded;
    }
}
