package io.biscuit.query;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

/**
 * Reference byte-wise LIKE / ILIKE matcher used to check index results.
 * Scans the value directly with a dynamic program over pattern tokens.
 */
public final class LikeOracle {

    private static final int ANY_ONE = -2;
    private static final int ANY_MANY = -3;

    private LikeOracle() {
    }

    public static boolean matches(String value, String pattern, boolean caseSensitive) {
        if (value == null) {
            return false;
        }
        var bytes = value.getBytes(StandardCharsets.UTF_8);
        var tokens = tokenize(pattern);
        if (!caseSensitive) {
            bytes = fold(bytes);
            for (var i = 0; i < tokens.length; i++) {
                if (tokens[i] >= 0) {
                    tokens[i] = foldByte(tokens[i]);
                }
            }
        }
        // reachable[j]: the first i tokens can consume exactly j bytes
        var reachable = new boolean[bytes.length + 1];
        reachable[0] = true;
        for (var token : tokens) {
            var next = new boolean[bytes.length + 1];
            for (var j = 0; j <= bytes.length; j++) {
                if (!reachable[j]) {
                    continue;
                }
                if (token == ANY_MANY) {
                    for (var k = j; k <= bytes.length; k++) {
                        next[k] = true;
                    }
                    break;
                }
                if (j < bytes.length && (token == ANY_ONE || (bytes[j] & 0xFF) == token)) {
                    next[j + 1] = true;
                }
            }
            reachable = next;
        }
        return reachable[bytes.length];
    }

    private static int[] tokenize(String pattern) {
        var out = new ArrayList<Integer>();
        for (var i = 0; i < pattern.length(); ) {
            var ch = pattern.charAt(i);
            if (ch == '%') {
                out.add(ANY_MANY);
                i++;
                continue;
            }
            if (ch == '_') {
                out.add(ANY_ONE);
                i++;
                continue;
            }
            if (ch == '\\') {
                i++;
            }
            var codePoint = pattern.codePointAt(i);
            var encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
            for (var b : encoded) {
                out.add(b & 0xFF);
            }
            i += Character.charCount(codePoint);
        }
        return out.stream().mapToInt(Integer::intValue).toArray();
    }

    private static byte[] fold(byte[] bytes) {
        var folded = bytes.clone();
        for (var i = 0; i < folded.length; i++) {
            folded[i] = (byte) foldByte(folded[i] & 0xFF);
        }
        return folded;
    }

    private static int foldByte(int b) {
        return b >= 'A' && b <= 'Z' ? b + ('a' - 'A') : b;
    }
}
