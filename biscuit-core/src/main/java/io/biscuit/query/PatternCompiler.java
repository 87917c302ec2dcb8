package io.biscuit.query;

import io.biscuit.core.InvalidPatternException;
import io.biscuit.index.AsciiCaseFolding;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles SQL LIKE patterns into {@link CompiledPattern}s.
 * <p>
 * {@code %} matches any run of bytes, {@code _} exactly one byte. A backslash makes the
 * next character literal ({@code \%}, {@code \_}, {@code \\}); a pattern ending in an
 * unpaired backslash is rejected.
 */
public final class PatternCompiler {

    private static final char ESCAPE = '\\';

    private PatternCompiler() {
    }

    /**
     * Compile {@code pattern}.
     *
     * @param pattern       the LIKE pattern
     * @param caseSensitive false for ILIKE; literal bytes are then ASCII-folded
     * @return the compiled pattern
     * @throws InvalidPatternException if the pattern ends in an unpaired escape
     */
    public static CompiledPattern compile(String pattern, boolean caseSensitive) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern required");
        }
        var segments = new ArrayList<Segment>();
        var literal = new ByteArrayOutputStream();
        var gapMin = 0;
        var inGap = false;
        var gapUnbounded = false;
        var startsWithPercent = false;
        var endsWithPercent = false;

        var i = 0;
        while (i < pattern.length()) {
            var ch = pattern.charAt(i);
            if (ch == '%' || ch == '_') {
                if (!inGap) {
                    flushLiteral(literal, segments, caseSensitive);
                    inGap = true;
                    gapMin = 0;
                    gapUnbounded = false;
                }
                if (ch == '%') {
                    gapUnbounded = true;
                    if (i == 0) {
                        startsWithPercent = true;
                    }
                } else {
                    gapMin++;
                }
                endsWithPercent = ch == '%';
                i++;
                continue;
            }
            if (inGap) {
                segments.add(gapUnbounded ? Segment.Gap.atLeast(gapMin) : Segment.Gap.exact(gapMin));
                inGap = false;
            }
            if (ch == ESCAPE) {
                if (i + 1 >= pattern.length()) {
                    throw new InvalidPatternException(pattern, i, "unterminated escape");
                }
                i++;
            }
            var codePoint = pattern.codePointAt(i);
            var encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
            literal.write(encoded, 0, encoded.length);
            endsWithPercent = false;
            i += Character.charCount(codePoint);
        }
        if (inGap) {
            segments.add(gapUnbounded ? Segment.Gap.atLeast(gapMin) : Segment.Gap.exact(gapMin));
        }
        flushLiteral(literal, segments, caseSensitive);

        return new CompiledPattern(pattern, segments, !startsWithPercent, !endsWithPercent, caseSensitive);
    }

    private static void flushLiteral(ByteArrayOutputStream literal, List<Segment> segments, boolean caseSensitive) {
        if (literal.size() == 0) {
            return;
        }
        var bytes = literal.toByteArray();
        segments.add(new Segment.Literal(caseSensitive ? bytes : AsciiCaseFolding.fold(bytes)));
        literal.reset();
    }
}
