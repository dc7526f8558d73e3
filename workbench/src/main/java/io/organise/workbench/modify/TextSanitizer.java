package io.organise.workbench.modify;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Cleans text pasted from word processors: non-breaking spaces become plain spaces, and UTF-8 text
 * that was once decoded as Windows-1252 ({@code "Peopleâ€™s"}) is turned back into
 * {@code "People’s"}.
 */
public final class TextSanitizer {
    private static final char NBSP = '\u00A0';
    private static final String MOJIBAKE_MARKERS = "\u00C3\u00E2\u20AC\u2122\u0153\u00A2\u2030\u0160\u017E\u00C2";
    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

    private TextSanitizer() {}

    /** The cleaned value; the same instance when nothing needed cleaning. */
    public static String sanitize(String value) {
        String result = value;
        if (result.indexOf(NBSP) >= 0) {
            result = result.replace(NBSP, ' ');
        }
        String repaired = repairMojibake(result);
        return repaired != null ? repaired : result;
    }

    /** Re-decoded text, or null when the value has no markers or does not round-trip cleanly. */
    static String repairMojibake(String value) {
        if (!hasMarker(value)) return null;
        CharsetEncoder encoder = WINDOWS_1252.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer bytes = encoder.encode(CharBuffer.wrap(value));
            String decoded = decoder.decode(bytes).toString();
            return decoded.equals(value) ? null : decoded;
        } catch (CharacterCodingException e) {
            // not mojibake after all; keep the text as written
            return null;
        }
    }

    private static boolean hasMarker(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (MOJIBAKE_MARKERS.indexOf(value.charAt(i)) >= 0) return true;
        }
        return false;
    }
}
