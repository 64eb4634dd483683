package com.goldminer.backend.services.sms.normalization;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.HashMap;
import java.util.Map;

import org.springframework.stereotype.Component;

/**
 * Brings raw SMS text to a canonical form: repairs UTF-8 text that was decoded as
 * windows-1252/latin-1 ("mojibake"), applies NFC and maps Arabic-Indic digits to ASCII.
 * Every other character, Arabic letters included, is left untouched.
 *
 * <p>{@code normalize(normalize(s)).equals(normalize(s))} holds for every input.
 */
@Component
public class TextNormalizer {

    private static final char ARABIC_INDIC_ZERO = '٠';
    private static final char ARABIC_INDIC_NINE = '٩';
    private static final int MAX_PASSES = 8;

    /** Reverse of the windows-1252 decoding table, with latin-1 for the five undefined bytes. */
    private static final Map<Character, Byte> SLOPPY_CP1252;

    static {
        Map<Character, Byte> table = new HashMap<>();
        Charset cp1252 = Charset.forName("windows-1252");
        for (int b = 0x80; b <= 0xFF; b++) {
            String decoded = new String(new byte[] {(byte) b}, cp1252);
            char c = decoded.charAt(0);
            if (c != '\uFFFD') {
                table.put(c, (byte) b);
            }
            table.putIfAbsent((char) b, (byte) b);
        }
        SLOPPY_CP1252 = Map.copyOf(table);
    }

    /**
     * Normalized text plus whether a mojibake repair changed it.
     */
    public record NormalizedText(String text, boolean repaired) {}

    public String normalize(String text) {
        return normalizeWithReport(text).text();
    }

    public NormalizedText normalizeWithReport(String text) {
        if (text == null) {
            return new NormalizedText("", false);
        }
        String current = text;
        boolean repaired = false;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String fixed = repairMojibake(current);
            repaired |= !fixed.equals(current);
            String next = convertDigits(Normalizer.normalize(fixed, Normalizer.Form.NFC));
            if (next.equals(current)) {
                return new NormalizedText(next, repaired);
            }
            current = next;
        }
        return new NormalizedText(current, repaired);
    }

    /**
     * Decodes raw bytes as UTF-8, replacing undecodable sequences, then normalizes.
     */
    public String normalize(byte[] raw) {
        if (raw == null) {
            return "";
        }
        return normalize(new String(raw, StandardCharsets.UTF_8));
    }

    /**
     * Maps ٠-٩ to 0-9 and leaves all other characters unchanged.
     */
    public static String convertDigits(String text) {
        if (text == null) {
            return null;
        }
        StringBuilder out = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= ARABIC_INDIC_ZERO && c <= ARABIC_INDIC_NINE) {
                if (out == null) {
                    out = new StringBuilder(text);
                }
                out.setCharAt(i, (char) ('0' + (c - ARABIC_INDIC_ZERO)));
            }
        }
        return out == null ? text : out.toString();
    }

    /**
     * Re-encodes the text with windows-1252 and decodes it again as strict UTF-8.
     * The repaired string is only used when every character round-trips and the bytes
     * form valid UTF-8; otherwise the input is returned as is.
     */
    static String repairMojibake(String text) {
        boolean hasHighChar = false;
        byte[] bytes = new byte[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes[i] = (byte) c;
                continue;
            }
            Byte mapped = SLOPPY_CP1252.get(c);
            if (mapped == null) {
                return text;
            }
            bytes[i] = mapped;
            hasHighChar = true;
        }
        if (!hasHighChar) {
            return text;
        }

        CharsetDecoder strictUtf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer decoded = strictUtf8.decode(ByteBuffer.wrap(bytes));
            return decoded.toString();
        } catch (CharacterCodingException e) {
            return text;
        }
    }
}
