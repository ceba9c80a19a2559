package com.dubbi.hostmaster.portal.session;

import com.dubbi.hostmaster.portal.error.EncodingException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.MalformedInputException;
import java.nio.charset.UnmappableCharacterException;

/**
 * 포털의 레거시 2바이트 인코딩(Shift_JIS 계열)과 Java 문자열 사이의 변환.
 * 표현할 수 없는 문자는 치환하지 않고 실패시킨다.
 * 인코더의 단방향 근사 매핑(예: U+00A5 → 0x5C)도 되돌렸을 때 원문과 달라지므로 실패로 본다.
 */
public final class LegacyEncoding {
    public static final String DEFAULT_CHARSET = "Windows-31J";

    private final Charset charset;

    public LegacyEncoding(Charset charset) {
        this.charset = charset;
    }

    public static LegacyEncoding of(String charsetName) {
        try {
            return new LegacyEncoding(Charset.forName(charsetName));
        } catch (IllegalArgumentException e) {
            throw new EncodingException("unsupported charset: " + charsetName, e);
        }
    }

    public static LegacyEncoding windows31j() {
        return of(DEFAULT_CHARSET);
    }

    public Charset charset() {
        return charset;
    }

    public byte[] toLegacy(String text) {
        try {
            ByteBuffer out = charset.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));
            byte[] bytes = new byte[out.remaining()];
            out.get(bytes);
            if (!text.equals(new String(bytes, charset))) {
                int bad = firstUnrepresentable(text);
                throw new EncodingException(String.format("cannot encode %s without substitution at index %d (U+%04X)",
                        charset.name(), bad, text.codePointAt(Math.max(bad, 0))), null);
            }
            return bytes;
        } catch (CharacterCodingException e) {
            throw new EncodingException(describe("encode", text, e), e);
        }
    }

    public String fromLegacy(byte[] bytes) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new EncodingException(describe("decode", null, e), e);
        }
    }

    private String describe(String direction, String text, CharacterCodingException e) {
        String reason;
        if (e instanceof UnmappableCharacterException u) {
            reason = "unmappable input of length " + u.getInputLength();
        } else if (e instanceof MalformedInputException m) {
            reason = "malformed input of length " + m.getInputLength();
        } else {
            reason = e.getClass().getSimpleName();
        }
        String sample = "";
        if (text != null) {
            int bad = firstUnrepresentable(text);
            if (bad >= 0) {
                sample = String.format(" at index %d (U+%04X)", bad, text.codePointAt(bad));
            }
        }
        return "cannot " + direction + " " + charset.name() + ": " + reason + sample;
    }

    /**
     * Index of the first code point that has no mapping or does not decode back to itself; -1 if none.
     */
    private int firstUnrepresentable(String text) {
        var encoder = charset.newEncoder();
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            String one = new String(Character.toChars(cp));
            if (!encoder.canEncode(one) || !one.equals(new String(one.getBytes(charset), charset))) return i;
            i += Character.charCount(cp);
        }
        return -1;
    }
}
