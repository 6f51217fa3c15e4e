package com.wbsledger.reports.ingest;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;

/**
 * Decodes export bytes without ever failing: each malformed or unmappable
 * sequence becomes U+FFFD and is counted.
 */
public final class ExportDecoder {

    private static final char REPLACEMENT = '\uFFFD';
    private static final char BOM = '\uFEFF';

    private ExportDecoder() {
    }

    public static DecodedText decode(byte[] content, Charset charset) {
        if (content == null || content.length == 0) {
            return new DecodedText("", 0);
        }
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(content);
        CharBuffer out = CharBuffer.allocate((int) Math.ceil(content.length * (double) decoder.maxCharsPerByte()) + 16);
        int anomalies = 0;
        while (true) {
            CoderResult result = in.hasRemaining() ? decoder.decode(in, out, true) : CoderResult.UNDERFLOW;
            if (result.isUnderflow()) {
                result = decoder.flush(out);
                if (result.isUnderflow()) {
                    break;
                }
            }
            if (result.isOverflow()) {
                out = grow(out);
            } else if (result.isError()) {
                anomalies++;
                in.position(in.position() + result.length());
                if (!out.hasRemaining()) {
                    out = grow(out);
                }
                out.put(REPLACEMENT);
            }
        }
        out.flip();
        String text = out.toString();
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return new DecodedText(text, anomalies);
    }

    private static CharBuffer grow(CharBuffer buffer) {
        CharBuffer larger = CharBuffer.allocate(buffer.capacity() * 2 + 16);
        buffer.flip();
        larger.put(buffer);
        return larger;
    }
}
