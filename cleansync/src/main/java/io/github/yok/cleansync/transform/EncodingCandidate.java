package io.github.yok.cleansync.transform;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One text encoding tried when reading a raw CSV payload.
 *
 * <p>
 * Decoding is strict: malformed or unmappable input fails instead of being replaced. A candidate
 * that does not strip the byte order mark rejects input starting with one, so that a UTF-8 file
 * with a signature is read by the candidate meant for it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@AllArgsConstructor
public class EncodingCandidate {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    // Label used in log and error messages
    private final String label;

    private final Charset charset;

    // Whether a leading byte order mark is consumed
    private final boolean stripBom;

    /**
     * Decodes the given bytes with this candidate.
     *
     * @param content raw bytes
     * @return decoded text
     * @throws CharacterCodingException if the bytes are not valid in this encoding, or carry a byte
     *         order mark this candidate does not accept
     */
    public String decode(byte[] content) throws CharacterCodingException {
        String text = charset.newDecoder().onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(content))
                .toString();
        boolean hasBom = !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK;
        if (hasBom && stripBom) {
            return text.substring(1);
        }
        if (hasBom) {
            throw new UnexpectedByteOrderMarkException(label);
        }
        return text;
    }

    /**
     * Signals a byte order mark at the start of input read by a candidate that keeps it.
     */
    static final class UnexpectedByteOrderMarkException extends CharacterCodingException {

        private static final long serialVersionUID = 1L;

        private final String label;

        UnexpectedByteOrderMarkException(String label) {
            this.label = label;
        }

        @Override
        public String getMessage() {
            return "Input starts with a byte order mark not accepted by " + label;
        }
    }
}
