package com.sulid;

import java.util.Arrays;

import static com.sulid.DefaultValue.ENCODED_LENGTH;

/**
 * Crockford Base32 codec for 128-bit values.
 *
 * <p>26 characters, 5 bits each, most significant first. The top two bits of the
 * first character are always zero, so a valid first character is {@code 0-7}.
 * Decoding accepts lower case letters; I, L, O and U are not part of the
 * alphabet.</p>
 */
final class Crockford {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

    /** Character code to 5-bit value, -1 when not in the alphabet */
    private static final byte[] LOOKUP = new byte[128];

    static {
        Arrays.fill(LOOKUP, (byte) -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            char c = ALPHABET[i];
            LOOKUP[c] = (byte) i;
            LOOKUP[Character.toLowerCase(c)] = (byte) i;
        }
    }

    private Crockford() {
    }

    /**
     * Writes the 26 character form of a 128-bit value.
     *
     * @param msb high 64 bits
     * @param lsb low 64 bits
     * @param out destination buffer, at least 26 chars from offset 0
     */
    static void encode(long msb, long lsb, char[] out) {
        for (int i = ENCODED_LENGTH - 1; i >= 0; i--) {
            out[i] = ALPHABET[(int) (lsb & 0x1F)];
            lsb = (lsb >>> 5) | (msb << 59);
            msb >>>= 5;
        }
    }

    /**
     * Decodes a 26 character string.
     *
     * @param text the encoded form
     * @return the decoded value
     * @throws DecodeException if the length or any character is invalid
     */
    static Sulid decode(CharSequence text) {
        if (text == null || text.length() != ENCODED_LENGTH) {
            throw new DecodeException(DecodeException.Kind.INVALID_LENGTH,
                    "Encoded Sulid must be " + ENCODED_LENGTH + " characters, got "
                            + (text == null ? "null" : String.valueOf(text.length())));
        }

        long msb = 0L;
        long lsb = 0L;
        for (int i = 0; i < ENCODED_LENGTH; i++) {
            char c = text.charAt(i);
            int value = c < LOOKUP.length ? LOOKUP[c] : -1;
            if (value < 0) {
                throw new DecodeException(DecodeException.Kind.INVALID_CHAR,
                        "Invalid character '" + c + "' at index " + i);
            }
            // A first character above 7 does not fit in 128 bits
            if (i == 0 && value > 7) {
                throw new DecodeException(DecodeException.Kind.INVALID_CHAR,
                        "Leading character '" + c + "' overflows 128 bits");
            }
            msb = (msb << 5) | (lsb >>> 59);
            lsb = (lsb << 5) | value;
        }
        return Sulid.of(msb, lsb);
    }
}
