package com.sulid;

/**
 * Thrown when a text form cannot be decoded into a {@link Sulid}.
 *
 * <p>The {@link Kind} tells a caller what was wrong with the input, so it can be
 * corrected and retried. A failed decode never yields a partial value.</p>
 */
public class DecodeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Decode failure categories.
     */
    public enum Kind {
        /** Input is not exactly {@value DefaultValue#ENCODED_LENGTH} characters long */
        INVALID_LENGTH,

        /** Input contains a character outside the Crockford Base32 alphabet */
        INVALID_CHAR
    }

    private final Kind kind;

    public DecodeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Returns the failure category.
     *
     * @return the kind of decode failure
     */
    public Kind getKind() {
        return kind;
    }
}
