package io.cuid.fingerprint;

import io.cuid.core.CuidException;
import io.cuid.encoding.Base36;

import java.util.Locale;
import java.util.Objects;

/**
 * Four-character base-36 token identifying the process and host an identifier was generated on.
 *
 * @param value lowercase base-36 digits, exactly {@link #WIDTH} characters
 */
public record Fingerprint(String value) {

    public static final int WIDTH = 4;

    public Fingerprint {
        Objects.requireNonNull(value, "value");
        if (value.length() != WIDTH || !Base36.isBase36(value)) {
            throw new CuidException("Fingerprint must be " + WIDTH + " base-36 characters: '" + value + "'");
        }
    }

    /**
     * Accepts an explicit fingerprint, e.g. one pinned per container.
     * Uppercase letters are normalized to lowercase.
     *
     * @param value the fingerprint text
     * @return the fingerprint
     * @throws CuidException if value is not 4 base-36 characters
     */
    public static Fingerprint of(String value) {
        Objects.requireNonNull(value, "value");
        return new Fingerprint(value.toLowerCase(Locale.ROOT));
    }

    /**
     * Encodes a numeric fingerprint, left-padded to {@link #WIDTH}.
     */
    static Fingerprint ofNumeric(long numeric) {
        return new Fingerprint(Base36.encodeFixed(numeric, WIDTH));
    }

    @Override
    public String toString() {
        return value;
    }
}
