package io.cuid.generator;

import io.cuid.core.CuidException;
import io.cuid.encoding.Base36;
import io.cuid.fingerprint.Fingerprint;

/**
 * The segments of an identifier produced by {@link CuidGenerator}.
 * <p>
 * Only the timestamp has a variable width, so an identifier is split by taking the
 * fixed-width blocks from its end.
 *
 * @param timestamp    base-36 microsecond timestamp, 1 to 8 characters
 * @param counter      four-character counter block
 * @param fingerprint  four-character fingerprint
 * @param firstRandom  first random block
 * @param secondRandom second random block
 */
public record CuidParts(String timestamp, String counter, String fingerprint,
                        String firstRandom, String secondRandom) {

    private static final int BLOCK = CuidGenerator.BLOCK_SIZE;
    private static final int TAIL = BLOCK * 3 + Fingerprint.WIDTH;
    private static final int MAX_TIMESTAMP = 8;

    public static final int MIN_LENGTH = CuidGenerator.PREFIX.length() + 1 + TAIL;
    public static final int MAX_LENGTH = CuidGenerator.PREFIX.length() + MAX_TIMESTAMP + TAIL;

    /**
     * Split an identifier into its segments.
     *
     * @param cuid the identifier
     * @return the segments
     * @throws CuidException if the text is not a well-formed identifier
     */
    public static CuidParts parse(String cuid) {
        String problem = validate(cuid);
        if (problem != null) {
            throw new CuidException("Invalid CUID '" + cuid + "': " + problem);
        }
        int end = cuid.length();
        int secondRandomStart = end - BLOCK;
        int firstRandomStart = secondRandomStart - BLOCK;
        int fingerprintStart = firstRandomStart - Fingerprint.WIDTH;
        int counterStart = fingerprintStart - BLOCK;
        return new CuidParts(
                cuid.substring(CuidGenerator.PREFIX.length(), counterStart),
                cuid.substring(counterStart, fingerprintStart),
                cuid.substring(fingerprintStart, firstRandomStart),
                cuid.substring(firstRandomStart, secondRandomStart),
                cuid.substring(secondRandomStart, end));
    }

    /**
     * Check whether the text has the shape of an identifier.
     *
     * @param cuid the text, may be null
     * @return true if {@link #parse(String)} would accept it
     */
    public static boolean isCuid(String cuid) {
        return validate(cuid) == null;
    }

    public long timestampValue() {
        return Base36.decode(timestamp);
    }

    public long counterValue() {
        return Base36.decode(counter);
    }

    private static String validate(String cuid) {
        if (cuid == null) {
            return "null";
        }
        if (!cuid.startsWith(CuidGenerator.PREFIX)) {
            return "missing prefix";
        }
        if (cuid.length() < MIN_LENGTH || cuid.length() > MAX_LENGTH) {
            return "length " + cuid.length() + " outside " + MIN_LENGTH + ".." + MAX_LENGTH;
        }
        if (!Base36.isBase36(cuid)) {
            return "characters outside [0-9a-z]";
        }
        return null;
    }
}
