package io.cuid.encoding;

/**
 * Base-36 encoding with digits {@code 0-9} followed by {@code a-z}.
 * <p>
 * Every block of an identifier is produced here, either at its natural width
 * ({@link #encode(long)}) or left-padded to a fixed width ({@link #encodeFixed(long, int)}).
 */
public final class Base36 {

    public static final int RADIX = 36;

    /** Character used to left-pad fixed-width blocks. */
    public static final char PAD = '0';

    private Base36() {
    }

    /**
     * Encodes a non-negative value in lowercase base 36.
     *
     * @param value the value to encode
     * @return the encoded digits, never empty
     * @throws IllegalArgumentException if value is negative
     */
    public static String encode(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Cannot encode negative value: " + value);
        }
        return Long.toString(value, RADIX);
    }

    /**
     * Encodes a non-negative value and left-pads it with {@link #PAD} to the given width.
     * <p>
     * Encodings that already reach the width are returned as-is, never truncated.
     *
     * @param value the value to encode
     * @param width the minimum number of characters
     * @return the padded encoding
     */
    public static String encodeFixed(long value, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Width must be positive: " + width);
        }
        String digits = encode(value);
        if (digits.length() >= width) {
            return digits;
        }
        StringBuilder padded = new StringBuilder(width);
        for (int i = digits.length(); i < width; i++) {
            padded.append(PAD);
        }
        return padded.append(digits).toString();
    }

    /**
     * Decodes lowercase base-36 digits.
     *
     * @param digits characters in {@code [0-9a-z]}
     * @return the decoded value
     * @throws IllegalArgumentException if digits is empty, contains other characters or overflows a long
     */
    public static long decode(CharSequence digits) {
        if (digits == null || digits.length() == 0) {
            throw new IllegalArgumentException("Nothing to decode");
        }
        if (!isBase36(digits)) {
            throw new IllegalArgumentException("Not a lowercase base-36 string: " + digits);
        }
        try {
            return Long.parseLong(digits.toString(), RADIX);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Base-36 value out of range: " + digits, e);
        }
    }

    /**
     * Checks that every character is a lowercase base-36 digit.
     *
     * @param chars the characters to check
     * @return true if all characters are in {@code [0-9a-z]}
     */
    public static boolean isBase36(CharSequence chars) {
        for (int i = 0; i < chars.length(); i++) {
            char c = chars.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'z'))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Number of distinct values a block of the given width can hold, {@code 36^width}.
     */
    public static long capacity(int width) {
        long capacity = 1L;
        for (int i = 0; i < width; i++) {
            capacity = Math.multiplyExact(capacity, RADIX);
        }
        return capacity;
    }
}
