package io.github.yok.flexschema.ldif;

import lombok.Generated;

/**
 * Flags attribute values that are likely binary content.
 *
 * <p>
 * A value is binary when more than 30% of its characters are control characters
 * ({@code U+0000-U+001F}, {@code U+007F-U+009F}) or when it is longer than 1000 characters.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class BinaryHeuristic {

    private static final double CONTROL_RATIO_THRESHOLD = 0.3;

    private static final int LENGTH_THRESHOLD = 1000;

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private BinaryHeuristic() {}

    /**
     * Classifies a value.
     *
     * @param value attribute value
     * @return {@code true} if the value looks binary; {@code false} for {@code null} or empty
     */
    public static boolean isBinary(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        if (value.length() > LENGTH_THRESHOLD) {
            return true;
        }
        int controls = 0;
        for (int i = 0; i < value.length(); i++) {
            if (isControl(value.charAt(i))) {
                controls++;
            }
        }
        return (double) controls / value.length() > CONTROL_RATIO_THRESHOLD;
    }

    private static boolean isControl(char c) {
        return c <= 0x1F || (c >= 0x7F && c <= 0x9F);
    }
}
