package io.github.yok.flexschema.ldif;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One raw line of a directory-export document with its 0-based position.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class LdifLine {

    private final int index;

    // Raw text, without the line feed; a trailing carriage return is kept
    private final String text;

    // true for blank lines and comment lines starting with '#'
    private final boolean skippable;

    /**
     * Determines whether this line continues the value of the previous line.
     *
     * @return {@code true} if the line starts with the continuation marker
     */
    public boolean isContinuation() {
        return LineScanner.startsWithContinuationMarker(text);
    }
}
