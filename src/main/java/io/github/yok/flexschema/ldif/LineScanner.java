package io.github.yok.flexschema.ldif;

import com.google.common.base.Splitter;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Splits directory-export text into raw lines.
 *
 * <p>
 * Lines are split on {@code \n} only; a trailing {@code \r} is left for the caller to strip. Blank
 * and comment lines are flagged as skippable but still yielded, so that the consumer sees every
 * index. Line folding is not resolved here: a folded value needs parser context, so the scanner
 * only exposes {@link #startsWithContinuationMarker(String)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class LineScanner {

    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LineScanner() {}

    /**
     * Scans the given content.
     *
     * @param content decoded document text
     * @return restartable, indexable sequence of lines
     */
    public static ScannedLines scan(String content) {
        return new ScannedLines(LINE_SPLITTER.splitToList(StringUtils.defaultString(content)));
    }

    /**
     * Determines whether a line continues the value of the previous line.
     *
     * @param line raw line
     * @return {@code true} if the line begins with a space
     */
    public static boolean startsWithContinuationMarker(String line) {
        return line != null && !line.isEmpty() && line.charAt(0) == ' ';
    }

    /**
     * Determines whether a line is blank or a comment.
     *
     * @param line raw line
     * @return {@code true} if the line carries no content
     */
    public static boolean isSkippable(String line) {
        return StringUtils.isBlank(line) || line.charAt(0) == '#';
    }

    /**
     * Lines of one scanned document.
     *
     * <p>
     * {@link LdifLine} objects are created on access; every call to {@link #iterator()} starts
     * from the first line again.
     * </p>
     */
    public static final class ScannedLines implements Iterable<LdifLine> {

        private final List<String> rawLines;

        private ScannedLines(List<String> rawLines) {
            this.rawLines = rawLines;
        }

        /**
         * Returns the number of lines.
         *
         * @return line count
         */
        public int size() {
            return rawLines.size();
        }

        /**
         * Returns the line at the given index.
         *
         * @param index 0-based index
         * @return line
         * @throws IndexOutOfBoundsException if the index is out of range
         */
        public LdifLine get(int index) {
            String raw = rawLines.get(index);
            return new LdifLine(index, raw, isSkippable(raw));
        }

        /**
         * {@inheritDoc}
         */
        @Override
        public Iterator<LdifLine> iterator() {
            return new Iterator<>() {
                private int cursor;

                @Override
                public boolean hasNext() {
                    return cursor < rawLines.size();
                }

                @Override
                public LdifLine next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    return get(cursor++);
                }
            };
        }
    }
}
