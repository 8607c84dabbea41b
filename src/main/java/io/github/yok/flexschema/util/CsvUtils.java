package io.github.yok.flexschema.util;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility class for reading delimited text with Apache Commons CSV.
 *
 * <p>
 * Provides delimiter auto-detection and the {@link CSVFormat} used for schema sampling: double
 * quote as text qualifier, empty lines ignored, no header handling (headers are resolved by the
 * caller so that blank header cells can be renamed).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class CsvUtils {

    /**
     * Delimiters considered by {@link #detectDelimiter(String)}, in tie-breaking order.
     */
    public static final List<Character> CANDIDATE_DELIMITERS =
            ImmutableList.of(',', ';', '\t', '|', ':', ' ');

    private static final char DEFAULT_DELIMITER = ',';

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Detects the delimiter of delimited text from its first line.
     *
     * <p>
     * The candidate occurring most often in the first line wins; on a tie the earlier candidate in
     * {@link #CANDIDATE_DELIMITERS} is kept. When no candidate occurs, comma is returned.
     * </p>
     *
     * @param content delimited text
     * @return detected delimiter
     */
    public static char detectDelimiter(String content) {
        String firstLine = StringUtils.substringBefore(StringUtils.defaultString(content), "\n");
        char best = DEFAULT_DELIMITER;
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = StringUtils.countMatches(firstLine, candidate);
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        log.debug("Detected delimiter [{}] ({} occurrences in first line)", best, bestCount);
        return best;
    }

    /**
     * Builds the format used to read delimited text for sampling.
     *
     * @param delimiter field delimiter
     * @return CSV format
     */
    public static CSVFormat samplingFormat(char delimiter) {
        return CSVFormat.DEFAULT.builder().setDelimiter(delimiter).setQuote('"')
                .setIgnoreEmptyLines(true).setTrim(false).get();
    }
}
