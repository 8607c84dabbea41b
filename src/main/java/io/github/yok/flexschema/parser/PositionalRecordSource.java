package io.github.yok.flexschema.parser;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.github.yok.flexschema.inference.SampleRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * {@link RecordSource} for fixed-width positional text.
 *
 * <p>
 * Column widths come from {@link ParseOptions#getColumnWidths()}. When none are given they are
 * detected from the first {@value #DETECTION_LINES} non-blank lines: a column starts wherever every
 * sample line long enough switches from a space to a non-space character. Columns are named
 * {@code ColumnN}; values are trimmed and empty values are recorded as {@code null}. The last
 * column extends to the end of the line.
 * </p>
 */
@Slf4j
public class PositionalRecordSource implements RecordSource {

    /**
     * Number of lines inspected by width detection.
     */
    public static final int DETECTION_LINES = 5;

    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    /**
     * {@inheritDoc}
     */
    @Override
    public List<SampleRecord> read(String content, ParseOptions options) {
        List<String> lines = LINE_SPLITTER.splitToList(StringUtils.defaultString(content)).stream()
                .filter(StringUtils::isNotBlank).collect(Collectors.toList());

        List<Integer> widths = options.getColumnWidths();
        if (widths == null || widths.isEmpty()) {
            widths = detectWidths(lines.subList(0, Math.min(DETECTION_LINES, lines.size())));
            log.info("Detected positional column widths: {}", widths);
        } else {
            widths.forEach(w -> Validate.isTrue(w != null && w > 0,
                    "column widths must be positive: %s", options.getColumnWidths()));
        }

        List<SampleRecord> records = new ArrayList<>(lines.size());
        for (String line : lines) {
            records.add(toRecord(line, widths));
        }
        log.info("Read {} positional records with {} columns", records.size(), widths.size());
        return records;
    }

    /**
     * Detects column widths from sample lines.
     *
     * @param sampleLines non-blank sample lines
     * @return widths of the detected columns; empty if there is no sample
     */
    public static List<Integer> detectWidths(List<String> sampleLines) {
        int lineLength = sampleLines.stream().mapToInt(String::length).max().orElse(0);
        if (lineLength == 0) {
            return ImmutableList.of();
        }

        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int pos = 1; pos < lineLength; pos++) {
            if (isColumnStart(sampleLines, pos)) {
                starts.add(pos);
            }
        }
        starts.add(lineLength);

        ImmutableList.Builder<Integer> widths = ImmutableList.builder();
        for (int i = 0; i < starts.size() - 1; i++) {
            widths.add(starts.get(i + 1) - starts.get(i));
        }
        return widths.build();
    }

    private static boolean isColumnStart(List<String> lines, int pos) {
        boolean seen = false;
        for (String line : lines) {
            if (line.length() <= pos) {
                continue;
            }
            seen = true;
            if (line.charAt(pos) == ' ' || line.charAt(pos - 1) != ' ') {
                return false;
            }
        }
        return seen;
    }

    private static SampleRecord toRecord(String line, List<Integer> widths) {
        SampleRecord record = new SampleRecord();
        int start = 0;
        for (int i = 0; i < widths.size(); i++) {
            boolean last = i == widths.size() - 1;
            int end = last ? line.length() : Math.min(start + widths.get(i), line.length());
            String value = start < line.length() ? line.substring(start, Math.max(start, end))
                    : null;
            record.add("Column" + (i + 1), StringUtils.trimToNull(value));
            start += widths.get(i);
        }
        return record;
    }
}
