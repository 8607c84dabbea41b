package io.github.yok.flexschema.parser;

import io.github.yok.flexschema.inference.SampleRecord;
import io.github.yok.flexschema.util.CsvUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link RecordSource} for delimited text (CSV, TSV, pipe-separated, ...).
 *
 * <p>
 * Behavior:
 * </p>
 * <ul>
 * <li>The delimiter comes from {@link ParseOptions#getDelimiter()} or is detected with
 * {@link CsvUtils#detectDelimiter(String)}.</li>
 * <li>With a header row, blank header cells are named {@code ColumnN}; duplicates get a
 * {@code _N} suffix. Without header, every column is named {@code ColumnN}.</li>
 * <li>Values are trimmed; empty cells are recorded as {@code null}.</li>
 * <li>Cells beyond the header width get {@code ColumnN} names; missing trailing cells are simply
 * absent from the record.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DelimitedRecordSource implements RecordSource {

    /**
     * {@inheritDoc}
     */
    @Override
    public List<SampleRecord> read(String content, ParseOptions options)
            throws MalformedContentException {
        char delimiter = options.getDelimiter() != null ? options.getDelimiter()
                : CsvUtils.detectDelimiter(content);
        CSVFormat format = CsvUtils.samplingFormat(delimiter);

        List<SampleRecord> records = new ArrayList<>();
        List<String> headers = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(content, format)) {
            boolean headerPending = options.isHasHeader();
            for (CSVRecord row : parser) {
                if (headerPending) {
                    headers.addAll(resolveHeaders(row));
                    headerPending = false;
                    continue;
                }
                records.add(toRecord(row, headers));
            }
        } catch (IOException | UncheckedIOException e) {
            throw new MalformedContentException(
                    "Failed to read delimited content: " + e.getMessage(), e);
        }
        log.info("Read {} delimited records (delimiter [{}], header={})", records.size(),
                delimiter, options.isHasHeader());
        return records;
    }

    private static List<String> resolveHeaders(CSVRecord row) {
        List<String> headers = new ArrayList<>(row.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < row.size(); i++) {
            String name = StringUtils.trim(row.get(i));
            if (StringUtils.isEmpty(name)) {
                name = columnName(i);
            }
            String unique = name;
            int suffix = 2;
            while (!seen.add(unique)) {
                unique = name + "_" + suffix++;
            }
            headers.add(unique);
        }
        return headers;
    }

    private static SampleRecord toRecord(CSVRecord row, List<String> headers) {
        SampleRecord record = new SampleRecord();
        for (int i = 0; i < row.size(); i++) {
            String name = i < headers.size() ? headers.get(i) : columnName(i);
            record.add(name, StringUtils.trimToNull(row.get(i)));
        }
        return record;
    }

    private static String columnName(int index) {
        return "Column" + (index + 1);
    }
}
