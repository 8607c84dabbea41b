package io.github.yok.flexschema.parser;

import io.github.yok.flexschema.inference.SampleRecord;
import io.github.yok.flexschema.ldif.Attribute;
import io.github.yok.flexschema.ldif.DirectoryEntry;
import io.github.yok.flexschema.ldif.EntryParser;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link RecordSource} for directory-export documents.
 *
 * <p>
 * Each entry becomes one record whose fields are the entry's attributes. {@code objectClass}
 * values are not part of the records. This source never throws
 * {@link MalformedContentException}.
 * </p>
 */
public class LdifRecordSource implements RecordSource {

    private final EntryParser parser = new EntryParser();

    /**
     * {@inheritDoc}
     */
    @Override
    public List<SampleRecord> read(String content, ParseOptions options) {
        return toRecords(parser.parse(content).getEntries());
    }

    /**
     * Flattens parsed entries into records.
     *
     * @param entries parsed entries
     * @return one record per entry, attributes in file order
     */
    public static List<SampleRecord> toRecords(List<DirectoryEntry> entries) {
        return entries.stream().map(LdifRecordSource::toRecord).collect(Collectors.toList());
    }

    private static SampleRecord toRecord(DirectoryEntry entry) {
        SampleRecord record = new SampleRecord();
        for (Attribute attribute : entry.getAttributes()) {
            record.addAll(attribute.getName(), attribute.getValues());
        }
        return record;
    }
}
