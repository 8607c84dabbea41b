package io.github.yok.flexschema.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexschema.inference.SchemaResult;
import io.github.yok.flexschema.ldif.DirectoryEntry;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of analyzing a directory-export document: typed entries, base DN and proposed schema.
 */
@ToString
public class LdifAnalysis {

    // Entries whose attributes carry an inferred type
    @Getter
    private final List<DirectoryEntry> entries;

    private final String baseDistinguishedName;

    @Getter
    private final SchemaResult schema;

    public LdifAnalysis(List<DirectoryEntry> entries, String baseDistinguishedName,
            SchemaResult schema) {
        this.entries = ImmutableList.copyOf(entries);
        this.baseDistinguishedName = baseDistinguishedName;
        this.schema = schema;
    }

    /**
     * Returns the heuristic base DN derived from the first entry.
     *
     * @return base DN, or empty if the document has no entry
     */
    public Optional<String> getBaseDistinguishedName() {
        return Optional.ofNullable(baseDistinguishedName);
    }

    /**
     * Returns the number of entries.
     *
     * @return entry count
     */
    public int getTotalEntries() {
        return entries.size();
    }

    /**
     * Returns the number of regular attributes over all entries.
     *
     * @return attribute count
     */
    public int getTotalAttributes() {
        return entries.stream().mapToInt(e -> e.getAttributes().size()).sum();
    }
}
