package io.github.yok.flexschema.ldif;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Entries of a parsed directory-export document plus the derived base DN.
 */
@ToString
public class LdifParseResult {

    @Getter
    private final List<DirectoryEntry> entries;

    private final String baseDistinguishedName;

    /**
     * Creates a result.
     *
     * @param entries parsed entries in document order
     * @param baseDistinguishedName derived base DN, or {@code null}
     */
    public LdifParseResult(List<DirectoryEntry> entries, String baseDistinguishedName) {
        this.entries = ImmutableList.copyOf(entries);
        this.baseDistinguishedName = baseDistinguishedName;
    }

    /**
     * Returns the base DN derived from the first entry.
     *
     * <p>
     * This is a heuristic default (the last two DN components) that the caller may override.
     * </p>
     *
     * @return base DN, or empty if no entry was parsed
     */
    public Optional<String> getBaseDistinguishedName() {
        return Optional.ofNullable(baseDistinguishedName);
    }

    /**
     * Returns the total number of regular attributes over all entries.
     *
     * @return attribute count
     */
    public int getTotalAttributes() {
        return entries.stream().mapToInt(e -> e.getAttributes().size()).sum();
    }
}
