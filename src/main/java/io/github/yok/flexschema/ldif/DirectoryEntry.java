package io.github.yok.flexschema.ldif;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * One entry of a directory-export document.
 *
 * <p>
 * {@code objectClass} values are kept apart from the regular attributes, in file order with
 * duplicates preserved. Instances are immutable.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class DirectoryEntry {

    private final String distinguishedName;

    private final List<String> objectClasses;

    private final List<Attribute> attributes;

    // 0-based position among the emitted entries
    private final int entryIndex;

    /**
     * Creates an entry.
     *
     * @param distinguishedName non-blank distinguished name
     * @param objectClasses object classes in file order
     * @param attributes attributes in file order
     * @param entryIndex 0-based position
     * @throws IllegalArgumentException if the DN is blank or the index negative
     */
    public DirectoryEntry(String distinguishedName, List<String> objectClasses,
            List<Attribute> attributes, int entryIndex) {
        Preconditions.checkArgument(StringUtils.isNotBlank(distinguishedName),
                "distinguishedName must not be blank");
        Preconditions.checkArgument(entryIndex >= 0, "entryIndex must not be negative");
        this.distinguishedName = distinguishedName;
        this.objectClasses = ImmutableList.copyOf(objectClasses);
        this.attributes = ImmutableList.copyOf(attributes);
        this.entryIndex = entryIndex;
    }

    /**
     * Returns a copy of this entry with replaced attributes.
     *
     * @param replacement attributes in file order
     * @return new entry with the same DN, object classes and index
     */
    public DirectoryEntry withAttributes(List<Attribute> replacement) {
        return new DirectoryEntry(distinguishedName, objectClasses, replacement, entryIndex);
    }
}
