package io.github.yok.flexschema.ldif;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.flexschema.inference.SemanticType;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Attribute of a directory entry with all values observed for it.
 *
 * <p>
 * Instances are immutable. {@link #getInferredType()} is {@code null} until a type has been
 * assigned through {@link #withInferredType(SemanticType)}; the parser never assigns one.
 * </p>
 */
@Getter
@EqualsAndHashCode
@ToString
public class Attribute {

    // Case is preserved as written in the source
    private final String name;

    private final List<String> values;

    private final boolean binary;

    private final SemanticType inferredType;

    /**
     * Creates an attribute without an inferred type.
     *
     * @param name attribute name
     * @param values values in file order, at least one
     * @param binary whether the first value was classified as binary
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public Attribute(String name, List<String> values, boolean binary) {
        this(name, values, binary, null);
    }

    private Attribute(String name, List<String> values, boolean binary,
            SemanticType inferredType) {
        Preconditions.checkNotNull(name, "name must not be null");
        Preconditions.checkArgument(!values.isEmpty(), "attribute %s has no value", name);
        this.name = name;
        this.values = ImmutableList.copyOf(values);
        this.binary = binary;
        this.inferredType = inferredType;
    }

    /**
     * Determines whether the attribute holds more than one value.
     *
     * @return {@code true} if multi-valued
     */
    public boolean isMultiValued() {
        return values.size() > 1;
    }

    /**
     * Returns a copy of this attribute carrying the given type.
     *
     * @param type inferred type
     * @return typed copy
     */
    public Attribute withInferredType(SemanticType type) {
        return new Attribute(name, values, binary, type);
    }
}
