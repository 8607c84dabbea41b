package io.github.yok.flexschema.inference;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Logical data types that can be proposed for a field.
 *
 * <p>
 * The type is a suggestion derived from sample values, not a declared schema. Callers are free to
 * override it.
 * </p>
 */
@Getter
@AllArgsConstructor
public enum SemanticType {

    STRING("String"),

    INTEGER("Integer"),

    DECIMAL("Decimal"),

    DATE("Date"),

    BOOLEAN("Boolean"),

    EMAIL("Email"),

    DISTINGUISHED_NAME("Distinguished Name"),

    TELEPHONE("Telephone"),

    PASSWORD("Password"),

    OBJECT_CLASS("Object Class"),

    TIMESTAMP("Timestamp"),

    BINARY_HASH("Binary Hash"),

    BINARY("Binary");

    // Label shown to users
    private final String displayName;
}
