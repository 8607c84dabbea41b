package io.github.yok.flexschema.ldif;

/**
 * States of {@link EntryParser}.
 */
public enum ParserState {

    // No entry has been opened yet.
    OUTSIDE_ENTRY,

    // An entry is open and no attribute is being accumulated.
    IN_ENTRY,

    // An entry is open and an attribute is being accumulated.
    IN_ATTRIBUTE
}
