package io.github.yok.flexschema.ldif;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses a directory-export (LDIF-style) document into {@link DirectoryEntry} records.
 *
 * <p>
 * The parser is a state machine ({@link ParserState}) driven by a cursor over the lines produced
 * by {@link LineScanner}:
 * </p>
 * <ol>
 * <li>A {@code dn:} line (case-insensitive) closes the open attribute and the open entry, then
 * starts a new entry.</li>
 * <li>Any other line with a colon inside an entry is an attribute line. An empty value followed by
 * continuation lines is unfolded by lookahead: the leading space of each continuation line is
 * removed and the parts are concatenated without separator.</li>
 * <li>{@code objectClass} values go to {@link DirectoryEntry#getObjectClasses()} only.</li>
 * <li>A line repeating the name of the open attribute (exact, case-sensitive match) adds a value
 * to it; any other name closes it and opens a new one.</li>
 * <li>Blank lines, comments, lines without colon and continuation lines that were not consumed
 * by a lookahead are skipped.</li>
 * </ol>
 *
 * <p>
 * The open attribute is flushed from exactly three places: a new attribute name, a new entry and
 * the end of input. An attribute without value and an entry without DN are never emitted. The
 * parser never fails on structural problems. Instances hold no state between calls.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class EntryParser {

    private static final String DN_PREFIX = "dn:";

    private static final String OBJECT_CLASS = "objectClass";

    private static final Splitter DN_SPLITTER = Splitter.on(',');

    private static final Joiner DN_JOINER = Joiner.on(',');

    /**
     * Parses the given document.
     *
     * @param content decoded document text
     * @return entries in file order plus the derived base DN
     */
    public LdifParseResult parse(String content) {
        LineScanner.ScannedLines lines = LineScanner.scan(content);
        ParseRun run = new ParseRun();

        int cursor = 0;
        while (cursor < lines.size()) {
            LdifLine line = lines.get(cursor++);
            if (line.isSkippable()) {
                continue;
            }
            if (line.isContinuation()) {
                log.debug("Skipped continuation line without open value at line {}",
                        line.getIndex() + 1);
                continue;
            }

            String text = line.getText().trim();
            if (StringUtils.startsWithIgnoreCase(text, DN_PREFIX)) {
                run.startEntry(text.substring(DN_PREFIX.length()).trim());
                continue;
            }

            int colon = text.indexOf(':');
            if (colon < 0 || run.getState() == ParserState.OUTSIDE_ENTRY) {
                log.debug("Skipped malformed line {}: {}", line.getIndex() + 1, text);
                continue;
            }

            String name = text.substring(0, colon).trim();
            StringBuilder value = new StringBuilder(text.substring(colon + 1).trim());
            if (value.length() == 0) {
                while (cursor < lines.size() && lines.get(cursor).isContinuation()) {
                    value.append(lines.get(cursor).getText().substring(1));
                    cursor++;
                }
            }
            run.acceptAttribute(name, value.toString());
        }
        run.finish();

        List<DirectoryEntry> entries = run.getEntries();
        String baseDn = entries.isEmpty() ? null
                : deriveBaseDistinguishedName(entries.get(0).getDistinguishedName());
        log.info("Parsed {} directory entries from {} lines (base DN: {})", entries.size(),
                lines.size(), baseDn);
        return new LdifParseResult(entries, baseDn);
    }

    /**
     * Derives a base DN from a full DN by keeping its last two comma-separated components.
     *
     * @param distinguishedName full DN
     * @return the last two components, or the whole DN if it has fewer than two
     */
    public static String deriveBaseDistinguishedName(String distinguishedName) {
        List<String> parts = DN_SPLITTER.splitToList(distinguishedName);
        if (parts.size() < 2) {
            return distinguishedName;
        }
        return DN_JOINER.join(parts.subList(parts.size() - 2, parts.size())).trim();
    }

    // Value accumulation for the attribute currently open.
    private static final class AttributeBuffer {

        private final String name;
        private final List<String> values = new ArrayList<>();
        private final boolean binary;

        AttributeBuffer(String name, String firstValue) {
            this.name = name;
            this.values.add(firstValue);
            this.binary = BinaryHeuristic.isBinary(firstValue);
        }

        Attribute toAttribute() {
            return new Attribute(name, values, binary);
        }
    }

    // Mutable state of a single parse() call.
    private static final class ParseRun {

        @Getter
        private final List<DirectoryEntry> entries = new ArrayList<>();

        @Getter
        private ParserState state = ParserState.OUTSIDE_ENTRY;

        private String distinguishedName;
        private List<String> objectClasses = new ArrayList<>();
        private List<Attribute> attributes = new ArrayList<>();
        private Optional<AttributeBuffer> openAttribute = Optional.empty();
        private int entryCounter;

        void startEntry(String dn) {
            if (state != ParserState.OUTSIDE_ENTRY) {
                flushOpenAttribute();
                flushEntry();
            }
            distinguishedName = dn;
            objectClasses = new ArrayList<>();
            attributes = new ArrayList<>();
            state = ParserState.IN_ENTRY;
        }

        void acceptAttribute(String name, String value) {
            if (OBJECT_CLASS.equalsIgnoreCase(name)) {
                objectClasses.add(value);
                return;
            }
            if (openAttribute.isPresent() && openAttribute.get().name.equals(name)) {
                openAttribute.get().values.add(value);
                return;
            }
            flushOpenAttribute();
            openAttribute = Optional.of(new AttributeBuffer(name, value));
            state = ParserState.IN_ATTRIBUTE;
        }

        void finish() {
            if (state != ParserState.OUTSIDE_ENTRY) {
                flushOpenAttribute();
                flushEntry();
            }
            state = ParserState.OUTSIDE_ENTRY;
        }

        private void flushOpenAttribute() {
            openAttribute.filter(buffer -> !buffer.values.isEmpty())
                    .ifPresent(buffer -> attributes.add(buffer.toAttribute()));
            openAttribute = Optional.empty();
            state = ParserState.IN_ENTRY;
        }

        private void flushEntry() {
            if (StringUtils.isBlank(distinguishedName)) {
                log.debug("Discarded entry without distinguished name ({} attributes)",
                        attributes.size());
                return;
            }
            entries.add(new DirectoryEntry(distinguishedName, objectClasses, attributes,
                    entryCounter++));
        }
    }
}
