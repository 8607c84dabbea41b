package io.github.yok.flexschema.parser;

import com.google.common.base.Splitter;
import io.github.yok.flexschema.inference.SampleRecord;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * {@link RecordSource} for line-oriented text structured by a regular expression, such as log
 * files.
 *
 * <p>
 * The pattern from {@link ParseOptions#getPattern()} is searched in every non-blank line. The
 * first match of a line becomes one record. When the pattern declares named groups
 * ({@code (?<level>...)}) those names are the fields; otherwise every capturing group becomes a
 * field named {@code GroupN}. Lines without a match are skipped and counted.
 * </p>
 */
@Slf4j
public class RegexRecordSource implements RecordSource {

    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException if no pattern is given or it is not a valid expression
     */
    @Override
    public List<SampleRecord> read(String content, ParseOptions options) {
        Validate.isTrue(StringUtils.isNotBlank(options.getPattern()),
                "a pattern is required for regex-structured content");
        Pattern pattern = Pattern.compile(options.getPattern());
        Set<String> groupNames = namedGroups(options.getPattern());

        List<SampleRecord> records = new ArrayList<>();
        int unmatched = 0;
        for (String line : LINE_SPLITTER.split(StringUtils.defaultString(content))) {
            if (StringUtils.isBlank(line)) {
                continue;
            }
            Matcher matcher = pattern.matcher(line);
            if (!matcher.find()) {
                unmatched++;
                continue;
            }
            records.add(toRecord(matcher, groupNames));
        }
        if (unmatched > 0) {
            log.warn("{} lines did not match pattern [{}]", unmatched, options.getPattern());
        }
        log.info("Read {} regex records", records.size());
        return records;
    }

    /**
     * Extracts the named groups declared by a pattern, in declaration order.
     *
     * @param regex regular expression
     * @return group names
     */
    public static Set<String> namedGroups(String regex) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = NAMED_GROUP.matcher(regex);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static SampleRecord toRecord(Matcher matcher, Set<String> groupNames) {
        SampleRecord record = new SampleRecord();
        if (groupNames.isEmpty()) {
            for (int g = 1; g <= matcher.groupCount(); g++) {
                record.add("Group" + g, StringUtils.trimToNull(matcher.group(g)));
            }
        } else {
            for (String name : groupNames) {
                record.add(name, StringUtils.trimToNull(matcher.group(name)));
            }
        }
        return record;
    }
}
