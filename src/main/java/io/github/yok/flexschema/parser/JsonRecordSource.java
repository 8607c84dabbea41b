package io.github.yok.flexschema.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import io.github.yok.flexschema.inference.SampleRecord;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link RecordSource} for JSON documents and JSON Lines.
 *
 * <p>
 * The content is first read as one JSON document: an array root yields one record per element,
 * an object root yields a single record. When the content is not a single document, it is read as
 * JSON Lines; lines that do not parse are skipped with a warning.
 * </p>
 *
 * <p>
 * Nested objects are flattened into dotted field names ({@code address.city}). Arrays contribute
 * one value per element, which makes the field multi-valued. JSON {@code null} is recorded as
 * {@code null}; other scalars use their text form.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JsonRecordSource implements RecordSource {

    private static final Splitter LINE_SPLITTER = Splitter.on('\n').omitEmptyStrings().trimResults();

    private final ObjectMapper mapper =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * {@inheritDoc}
     */
    @Override
    public List<SampleRecord> read(String content, ParseOptions options)
            throws MalformedContentException {
        List<JsonNode> roots = readRoots(content);
        List<SampleRecord> records = new ArrayList<>();
        for (JsonNode root : roots) {
            if (root.isArray()) {
                for (JsonNode element : root) {
                    records.add(toRecord(element));
                }
            } else {
                records.add(toRecord(root));
            }
        }
        if (records.isEmpty() && roots.isEmpty()) {
            throw new MalformedContentException("No valid JSON records found");
        }
        log.info("Read {} JSON records", records.size());
        return records;
    }

    private List<JsonNode> readRoots(String content) {
        List<JsonNode> roots = new ArrayList<>();
        try {
            JsonNode root = mapper.readTree(StringUtils.defaultString(content));
            if (root != null && !root.isMissingNode()) {
                roots.add(root);
            }
            return roots;
        } catch (JsonProcessingException e) {
            log.debug("Content is not a single JSON document, reading as JSON Lines: {}",
                    e.getOriginalMessage());
        }

        int lineNo = 0;
        for (String line : LINE_SPLITTER.split(content)) {
            lineNo++;
            try {
                roots.add(mapper.readTree(line));
            } catch (JsonProcessingException e) {
                log.warn("Skipped unparseable JSON line {}: {}", lineNo, e.getOriginalMessage());
            }
        }
        return roots;
    }

    private static SampleRecord toRecord(JsonNode node) {
        SampleRecord record = new SampleRecord();
        if (node.isObject()) {
            flatten("", node, record);
        } else {
            record.add("value", scalarText(node));
        }
        return record;
    }

    private static void flatten(String prefix, JsonNode node, SampleRecord record) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                flatten(path, value, record);
            } else if (value.isArray()) {
                addArray(path, value, record);
            } else {
                record.add(path, scalarText(value));
            }
        }
    }

    private static void addArray(String path, JsonNode array, SampleRecord record) {
        if (array.isEmpty()) {
            record.addAll(path, List.of());
            return;
        }
        for (JsonNode element : array) {
            if (element.isObject()) {
                flatten(path, element, record);
            } else if (element.isArray()) {
                addArray(path, element, record);
            } else {
                record.add(path, scalarText(element));
            }
        }
    }

    private static String scalarText(JsonNode node) {
        return node.isNull() ? null : node.asText();
    }
}
