package io.github.yok.flexschema.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.flexschema.inference.SchemaField;
import io.github.yok.flexschema.inference.SchemaResult;
import io.github.yok.flexschema.inference.SemanticType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link DeclaredSchemaSource} for Avro schema documents ({@code .avsc}).
 *
 * <p>
 * The root must be a {@code record}. Each field maps to one {@link SchemaField}:
 * </p>
 * <ul>
 * <li>a union containing {@code "null"} makes the field nullable; its first other branch gives the
 * type;</li>
 * <li>nested records are flattened into dotted names ({@code address.city}); fields of a nullable
 * record are nullable too;</li>
 * <li>{@code array} fields take the element type and are multi-valued;</li>
 * <li>{@code fixed} fields recommend their declared size as length;</li>
 * <li>the field {@code default}, when present, is the only sample value.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AvroSchemaSource implements DeclaredSchemaSource {

    private static final String NULL_TYPE = "null";

    // Primitive and named Avro types without logical type
    private static final Map<String, SemanticType> PRIMITIVES = ImmutableMap
            .<String, SemanticType>builder().put("string", SemanticType.STRING)
            .put("enum", SemanticType.STRING).put("int", SemanticType.INTEGER)
            .put("long", SemanticType.INTEGER).put("float", SemanticType.DECIMAL)
            .put("double", SemanticType.DECIMAL).put("boolean", SemanticType.BOOLEAN)
            .put("bytes", SemanticType.BINARY).put("fixed", SemanticType.BINARY).build();

    private static final Map<String, SemanticType> LOGICAL_TYPES = ImmutableMap
            .<String, SemanticType>builder().put("date", SemanticType.DATE)
            .put("timestamp-millis", SemanticType.TIMESTAMP)
            .put("timestamp-micros", SemanticType.TIMESTAMP)
            .put("local-timestamp-millis", SemanticType.TIMESTAMP)
            .put("local-timestamp-micros", SemanticType.TIMESTAMP)
            .put("decimal", SemanticType.DECIMAL).put("uuid", SemanticType.STRING).build();

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * {@inheritDoc}
     */
    @Override
    public SchemaResult readSchema(String content) throws MalformedContentException {
        JsonNode root;
        try {
            root = mapper.readTree(StringUtils.defaultString(content));
        } catch (JsonProcessingException e) {
            throw new MalformedContentException(
                    "Invalid Avro schema format: " + e.getOriginalMessage(), e);
        }
        if (root == null || !isRecord(root)) {
            throw new MalformedContentException("Avro schema root must be a record with fields");
        }

        List<SchemaField> fields = new ArrayList<>();
        collect("", root, false, fields);
        log.info("Read Avro schema [{}]: {} fields", root.path("name").asText(), fields.size());
        return new SchemaResult(ImmutableList.copyOf(fields), 0);
    }

    private void collect(String prefix, JsonNode record, boolean parentNullable,
            List<SchemaField> fields) {
        for (JsonNode field : record.path("fields")) {
            String name = field.path("name").asText();
            if (StringUtils.isBlank(name)) {
                log.warn("Skipped Avro field without name under [{}]", prefix);
                continue;
            }
            String path = prefix.isEmpty() ? name : prefix + "." + name;
            JsonNode type = field.path("type");
            boolean nullable = parentNullable || isNullableUnion(type);
            JsonNode effective = nonNullBranch(type);

            if (isRecord(effective)) {
                collect(path, effective, nullable, fields);
                continue;
            }
            boolean multiValued = false;
            if ("array".equals(effective.path("type").asText())) {
                multiValued = true;
                effective = nonNullBranch(effective.path("items"));
                if (isRecord(effective)) {
                    collect(path, effective, nullable, fields);
                    continue;
                }
            }
            SemanticType semanticType = typeOf(effective);
            Integer length = null;
            if ("fixed".equals(effective.path("type").asText())
                    && effective.path("size").canConvertToInt()) {
                length = effective.path("size").asInt();
            }
            List<String> samples = defaultSample(field.get("default"));
            log.debug("Avro field [{}]: type={}, nullable={}, multiValued={}", path, semanticType,
                    nullable, multiValued);
            fields.add(new SchemaField(path, semanticType, nullable, multiValued, length, samples));
        }
    }

    private static boolean isRecord(JsonNode node) {
        return node.isObject() && "record".equals(node.path("type").asText())
                && node.path("fields").isArray();
    }

    private static boolean isNullableUnion(JsonNode type) {
        if (!type.isArray()) {
            return type.isTextual() && NULL_TYPE.equals(type.asText());
        }
        for (JsonNode branch : type) {
            if (branch.isTextual() && NULL_TYPE.equals(branch.asText())) {
                return true;
            }
        }
        return false;
    }

    // First non-null branch of a union; the type itself otherwise
    private static JsonNode nonNullBranch(JsonNode type) {
        if (!type.isArray()) {
            return type;
        }
        for (JsonNode branch : type) {
            if (!(branch.isTextual() && NULL_TYPE.equals(branch.asText()))) {
                return branch;
            }
        }
        return type.path(0);
    }

    private static SemanticType typeOf(JsonNode type) {
        if (type.isTextual()) {
            return PRIMITIVES.getOrDefault(type.asText(), SemanticType.STRING);
        }
        String logicalType = type.path("logicalType").asText();
        if (LOGICAL_TYPES.containsKey(logicalType)) {
            return LOGICAL_TYPES.get(logicalType);
        }
        JsonNode inner = type.path("type");
        if (inner.isTextual()) {
            return PRIMITIVES.getOrDefault(inner.asText(), SemanticType.STRING);
        }
        // map or an unsupported nested type
        return SemanticType.STRING;
    }

    private static List<String> defaultSample(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return ImmutableList.of();
        }
        return ImmutableList.of(value.isValueNode() ? value.asText() : value.toString());
    }
}
