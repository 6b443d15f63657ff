package io.formulagen.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.formulagen.core.error.SchemaParseException;
import io.formulagen.core.model.Field;
import io.formulagen.core.model.FieldType;
import io.formulagen.core.model.Schema;
import io.formulagen.core.model.Table;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses schema metadata ({@code {tables: [{id, name, fields: [...]}]}}) from JSON or YAML into
 * a {@link Schema}.
 *
 * <p>
 * The document is first validated against the bundled
 * {@code schema/schema-metadata.schema.json}; structural problems are reported together in a
 * single {@link SchemaParseException}. Field options accept both the short names
 * ({@code linkedFieldId}, {@code aggregation}) and the platform's own names
 * ({@code recordLinkFieldId}, {@code aggregationFunction}, {@code fieldIdInLinkedTable}).
 */
public final class SchemaParser {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String METADATA_SCHEMA_RESOURCE = "/schema/schema-metadata.schema.json";

    private final JsonSchema metadataSchema;

    public SchemaParser() {
        this.metadataSchema = loadMetadataSchema();
    }

    /**
     * Parses a JSON or YAML metadata file.
     *
     * @throws SchemaParseException if the file cannot be read, is malformed, or does not conform
     */
    public Schema parse(Path path) {
        String source = path.toString();
        if (!Files.exists(path)) {
            throw new SchemaParseException("Schema metadata file not found: " + path, source);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(YAML_MAPPER.readTree(in), source);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read schema metadata: " + e.getMessage(), e, source);
        }
    }

    /** Parses JSON or YAML metadata held in a string. */
    public Schema parse(String content, String source) {
        try {
            return parse(YAML_MAPPER.readTree(content), source);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse schema metadata: " + e.getMessage(), e, source);
        }
    }

    /** Validates and maps an already-parsed metadata tree. */
    public Schema parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new SchemaParseException("Schema metadata is empty", source);
        }
        validate(root, source);

        List<Table> tables = new ArrayList<>();
        for (JsonNode tableNode : root.get("tables")) {
            String tableId = tableNode.get("id").asText();
            List<Field> fields = new ArrayList<>();
            for (JsonNode fieldNode : tableNode.get("fields")) {
                fields.add(mapField(fieldNode, tableId));
            }
            tables.add(new Table(tableId, tableNode.get("name").asText(), fields));
        }

        try {
            Schema schema = Schema.of(tables);
            LOG.info("Schema parsed: source={}, tables={}, fields={}", source, tables.size(), schema.fieldCount());
            return schema;
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException(e.getMessage(), e, source);
        }
    }

    private void validate(JsonNode root, String source) {
        Set<ValidationMessage> errors = metadataSchema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SchemaParseException("Schema metadata does not conform: " + detail, source);
        }
    }

    private static Field mapField(JsonNode node, String tableId) {
        String id = node.get("id").asText();
        String typeName = node.get("type").asText();
        FieldType type = FieldType.fromWireName(typeName);
        if (type == FieldType.UNKNOWN) {
            LOG.warn("Unknown field type '{}' for field {}; treating it as stored data", typeName, id);
        }
        JsonNode options = node.path("options");
        List<String> referenced = new ArrayList<>();
        for (JsonNode ref : options.path("referencedFieldIds")) {
            referenced.add(ref.asText());
        }
        String resultTypeName = optionalString(options.path("result"), "type");
        return new Field(
                id,
                node.get("name").asText(),
                type,
                tableId,
                optionalString(options, "formula"),
                firstPresent(options, "linkedFieldId", "recordLinkFieldId"),
                firstPresent(options, "fieldIdInLinkedTable", "targetFieldId"),
                firstPresent(options, "aggregation", "aggregationFunction"),
                optionalString(options, "linkedTableId"),
                optionalString(options, "inverseLinkFieldId"),
                options.path("prefersSingleRecordLink").asBoolean(false),
                referenced,
                resultTypeName != null ? FieldType.fromWireName(resultTypeName) : null);
    }

    private static String firstPresent(JsonNode node, String... keys) {
        for (String key : keys) {
            String value = optionalString(node, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String optionalString(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || !value.isTextual() || value.asText().isEmpty()) {
            return null;
        }
        return value.asText();
    }

    private static JsonSchema loadMetadataSchema() {
        try (InputStream in = SchemaParser.class.getResourceAsStream(METADATA_SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + METADATA_SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + METADATA_SCHEMA_RESOURCE, e);
        }
    }
}
