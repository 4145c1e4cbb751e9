package com.cubyte.ecs.core.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON encoding of {@link Package} trees using Jackson.
 * <p>
 * Objects map to JSON objects (field order kept), arrays to JSON arrays, {@link Package.Kind#NONE} to
 * {@code null}. Integral JSON numbers read back as 64-bit integer scalars, every other number as a double.
 * <p>
 * The default mapper writes {@code NaN} and the infinities as bare tokens and accepts them on read, so every
 * double scalar survives a round trip. Such output is not strict JSON.
 */
public final class PackageJson {
    private final ObjectMapper mapper;

    public PackageJson() {
        this(JsonMapper.builder()
                .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .build());
    }

    public PackageJson(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public String toJson(Package pkg) {
        try {
            return mapper.writeValueAsString(toNode(pkg));
        } catch (JsonProcessingException e) {
            throw new PackageException("Failed to serialize package to JSON", e);
        }
    }

    /**
     * @throws PackageException if the text is not valid JSON
     */
    public Package fromJson(String json) {
        try {
            return fromNode(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new PackageException("Malformed package JSON: " + e.getOriginalMessage(), e);
        }
    }

    public void write(Package pkg, OutputStream output) throws IOException {
        mapper.writeValue(output, toNode(pkg));
    }

    /**
     * @throws PackageException if the stream holds malformed JSON
     * @throws IOException      if the stream cannot be read
     */
    public Package read(InputStream input) throws IOException {
        try {
            return fromNode(mapper.readTree(input));
        } catch (JsonProcessingException e) {
            throw new PackageException("Malformed package JSON: " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode toNode(Package pkg) {
        JsonNodeFactory nodes = mapper.getNodeFactory();
        switch (pkg.kind()) {
            case SCALAR:
                Object scalar = pkg.scalar();
                if (scalar instanceof Boolean b) return nodes.booleanNode(b);
                if (scalar instanceof Long l) return nodes.numberNode(l);
                if (scalar instanceof Double d) return nodes.numberNode(d);
                return nodes.textNode((String) scalar);
            case OBJECT:
                ObjectNode object = nodes.objectNode();
                for (Map.Entry<String, Package> field : pkg.fields().entrySet()) {
                    object.set(field.getKey(), toNode(field.getValue()));
                }
                return object;
            case ARRAY:
                ArrayNode array = nodes.arrayNode();
                for (Package element : pkg.elements()) {
                    array.add(toNode(element));
                }
                return array;
            default:
                return nodes.nullNode();
        }
    }

    public Package fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Package.none();
        }
        if (node.isBoolean()) {
            return Package.of(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new PackageException("Integer " + node.asText() + " does not fit in 64 bits");
            }
            return Package.of(node.longValue());
        }
        if (node.isNumber()) {
            return Package.of(node.doubleValue());
        }
        if (node.isTextual()) {
            return Package.of(node.textValue());
        }
        if (node.isObject()) {
            Package.ObjectBuilder builder = Package.objectBuilder();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.put(field.getKey(), fromNode(field.getValue()));
            }
            return builder.build();
        }
        if (node.isArray()) {
            List<Package> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromNode(element));
            }
            return Package.array(elements);
        }
        throw new PackageException("Unsupported JSON node " + node.getNodeType());
    }
}
