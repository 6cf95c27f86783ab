package io.elementschema.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementType;
import io.elementschema.core.element.Sentinel;
import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.InvalidArgumentException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns Jackson trees into raw element input.
 *
 * <ul>
 * <li>objects → {@link LinkedHashMap} in document order</li>
 * <li>arrays → {@link List}</li>
 * <li>integral numbers → {@link Long}, or {@link java.math.BigInteger} beyond its range</li>
 * <li>floating-point numbers → {@link Double}, or {@link java.math.BigDecimal} when the parser
 * produced one</li>
 * <li>text → {@link String}, booleans → {@link Boolean}, binary → {@code byte[]}</li>
 * <li>{@code null} → {@code null}; a missing node → {@link Sentinel#UNSPECIFIED}</li>
 * </ul>
 *
 * <p>Thread-safe: stateless utility class.
 */
public final class JsonInput {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonInput() {}

    /** Converts a JSON tree into raw input. */
    public static Object toRaw(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return Sentinel.UNSPECIFIED;
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), toRaw(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            node.forEach(item -> list.add(toRaw(item)));
            return list;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isBigDecimal()) {
            return node.decimalValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isBinary()) {
            try {
                return node.binaryValue();
            } catch (IOException e) {
                throw new InvalidArgumentException("Unreadable binary node: " + e.getMessage(), e, Operation.UPDATE);
            }
        }
        return node.asText();
    }

    /** Creates an element of {@code type} with the converted tree as raw input. */
    public static <E extends Element<?>> E bind(ElementType<E> type, JsonNode node) {
        return type.create(toRaw(node));
    }

    /**
     * Parses a JSON document and binds it.
     *
     * @throws InvalidArgumentException if {@code json} is not valid JSON
     */
    public static <E extends Element<?>> E bind(ElementType<E> type, String json) {
        try {
            return bind(type, MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("Not a JSON document: " + e.getOriginalMessage(), e, Operation.UPDATE);
        }
    }
}
