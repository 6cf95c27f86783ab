package io.elementschema.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.elementschema.core.element.Element;
import io.elementschema.core.element.PathedElement;
import java.util.List;

/**
 * Builds an RFC 9457 Problem Details document from a validated element tree.
 *
 * <p>The {@code errors} member lists one entry per element with recorded errors: the root under
 * path {@code []}, then every leaf in traversal order under its traversal path:
 *
 * <pre>
 * {
 *   "type": "urn:element-schema:error:validation-failed",
 *   "title": "Validation Failed",
 *   "status": 422,
 *   "detail": "2 elements have errors",
 *   "errors": [ { "path": [0, 1], "messages": ["Must be less than 10."] }, ... ]
 * }
 * </pre>
 *
 * <p>Thread-safe and immutable.
 */
public final class ErrorReportBuilder {

    public static final String URN = "urn:element-schema:error:validation-failed";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int DEFAULT_STATUS = 422;
    private static final String DEFAULT_TITLE = "Validation Failed";

    private final int status;
    private final String title;

    /** Creates a builder with HTTP status 422 and the default title. */
    public ErrorReportBuilder() {
        this(DEFAULT_STATUS, DEFAULT_TITLE);
    }

    /**
     * @param status the HTTP status code to report
     * @param title  the problem title
     */
    public ErrorReportBuilder(int status, String title) {
        this.status = status;
        this.title = title != null ? title : DEFAULT_TITLE;
    }

    /**
     * Builds the report. Does not validate: call {@code validate} on the root first.
     *
     * @param root         the root of the element tree
     * @param instancePath identifies the request or document, may be null
     * @return the problem document
     */
    public JsonNode build(Element<?> root, String instancePath) {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("type", URN);
        response.put("title", title);
        response.put("status", status);

        ArrayNode errors = MAPPER.createArrayNode();
        if (!root.errors().isEmpty()) {
            errors.add(entry(List.of(), root.errors()));
        }
        root.traverse()
                .filter(leaf -> leaf.element() != root && !leaf.element().errors().isEmpty())
                .forEach(leaf -> errors.add(entry(leaf.path(), leaf.element().errors())));

        response.put("detail", errors.size() == 1 ? "1 element has errors" : errors.size() + " elements have errors");
        if (instancePath != null) {
            response.put("instance", instancePath);
        } else {
            response.putNull("instance");
        }
        response.set("errors", errors);
        return response;
    }

    /** The leaves that have errors, in traversal order. */
    public static List<PathedElement> failingLeaves(Element<?> root) {
        return root.traverse().filter(leaf -> !leaf.element().errors().isEmpty()).toList();
    }

    public int status() {
        return status;
    }

    private static ObjectNode entry(List<Integer> path, List<String> messages) {
        ObjectNode entry = MAPPER.createObjectNode();
        ArrayNode pathNode = entry.putArray("path");
        path.forEach(pathNode::add);
        ArrayNode messageNode = entry.putArray("messages");
        messages.forEach(messageNode::add);
        return entry;
    }
}
