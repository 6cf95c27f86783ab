package io.elementschema.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.elementschema.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Overrides for validator message templates, keyed by validator key (e.g. {@code shorter-than}).
 *
 * <p>Templates use the same {@code {placeholder}} syntax as the built-in messages. A catalog is
 * usually loaded from YAML:
 *
 * <pre>
 * messages:
 *   present: "Please fill in this field."
 *   shorter-than: "Use fewer than {upperbound} characters."
 * </pre>
 *
 * <p>Immutable and thread-safe.
 */
public final class MessageCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(MessageCatalog.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final MessageCatalog EMPTY = new MessageCatalog(Map.of());

    /** Recognized top-level keys. */
    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("messages");

    private final Map<String, String> templates;

    private MessageCatalog(Map<String, String> templates) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    /** A catalog without overrides. */
    public static MessageCatalog empty() {
        return EMPTY;
    }

    /**
     * Creates a catalog from a key → template map.
     *
     * @param templates the overrides; copied
     * @return an immutable catalog
     */
    public static MessageCatalog of(Map<String, String> templates) {
        if (templates == null || templates.isEmpty()) {
            return EMPTY;
        }
        return new MessageCatalog(templates);
    }

    /**
     * Loads a catalog from a YAML file.
     *
     * @throws ConfigLoadException if the file cannot be read or has the wrong shape
     */
    public static MessageCatalog load(Path path) {
        String source = path.toString();
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, source);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read message catalog: " + e.getMessage(), e, source);
        }
    }

    /**
     * Loads a catalog from a classpath resource (absolute, without the leading slash).
     *
     * @throws ConfigLoadException if the resource is missing or has the wrong shape
     */
    public static MessageCatalog loadResource(String resource) {
        ClassLoader loader = MessageCatalog.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigLoadException("Message catalog resource not found", resource);
            }
            return parse(in, resource);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read message catalog: " + e.getMessage(), e, resource);
        }
    }

    private static MessageCatalog parse(InputStream in, String source) throws IOException {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigLoadException("Invalid YAML in message catalog: " + e.getOriginalMessage(), e, source);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            LOG.info("Loaded empty message catalog: source={}", source);
            return EMPTY;
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Message catalog must be a mapping", source);
        }
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_ROOT_KEYS.contains(name)) {
                throw new ConfigLoadException("Unknown key in message catalog: '" + name + "'", source);
            }
        }
        JsonNode messages = root.path("messages");
        if (messages.isMissingNode() || messages.isNull()) {
            return EMPTY;
        }
        if (!messages.isObject()) {
            throw new ConfigLoadException("'messages' must be a mapping of validator key to template", source);
        }
        Map<String, String> templates = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = messages.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new ConfigLoadException("Template for '" + field.getKey() + "' must be a string", source);
            }
            templates.put(field.getKey(), field.getValue().asText());
        }
        LOG.info("Loaded message catalog: source={}, messages={}", source, templates.size());
        return of(templates);
    }

    /** The override for a validator key, if any. */
    public Optional<String> lookup(String key) {
        return Optional.ofNullable(templates.get(key));
    }

    /** The override for a validator key, or {@code fallback}. */
    public String resolve(String key, String fallback) {
        return templates.getOrDefault(key, fallback);
    }

    public int size() {
        return templates.size();
    }

    @Override
    public String toString() {
        return "MessageCatalog" + templates.keySet();
    }
}
