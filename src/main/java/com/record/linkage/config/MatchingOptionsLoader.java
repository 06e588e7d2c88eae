package com.record.linkage.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.record.linkage.core.model.AlgorithmType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads {@link MatchingOptions} from JSON. Keys that are absent keep their defaults.
 *
 * <pre>
 * {
 *   "thresholds": { "levenshtein": 0.8, "jaccard": 0.5 },
 *   "maxWorkers": 8,
 *   "ngramSize": 2
 * }
 * </pre>
 */
public class MatchingOptionsLoader {
    private static final Logger log = LoggerFactory.getLogger(MatchingOptionsLoader.class);

    public static final String DEFAULT_RESOURCE = "record-linkage-defaults.json";

    private final ObjectMapper objectMapper;

    public MatchingOptionsLoader() {
        this(new ObjectMapper());
    }

    public MatchingOptionsLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads options from a JSON reader, overlaying the built-in defaults.
     *
     * @throws ConfigurationLoadException if the input is not readable JSON
     * @throws IllegalArgumentException   if a value is out of range or names an unknown algorithm
     */
    public MatchingOptions fromJson(Reader reader) {
        JsonNode root;
        try {
            root = objectMapper.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new ConfigurationLoadException("Invalid matching configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationLoadException("Cannot read matching configuration", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return MatchingOptions.defaults();
        }
        if (!root.isObject()) {
            throw new ConfigurationLoadException("Matching configuration must be a JSON object");
        }

        MatchingOptions.Builder builder = MatchingOptions.builder();

        JsonNode thresholds = root.path("thresholds");
        if (!thresholds.isMissingNode()) {
            if (!thresholds.isObject()) {
                throw new ConfigurationLoadException("'thresholds' must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = thresholds.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.threshold(AlgorithmType.fromKey(field.getKey()), requireNumber(field.getValue(), field.getKey()));
            }
        }

        JsonNode maxWorkers = root.path("maxWorkers");
        if (!maxWorkers.isMissingNode()) {
            builder.maxWorkers(requireInt(maxWorkers, "maxWorkers"));
        }

        JsonNode ngramSize = root.path("ngramSize");
        if (!ngramSize.isMissingNode()) {
            builder.ngramSize(requireInt(ngramSize, "ngramSize"));
        }

        MatchingOptions options = builder.build();
        log.debug("config.loaded options={}", options);
        return options;
    }

    /**
     * Loads options from a classpath resource, falling back to defaults when the resource is absent.
     */
    public MatchingOptions fromClasspath(String resource) {
        InputStream in = MatchingOptionsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.info("config.resourceMissing resource={} using defaults", resource);
            return MatchingOptions.defaults();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException e) {
            throw new ConfigurationLoadException("Cannot close configuration resource " + resource, e);
        }
    }

    /**
     * Loads the bundled default configuration.
     */
    public MatchingOptions fromDefaultResource() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    private static double requireNumber(JsonNode node, String name) {
        if (!node.isNumber()) {
            throw new IllegalArgumentException(name + " must be a number, got " + node);
        }
        return node.asDouble();
    }

    private static int requireInt(JsonNode node, String name) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException(name + " must be an integer, got " + node);
        }
        return node.asInt();
    }
}
