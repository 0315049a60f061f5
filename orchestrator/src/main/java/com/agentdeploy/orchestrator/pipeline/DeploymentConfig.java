package com.agentdeploy.orchestrator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Typed view of a job's config, parsed only inside the pipeline.
 *
 * Required: {@code source} (build context: a git url or an archive uri).
 * Everything else defaults to what a single small agent service needs.
 *
 * <pre>
 * {
 *   "source":       "gs://bucket/agents/a1.tar.gz",
 *   "serviceName":  "agent-a1",          // default "agent-" + targetId, lower-cased
 *   "imageName":    "agent-a1",          // default = serviceName
 *   "region":       "us-central1",
 *   "memory":       "2Gi",
 *   "cpu":          "1",
 *   "minInstances": 0,
 *   "maxInstances": 10,
 *   "healthPath":   "/health",
 *   "env":          { "AGENT_ID": "a1" }
 * }
 * </pre>
 */
public record DeploymentConfig(
        String source,
        String serviceName,
        String imageName,
        String region,
        String memory,
        String cpu,
        int    minInstances,
        int    maxInstances,
        String healthPath,
        Map<String, String> env) {

    public static final String DEFAULT_REGION      = "us-central1";
    public static final String DEFAULT_MEMORY      = "2Gi";
    public static final String DEFAULT_CPU         = "1";
    public static final int    DEFAULT_MAX_INSTANCES = 10;
    public static final String DEFAULT_HEALTH_PATH = "/health";

    // Runtime service names: lower-case DNS label, at most 63 chars.
    private static final Pattern SERVICE_NAME = Pattern.compile("[a-z]([-a-z0-9]{0,61}[a-z0-9])?");
    private static final Pattern ENV_KEY      = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern MEMORY       = Pattern.compile("\\d+(Mi|Gi)");

    public DeploymentConfig {
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    /**
     * @throws StepException with kind INVALID_CONFIG naming the offending field
     */
    public static DeploymentConfig parse(String configJson, String targetId, ObjectMapper json) {
        JsonNode root;
        try {
            root = json.readTree(configJson == null ? "" : configJson);
        } catch (JsonProcessingException e) {
            throw invalid("config is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw invalid("config must be a JSON object");
        }

        String source = text(root, "source", null);
        if (source == null || source.isBlank()) {
            throw invalid("config.source is required");
        }

        String serviceName = text(root, "serviceName", defaultServiceName(targetId));
        if (!SERVICE_NAME.matcher(serviceName).matches()) {
            throw invalid("config.serviceName '" + serviceName
                    + "' must be a lower-case DNS label of at most 63 characters");
        }
        String imageName = text(root, "imageName", serviceName);

        String memory = text(root, "memory", DEFAULT_MEMORY);
        if (!MEMORY.matcher(memory).matches()) {
            throw invalid("config.memory '" + memory + "' must look like 512Mi or 2Gi");
        }

        int minInstances = integer(root, "minInstances", 0);
        int maxInstances = integer(root, "maxInstances", DEFAULT_MAX_INSTANCES);
        if (minInstances < 0 || maxInstances < 1 || maxInstances > 100 || minInstances > maxInstances) {
            throw invalid("config instance bounds must satisfy 0 <= minInstances <= maxInstances <= 100"
                    + " and maxInstances >= 1");
        }

        String healthPath = text(root, "healthPath", DEFAULT_HEALTH_PATH);
        if (!healthPath.startsWith("/")) {
            throw invalid("config.healthPath must start with '/'");
        }

        return new DeploymentConfig(
                source.trim(),
                serviceName,
                imageName,
                text(root, "region", DEFAULT_REGION),
                memory,
                text(root, "cpu", DEFAULT_CPU),
                minInstances,
                maxInstances,
                healthPath,
                env(root));
    }

    static String defaultServiceName(String targetId) {
        String cleaned = ("agent-" + targetId).toLowerCase(Locale.ROOT).replaceAll("[^-a-z0-9]", "-");
        if (cleaned.length() > 63) {
            cleaned = cleaned.substring(0, 63);
        }
        while (cleaned.endsWith("-")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        return cleaned;
    }

    // ------------------------------------------------------------------
    // Field helpers
    // ------------------------------------------------------------------

    private static String text(JsonNode root, String field, String fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isValueNode()) {
            throw invalid("config." + field + " must be a string");
        }
        return node.asText();
    }

    private static int integer(JsonNode root, String field, int fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw invalid("config." + field + " must be an integer");
        }
        return node.asInt();
    }

    private static Map<String, String> env(JsonNode root) {
        JsonNode node = root.get("env");
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw invalid("config.env must be an object of strings");
        }
        Map<String, String> env = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            if (!ENV_KEY.matcher(f.getKey()).matches()) {
                throw invalid("config.env key '" + f.getKey() + "' is not a valid variable name");
            }
            if (!f.getValue().isValueNode() || f.getValue().isNull()) {
                throw invalid("config.env." + f.getKey() + " must be a string");
            }
            env.put(f.getKey(), f.getValue().asText());
        }
        return env;
    }

    private static StepException invalid(String message) {
        return new StepException(StepException.Kind.INVALID_CONFIG, message);
    }
}
