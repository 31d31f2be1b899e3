package com.toolgate.policy.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.toolgate.common.json.JsonSupport;
import com.toolgate.policy.PolicyConfigurationException;
import com.toolgate.policy.model.Policy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parses JSON or YAML policy documents into immutable {@link Policy} instances.
 * <p>
 * Files ending in {@code .yaml}/{@code .yml} are read as YAML, {@code .json}
 * as JSON; any other suffix is tried as YAML first, then JSON. Environment
 * references are substituted on the parsed tree before binding. Every failure
 * surfaces as {@link PolicyConfigurationException}.
 */
@Slf4j
public class PolicyLoader {

    private static final TypeReference<LinkedHashMap<String, Object>> TREE_TYPE = new TypeReference<>() {
    };

    private static final YAMLMapper YAML_MAPPER = new YAMLMapper();

    private final Map<String, String> env;

    public PolicyLoader() {
        this(System.getenv());
    }

    public PolicyLoader(Map<String, String> env) {
        this.env = env != null ? env : Map.of();
    }

    /**
     * Load a policy file.
     */
    public Policy load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PolicyConfigurationException("Policy file not found: " + path);
        }
        String raw;
        try {
            raw = Files.readString(path);
        } catch (IOException e) {
            throw new PolicyConfigurationException("Failed to read policy file: " + path, e);
        }
        Policy policy = switch (formatOf(path)) {
            case "yaml" -> parseYaml(raw);
            case "json" -> parse(raw);
            default -> parseEither(raw);
        };
        log.info("Policy {} v{} loaded from: {}", policy.policyId(), policy.version(), path);
        return policy;
    }

    /**
     * Parse a policy from JSON text.
     */
    public Policy parse(String json) {
        return fromMap(readTree(json, JsonSupport.mapper(), "JSON"));
    }

    /**
     * Parse a policy from YAML text.
     */
    public Policy parseYaml(String yaml) {
        return fromMap(readTree(yaml, YAML_MAPPER, "YAML"));
    }

    private Policy parseEither(String raw) {
        Map<String, Object> tree;
        try {
            tree = readTree(raw, YAML_MAPPER, "YAML");
        } catch (PolicyConfigurationException yamlFailure) {
            log.debug("Policy is not YAML, trying JSON: {}", yamlFailure.getMessage());
            tree = readTree(raw, JsonSupport.mapper(), "JSON");
        }
        return fromMap(tree);
    }

    private static Map<String, Object> readTree(String raw, ObjectMapper mapper, String format) {
        if (raw == null || raw.isBlank()) {
            throw new PolicyConfigurationException("Policy document is empty");
        }
        Map<String, Object> tree;
        try {
            tree = mapper.readValue(raw, TREE_TYPE);
        } catch (JsonProcessingException e) {
            throw new PolicyConfigurationException("Policy document is not a " + format + " object: "
                    + e.getOriginalMessage(), e);
        }
        if (tree == null) {
            throw new PolicyConfigurationException("Policy document is empty");
        }
        return tree;
    }

    static String formatOf(Path path) {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
        if (name.endsWith(".yaml") || name.endsWith(".yml"))
            return "yaml";
        if (name.endsWith(".json"))
            return "json";
        return "unknown";
    }

    /**
     * Bind an already parsed document.
     */
    public Policy fromMap(Map<String, ?> document) {
        if (document == null) {
            throw new PolicyConfigurationException("Policy document is empty");
        }
        Object resolved = EnvSubstitution.resolve(document, env);
        try {
            return JsonSupport.mapper().convertValue(resolved, Policy.class);
        } catch (IllegalArgumentException e) {
            PolicyConfigurationException cause = findConfigurationCause(e);
            if (cause != null) {
                throw cause;
            }
            throw new PolicyConfigurationException("Invalid policy document: " + e.getMessage(), e);
        }
    }

    private static PolicyConfigurationException findConfigurationCause(Throwable t) {
        Throwable current = t;
        while (current != null) {
            if (current instanceof PolicyConfigurationException pce) {
                return pce;
            }
            current = current.getCause();
        }
        return null;
    }
}
