package io.lendflow.pattern;

import com.fasterxml.jackson.databind.JsonNode;
import io.lendflow.error.ConfigurationException;
import io.lendflow.model.MessageType;
import io.lendflow.pattern.condition.ConditionParser;
import io.lendflow.pattern.condition.ConditionSyntaxException;
import io.lendflow.pattern.condition.Expression;
import io.lendflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of collaboration patterns loaded from a JSON document shaped as
 * <pre>
 * {
 *   "collaboration_patterns": { "&lt;name&gt;": { "initiator", "agents", "steps", "error_handling" } },
 *   "agent_capabilities": { "&lt;agent&gt;": [ ... ] },
 *   "communication_protocols": { "agent_messaging": { "message_types": [ ... ] } }
 * }
 * </pre>
 * Every problem found while loading is collected and reported in one
 * {@link ConfigurationException}.
 */
public final class PatternCatalog {
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;
    private static final Logger log = LoggerFactory.getLogger(PatternCatalog.class);

    private final Map<String, CollaborationPattern> patterns;
    private final Map<String, List<String>> agentCapabilities;
    private final Set<MessageType> allowedMessageTypes;

    private PatternCatalog(
            Map<String, CollaborationPattern> patterns,
            Map<String, List<String>> agentCapabilities,
            Set<MessageType> allowedMessageTypes
    ) {
        this.patterns = Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
        this.agentCapabilities = Map.copyOf(agentCapabilities);
        this.allowedMessageTypes = Set.copyOf(allowedMessageTypes);
    }

    public static PatternCatalog of(Collection<CollaborationPattern> patterns) {
        Map<String, CollaborationPattern> byName = new LinkedHashMap<>();
        for (CollaborationPattern p : patterns) {
            if (byName.put(p.name(), p) != null) {
                throw new ConfigurationException("Duplicate collaboration pattern: " + p.name());
            }
        }
        return new PatternCatalog(byName, Map.of(), EnumSet.allOf(MessageType.class));
    }

    public static PatternCatalog load(Path file, int defaultTimeoutSeconds) {
        if (!Files.exists(file)) {
            throw new ConfigurationException("Collaboration pattern file not found: " + file);
        }
        try {
            return parse(Jsons.mapper().readTree(file.toFile()), defaultTimeoutSeconds);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read collaboration patterns: " + file, e);
        }
    }

    public static PatternCatalog parse(String json, int defaultTimeoutSeconds) {
        try {
            return parse(Jsons.mapper().readTree(json), defaultTimeoutSeconds);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid collaboration pattern JSON", e);
        }
    }

    public static PatternCatalog parse(JsonNode root, int defaultTimeoutSeconds) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Collaboration pattern document must be a JSON object");
        }
        List<String> issues = new ArrayList<>();
        int timeoutDefault = defaultTimeoutSeconds > 0 ? defaultTimeoutSeconds : DEFAULT_TIMEOUT_SECONDS;

        Map<String, CollaborationPattern> patterns = new LinkedHashMap<>();
        JsonNode patternsNode = root.path("collaboration_patterns");
        if (!patternsNode.isObject() || patternsNode.isEmpty()) {
            issues.add("collaboration_patterns must be a non-empty object");
        } else {
            Iterator<Map.Entry<String, JsonNode>> it = patternsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                CollaborationPattern pattern = parsePattern(entry.getKey(), entry.getValue(), timeoutDefault, issues);
                if (pattern != null) {
                    patterns.put(pattern.name(), pattern);
                }
            }
        }

        Map<String, List<String>> capabilities = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> caps = root.path("agent_capabilities").fields();
        while (caps.hasNext()) {
            Map.Entry<String, JsonNode> entry = caps.next();
            capabilities.put(entry.getKey(), textList(entry.getValue()));
        }

        Set<MessageType> messageTypes = EnumSet.noneOf(MessageType.class);
        JsonNode typesNode = root.path("communication_protocols").path("agent_messaging").path("message_types");
        if (typesNode.isArray()) {
            for (JsonNode t : typesNode) {
                try {
                    messageTypes.add(MessageType.fromString(t.asText("")));
                } catch (IllegalArgumentException e) {
                    issues.add("communication_protocols: " + e.getMessage());
                }
            }
        } else {
            messageTypes.addAll(EnumSet.allOf(MessageType.class));
        }

        if (!issues.isEmpty()) {
            throw new ConfigurationException("Invalid collaboration patterns: " + String.join("; ", issues));
        }
        log.info("Loaded {} collaboration pattern(s): {}", patterns.size(), patterns.keySet());
        return new PatternCatalog(patterns, capabilities, messageTypes);
    }

    private static CollaborationPattern parsePattern(String name, JsonNode node, int timeoutDefault, List<String> issues) {
        String prefix = "pattern '" + name + "': ";
        if (!node.isObject()) {
            issues.add(prefix + "definition must be an object");
            return null;
        }
        String initiator = node.path("initiator").asText("").trim();
        Set<String> agents = new LinkedHashSet<>(textList(node.path("agents")));
        if (initiator.isEmpty()) {
            issues.add(prefix + "initiator is required");
        } else if (!agents.isEmpty() && !agents.contains(initiator)) {
            issues.add(prefix + "initiator '" + initiator + "' is not one of the pattern agents");
        }

        List<StepDefinition> steps = new ArrayList<>();
        Set<String> stepNames = new HashSet<>();
        JsonNode stepsNode = node.path("steps");
        if (!stepsNode.isArray() || stepsNode.isEmpty()) {
            issues.add(prefix + "steps must be a non-empty array");
        } else {
            for (JsonNode stepNode : stepsNode) {
                StepDefinition step = parseStep(prefix, stepNode, timeoutDefault, issues);
                if (step == null) {
                    continue;
                }
                if (!stepNames.add(step.name())) {
                    issues.add(prefix + "duplicate step name '" + step.name() + "'");
                }
                if (!agents.isEmpty() && !agents.contains(step.agent())) {
                    issues.add(prefix + "step '" + step.name() + "' uses agent '" + step.agent() + "' outside the pattern agents");
                }
                steps.add(step);
            }
        }
        if (agents.isEmpty()) {
            // No explicit agent list: the initiator plus every step agent are permitted.
            if (!initiator.isEmpty()) {
                agents.add(initiator);
            }
            steps.forEach(s -> agents.add(s.agent()));
        }

        Map<String, ErrorPolicy> errorHandling = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> policies = node.path("error_handling").fields();
        while (policies.hasNext()) {
            Map.Entry<String, JsonNode> entry = policies.next();
            if (!stepNames.contains(entry.getKey())) {
                issues.add(prefix + "error_handling references unknown step '" + entry.getKey() + "'");
                continue;
            }
            JsonNode p = entry.getValue();
            try {
                errorHandling.put(entry.getKey(), new ErrorPolicy(
                        ErrorPolicy.OnError.fromString(p.path("on_error").asText(null)),
                        p.path("max_retries").asInt(0),
                        p.path("fallback").asText(null)
                ));
            } catch (IllegalArgumentException e) {
                issues.add(prefix + "error_handling '" + entry.getKey() + "': " + e.getMessage());
            }
        }

        return new CollaborationPattern(
                name,
                node.path("description").asText(""),
                initiator,
                agents,
                steps,
                errorHandling
        );
    }

    private static StepDefinition parseStep(String prefix, JsonNode node, int timeoutDefault, List<String> issues) {
        if (!node.isObject()) {
            issues.add(prefix + "step entries must be objects");
            return null;
        }
        String name = node.path("name").asText("").trim();
        String agent = node.path("agent").asText("").trim();
        if (name.isEmpty()) {
            issues.add(prefix + "step without name");
            return null;
        }
        if (agent.isEmpty()) {
            issues.add(prefix + "step '" + name + "' has no agent");
            return null;
        }
        int timeout = node.path("timeout_seconds").asInt(timeoutDefault);
        if (timeout <= 0) {
            issues.add(prefix + "step '" + name + "' timeout_seconds must be positive");
        }
        int retryCount = node.path("retry_count").asInt(0);
        if (retryCount < 0) {
            issues.add(prefix + "step '" + name + "' retry_count must be >= 0");
        }
        boolean eventTriggered = node.path("event_triggered").asBoolean(false);
        String trigger = node.hasNonNull("trigger_event") ? node.get("trigger_event").asText() : null;
        if (eventTriggered && (trigger == null || trigger.isBlank())) {
            issues.add(prefix + "step '" + name + "' is event_triggered without trigger_event");
        }
        String conditionSource = node.hasNonNull("condition") ? node.get("condition").asText() : null;
        Expression condition = null;
        if (conditionSource != null && !conditionSource.isBlank()) {
            try {
                condition = ConditionParser.parse(conditionSource);
            } catch (ConditionSyntaxException e) {
                issues.add(prefix + "step '" + name + "' condition: " + e.getMessage());
            }
        }
        return new StepDefinition(
                name,
                agent,
                node.path("description").asText(""),
                textList(node.path("inputs")),
                textList(node.path("outputs")),
                node.path("required").asBoolean(true),
                timeout,
                Math.max(0, retryCount),
                node.path("requires_confirmation").asBoolean(false),
                eventTriggered,
                trigger,
                conditionSource,
                condition
        );
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                String value = item.asText("").trim();
                if (!value.isEmpty()) {
                    out.add(value);
                }
            }
        }
        return out;
    }

    public Optional<CollaborationPattern> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(patterns.get(name));
    }

    public Set<String> patternNames() {
        return patterns.keySet();
    }

    public Collection<CollaborationPattern> patterns() {
        return patterns.values();
    }

    public Optional<List<String>> capabilitiesOf(String agentId) {
        return Optional.ofNullable(agentCapabilities.get(agentId));
    }

    public boolean allowsMessageType(MessageType type) {
        return allowedMessageTypes.contains(type);
    }

    public Set<MessageType> allowedMessageTypes() {
        return allowedMessageTypes;
    }
}
