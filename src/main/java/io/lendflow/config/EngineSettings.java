package io.lendflow.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.lendflow.error.ConfigurationException;
import io.lendflow.observability.AuditPolicy;
import io.lendflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tunables read from {@code lendflow-settings.json}. Absent keys keep their defaults;
 * a missing file yields {@link #defaults()}.
 */
public record EngineSettings(
        int agentPoolSize,
        int defaultStepTimeoutSeconds,
        int defaultMaxRetries,
        String orchestratorAgentId,
        int auditRetentionDays,
        boolean auditLogAllEvents,
        Set<String> auditSensitiveEvents
) {
    public static final int DEFAULT_AGENT_POOL_SIZE = 4;
    public static final int DEFAULT_STEP_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_MAX_RETRIES = 1;
    public static final String DEFAULT_ORCHESTRATOR_AGENT_ID = "orchestrator";

    public EngineSettings {
        if (agentPoolSize <= 0) {
            throw new ConfigurationException("agent_pool_size must be positive");
        }
        if (defaultStepTimeoutSeconds <= 0) {
            throw new ConfigurationException("default_step_timeout_seconds must be positive");
        }
        if (defaultMaxRetries < 0) {
            throw new ConfigurationException("default_max_retries must be >= 0");
        }
        if (orchestratorAgentId == null || orchestratorAgentId.isBlank()) {
            throw new ConfigurationException("orchestrator_agent_id must not be blank");
        }
        if (auditRetentionDays <= 0) {
            throw new ConfigurationException("audit.retention_days must be positive");
        }
        auditSensitiveEvents = auditSensitiveEvents == null ? Set.of() : Set.copyOf(auditSensitiveEvents);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_AGENT_POOL_SIZE,
                DEFAULT_STEP_TIMEOUT_SECONDS,
                DEFAULT_MAX_RETRIES,
                DEFAULT_ORCHESTRATOR_AGENT_ID,
                AuditPolicy.DEFAULT_RETENTION_DAYS,
                true,
                AuditPolicy.DEFAULT_SENSITIVE_EVENTS
        );
    }

    public static EngineSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            return fromJson(Jsons.mapper().readTree(file.toFile()));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read settings file: " + file, e);
        }
    }

    public static EngineSettings fromJson(JsonNode root) {
        EngineSettings d = defaults();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return d;
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Settings document must be a JSON object");
        }
        JsonNode audit = root.path("audit");
        Set<String> sensitive = new LinkedHashSet<>(d.auditSensitiveEvents());
        if (audit.path("sensitive_events").isArray()) {
            sensitive.clear();
            for (JsonNode e : audit.path("sensitive_events")) {
                sensitive.add(e.asText());
            }
        }
        return new EngineSettings(
                root.path("agent_pool_size").asInt(d.agentPoolSize()),
                root.path("default_step_timeout_seconds").asInt(d.defaultStepTimeoutSeconds()),
                root.path("default_max_retries").asInt(d.defaultMaxRetries()),
                root.path("orchestrator_agent_id").asText(d.orchestratorAgentId()),
                audit.path("retention_days").asInt(d.auditRetentionDays()),
                audit.path("log_all_events").asBoolean(d.auditLogAllEvents()),
                sensitive
        );
    }

    public AuditPolicy auditPolicy() {
        return new AuditPolicy(auditLogAllEvents, auditSensitiveEvents, auditRetentionDays);
    }
}
