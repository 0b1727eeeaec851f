package io.lendflow.agent;

import io.lendflow.error.DuplicateAgentException;
import io.lendflow.model.AgentMessage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class AgentRegistry implements AutoCloseable {
    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final Map<String, AgentMailbox> mailboxes = new ConcurrentHashMap<>();

    public void register(String agentId, Agent agent) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        if (agent == null) {
            throw new IllegalArgumentException("agent must not be null");
        }
        if (agents.putIfAbsent(agentId, agent) != null) {
            throw new DuplicateAgentException("Agent already registered: " + agentId);
        }
        mailboxes.put(agentId, new AgentMailbox(agentId, agent));
    }

    public Optional<Agent> findById(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    public boolean isRegistered(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    public Collection<String> listAgentIds() {
        return List.copyOf(agents.keySet());
    }

    public Optional<AgentMailbox> mailbox(String agentId) {
        return Optional.ofNullable(mailboxes.get(agentId));
    }

    /**
     * Hands the message to the recipient's mailbox; false when the recipient is unknown
     * or has already seen the id.
     */
    public boolean deliver(AgentMessage message) {
        AgentMailbox mailbox = mailboxes.get(message.recipient());
        return mailbox != null && mailbox.offer(message);
    }

    @Override
    public void close() {
        mailboxes.values().forEach(AgentMailbox::close);
    }
}
