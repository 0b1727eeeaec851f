package io.lendflow.agent;

import io.lendflow.model.AgentMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Inbound queue of one agent. Messages are handed to {@link Agent#receiveMessage}
 * one at a time on a dedicated thread; a message id seen before is dropped.
 */
public final class AgentMailbox implements AutoCloseable {
    static final int DEFAULT_DEDUP_WINDOW = 10_000;
    private static final Logger log = LoggerFactory.getLogger(AgentMailbox.class);

    private final String agentId;
    private final Agent agent;
    private final ExecutorService consumer;
    private final Map<String, Boolean> seenMessageIds;
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();

    public AgentMailbox(String agentId, Agent agent) {
        this(agentId, agent, DEFAULT_DEDUP_WINDOW);
    }

    public AgentMailbox(String agentId, Agent agent, int dedupWindow) {
        this.agentId = agentId;
        this.agent = agent;
        this.consumer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mailbox-" + agentId);
            t.setDaemon(true);
            return t;
        });
        int window = Math.max(1, dedupWindow);
        this.seenMessageIds = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > window;
            }
        };
    }

    /**
     * Queues the message and returns without waiting for the agent. Returns false when
     * the id was already delivered or the mailbox is closed.
     */
    public boolean offer(AgentMessage message) {
        synchronized (seenMessageIds) {
            if (seenMessageIds.containsKey(message.messageId())) {
                duplicates.incrementAndGet();
                log.debug("Dropping duplicate message {} for agent {}", message.messageId(), agentId);
                return false;
            }
            seenMessageIds.put(message.messageId(), Boolean.TRUE);
        }
        try {
            consumer.execute(() -> dispatch(message));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Mailbox of agent {} is closed, message {} not delivered", agentId, message.messageId());
            return false;
        }
    }

    /**
     * Blocks until every message queued before this call has been handed to the agent.
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        Future<?> marker;
        try {
            marker = consumer.submit(() -> {
            });
        } catch (RejectedExecutionException e) {
            return consumer.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        try {
            marker.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Mailbox drain marker failed for agent " + agentId, e);
        }
    }

    public long processedCount() {
        return processed.get();
    }

    public long duplicateCount() {
        return duplicates.get();
    }

    private void dispatch(AgentMessage message) {
        try {
            agent.receiveMessage(message);
            processed.incrementAndGet();
        } catch (Exception e) {
            log.error("Agent {} failed to process message {} from {}", agentId, message.messageId(), message.sender(), e);
        }
    }

    @Override
    public void close() {
        consumer.shutdown();
        try {
            if (!consumer.awaitTermination(5, TimeUnit.SECONDS)) {
                consumer.shutdownNow();
            }
        } catch (InterruptedException e) {
            consumer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
