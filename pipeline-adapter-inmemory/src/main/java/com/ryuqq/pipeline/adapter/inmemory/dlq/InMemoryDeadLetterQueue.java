package com.ryuqq.pipeline.adapter.inmemory.dlq;

import com.ryuqq.pipeline.core.spi.DeadLetterEntry;
import com.ryuqq.pipeline.core.spi.DeadLetterQueue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link DeadLetterQueue}.
 *
 * <p>Thread-safe; entries pushed from concurrent spawner workers keep arrival order.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private final CopyOnWriteArrayList<DeadLetterEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void push(String taskType, Map<String, Object> payload, String error, Map<String, Object> context) {
        entries.add(new DeadLetterEntry(Instant.now(), taskType, payload, error, context));
    }

    @Override
    public List<DeadLetterEntry> readAll() {
        return List.copyOf(entries);
    }

    @Override
    public int count() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
