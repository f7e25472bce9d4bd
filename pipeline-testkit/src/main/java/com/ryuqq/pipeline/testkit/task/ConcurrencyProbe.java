package com.ryuqq.pipeline.testkit.task;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks how many scripted tasks run at the same time.
 *
 * <p>Shared between all {@link ScriptedTaskUnit} instances of one test so the
 * observed peak can be compared against a spawner's concurrency cap.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ConcurrencyProbe {

    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final AtomicInteger invocations = new AtomicInteger();

    void enter() {
        invocations.incrementAndGet();
        int current = active.incrementAndGet();
        maxActive.accumulateAndGet(current, Math::max);
    }

    void exit() {
        active.decrementAndGet();
    }

    public int active() {
        return active.get();
    }

    public int maxActive() {
        return maxActive.get();
    }

    public int invocations() {
        return invocations.get();
    }
}
