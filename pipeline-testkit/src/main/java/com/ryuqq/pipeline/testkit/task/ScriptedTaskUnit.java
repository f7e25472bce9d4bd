package com.ryuqq.pipeline.testkit.task;

import com.ryuqq.pipeline.core.task.TaskFailure;
import com.ryuqq.pipeline.core.task.TaskResult;
import com.ryuqq.pipeline.core.task.TaskSuccess;
import com.ryuqq.pipeline.core.task.TaskUnit;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Task unit whose behavior is scripted by its payload.
 *
 * <p><strong>Payload keys:</strong></p>
 * <ul>
 *   <li>{@code sleep_ms} - milliseconds to sleep before answering</li>
 *   <li>{@code spin_ms} - milliseconds to busy-wait before answering, ignoring interrupts</li>
 *   <li>{@code throw} - exception message; throws {@link IllegalStateException}</li>
 *   <li>{@code fail} - error message; returns a {@link TaskFailure} of type "ScriptedFailure"</li>
 *   <li>{@code records_processed} - records reported on success (default 1)</li>
 *   <li>{@code data} - map returned as the success data (default: the payload echoed under "payload")</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ConcurrencyProbe probe = new ConcurrencyProbe();
 * TaskRegistry registry = TaskRegistry.builder()
 *     .register("scripted", () -&gt; new ScriptedTaskUnit(probe))
 *     .build();
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ScriptedTaskUnit implements TaskUnit {

    public static final String FAILURE_TYPE = "ScriptedFailure";

    private final ConcurrencyProbe probe;

    public ScriptedTaskUnit() {
        this(new ConcurrencyProbe());
    }

    public ScriptedTaskUnit(ConcurrencyProbe probe) {
        if (probe == null) {
            throw new IllegalArgumentException("probe cannot be null");
        }
        this.probe = probe;
    }

    @Override
    public TaskResult execute(Map<String, Object> payload) throws Exception {
        probe.enter();
        try {
            long sleepMs = longValue(payload.get("sleep_ms"), 0L);
            if (sleepMs > 0) {
                Thread.sleep(sleepMs);
            }
            long spinMs = longValue(payload.get("spin_ms"), 0L);
            if (spinMs > 0) {
                spin(spinMs);
            }
            Object throwMessage = payload.get("throw");
            if (throwMessage != null) {
                throw new IllegalStateException(throwMessage.toString());
            }
            Object failMessage = payload.get("fail");
            if (failMessage != null) {
                return TaskFailure.of(FAILURE_TYPE, failMessage.toString());
            }
            return TaskSuccess.of(longValue(payload.get("records_processed"), 1L), data(payload));
        } finally {
            probe.exit();
        }
    }

    private static void spin(long millis) {
        long deadline = System.nanoTime() + millis * 1_000_000L;
        while (System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
    }

    private static Map<String, Object> data(Map<String, Object> payload) {
        Object data = payload.get("data");
        if (data instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return copy;
        }
        Map<String, Object> echoed = new LinkedHashMap<>();
        echoed.put("payload", new LinkedHashMap<>(payload));
        return echoed;
    }

    private static long longValue(Object value, long defaultValue) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            return Long.parseLong(value.toString());
        }
        return defaultValue;
    }
}
