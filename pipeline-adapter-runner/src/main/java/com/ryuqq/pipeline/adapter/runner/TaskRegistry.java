package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.task.TaskUnit;
import com.ryuqq.pipeline.core.task.UnknownTaskTypeException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 작업 유형 식별자 → 작업 단위 팩토리 레지스트리 (불변).
 *
 * <p>작업마다 새 {@link TaskUnit} 인스턴스를 생성하므로 구현체는 호출 간 상태를 공유하지 않아도 됩니다.
 * 등록되지 않은 유형 조회는 {@link UnknownTaskTypeException}입니다.</p>
 *
 * <pre>
 * TaskRegistry registry = TaskRegistry.builder()
 *     .register("discovery.site_mapper", SiteMapper::new)
 *     .register("extraction.html_parser", HtmlParser::new)
 *     .build();
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class TaskRegistry {

    private final Map<String, Supplier<? extends TaskUnit>> factories;

    private TaskRegistry(Map<String, Supplier<? extends TaskUnit>> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 등록 여부 확인.
     *
     * @param taskType 작업 유형
     * @return 등록되어 있으면 true
     */
    public boolean contains(String taskType) {
        return taskType != null && factories.containsKey(taskType);
    }

    /**
     * 작업 유형이 등록되어 있는지 검증.
     *
     * @param taskType 작업 유형
     * @throws UnknownTaskTypeException 등록되지 않은 유형인 경우
     */
    public void require(String taskType) {
        if (!contains(taskType)) {
            throw new UnknownTaskTypeException(taskType);
        }
    }

    /**
     * 새 작업 단위 생성.
     *
     * @param taskType 작업 유형
     * @return 새 작업 단위 인스턴스
     * @throws UnknownTaskTypeException 등록되지 않은 유형인 경우
     */
    public TaskUnit resolve(String taskType) {
        require(taskType);
        TaskUnit unit = factories.get(taskType).get();
        if (unit == null) {
            throw new IllegalStateException("Factory returned null for task type: " + taskType);
        }
        return unit;
    }

    public Set<String> types() {
        return factories.keySet();
    }

    /**
     * TaskRegistry 빌더.
     */
    public static final class Builder {

        private final Map<String, Supplier<? extends TaskUnit>> factories = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 작업 유형 등록.
         *
         * @param taskType 작업 유형 식별자
         * @param factory 작업 단위 팩토리
         * @return this
         * @throws IllegalArgumentException 인자가 비어있거나 이미 등록된 유형인 경우
         */
        public Builder register(String taskType, Supplier<? extends TaskUnit> factory) {
            if (taskType == null || taskType.isBlank()) {
                throw new IllegalArgumentException("taskType cannot be null or blank");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            if (factories.putIfAbsent(taskType, factory) != null) {
                throw new IllegalArgumentException("Task type already registered: " + taskType);
            }
            return this;
        }

        public TaskRegistry build() {
            return new TaskRegistry(factories);
        }
    }
}
