/**
 * Runner adapter package.
 *
 * <p>Provides the bounded-concurrency {@link com.ryuqq.pipeline.core.task.TaskSpawner}
 * implementation and the static task registry it resolves task types against.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.BoundedTaskSpawner} - Semaphore-capped fan-out with per-task timeouts</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.TaskRegistry} - Task type to factory mapping</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.SpawnerConfig} - Concurrency cap and default timeout</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.adapter.runner;
