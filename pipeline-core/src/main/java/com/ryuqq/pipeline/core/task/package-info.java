/**
 * Task unit contract package.
 *
 * <p>Defines the uniform input/output contract of pipeline work units ("agents") and
 * the spawner that executes them under timeouts and a concurrency cap.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.task.TaskUnit} - Unit of work (payload in, result out)</li>
 *   <li>{@link com.ryuqq.pipeline.core.task.TaskResult} - Sealed result: success or failure</li>
 *   <li>{@link com.ryuqq.pipeline.core.task.TaskSpawner} - Resolves and executes task units</li>
 *   <li>{@link com.ryuqq.pipeline.core.task.BatchSummary} - Aggregate counts of a batch</li>
 * </ul>
 *
 * <h2>Error Propagation</h2>
 * <p>Timeouts and task faults become {@link com.ryuqq.pipeline.core.task.TaskFailure} values.
 * Only {@link com.ryuqq.pipeline.core.task.UnknownTaskTypeException} escapes a spawner.</p>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.core.task;
