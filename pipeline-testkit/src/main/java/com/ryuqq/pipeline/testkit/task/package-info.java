/**
 * Scripted task units for exercising {@link com.ryuqq.pipeline.core.task.TaskSpawner}
 * implementations and phase handlers without real network work.
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.testkit.task;
