/**
 * Pipeline run state package.
 *
 * <p>This package holds the full mutable state of one pipeline run and the immutable
 * value types stored inside it.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.state.PipelineState} - Data buckets, counters and current phase</li>
 *   <li>{@link com.ryuqq.pipeline.core.state.QueueItem} - Pending URL work item</li>
 *   <li>{@link com.ryuqq.pipeline.core.state.ErrorRecord} - Append-only error entry</li>
 *   <li>{@link com.ryuqq.pipeline.core.state.PhaseHistoryEntry} - One recorded phase transition</li>
 *   <li>{@link com.ryuqq.pipeline.core.state.StateSummary} - Lightweight snapshot of counters</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>A URL is in at most one of crawl queue, visited set, blocked set</li>
 *   <li>Cumulative counters never decrease</li>
 *   <li>Every mutation bumps {@code updatedAt}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.core.state;
